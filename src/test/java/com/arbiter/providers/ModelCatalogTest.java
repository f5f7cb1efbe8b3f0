package com.arbiter.providers;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelCatalogTest {

    @Test
    void catalogCoversEveryAdapter() {
        assertEquals(17, ModelCatalog.all().size());
        for (var kind : AdapterKind.values()) {
            assertTrue(ModelCatalog.all().stream().anyMatch(r -> r.adapter() == kind), kind + " has no model");
        }
    }

    @Test
    void resolvesKnownIds() {
        var route = ModelCatalog.resolve("moonshotai/kimi-k2");
        assertEquals(AdapterKind.OPENROUTER, route.adapter());
        assertEquals("moonshotai/kimi-k2", route.nativeModel());
        assertEquals("Kimi K2 (Moonshot)", route.displayName());
    }

    @Test
    void autoRouterIsNotADispatchableModel() {
        assertThrows(UnknownModelException.class, () -> ModelCatalog.resolve(ModelCatalog.AUTO_ROUTER));
        assertThrows(UnknownModelException.class, () -> ModelCatalog.resolve(null));
    }

    @Test
    void displayNameFallsBackToId() {
        assertEquals("DeepSeek-V3", ModelCatalog.displayName("deepseek/deepseek-chat"));
        assertEquals("custom/model", ModelCatalog.displayName("custom/model"));
    }

    @Test
    void findsByIdOrDisplayName() {
        assertEquals("minimax/minimax-m2", ModelCatalog.findByIdOrDisplayName("MiniMax M2").orElseThrow().modelId());
        assertEquals("minimax/minimax-m2", ModelCatalog.findByIdOrDisplayName("minimax/minimax-m2").orElseThrow().modelId());
        assertTrue(ModelCatalog.findByIdOrDisplayName("Nobody").isEmpty());
    }
}
