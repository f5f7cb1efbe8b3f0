package com.arbiter.providers;

import com.arbiter.shared.model.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MiniMaxProviderTest {

    private SseServer server;

    @BeforeEach
    void start() throws Exception {
        server = new SseServer();
    }

    @AfterEach
    void stop() {
        server.close();
    }

    private ChatRequest request() {
        return new ChatRequest("MiniMax-Text-01", List.of(Message.user("hi")), 128, Duration.ofSeconds(5));
    }

    @Test
    void acceptsChoicesAndTopLevelDeltaShapes() {
        server.respond(200,
                "data: {\"choices\":[{\"delta\":{\"content\":\"one \"}}]}",
                "data: {\"delta\":{\"content\":\"two\"}}",
                "data: [DONE]");
        var provider = new MiniMaxProvider("k", "group-7", server.baseUrl());

        var result = provider.chat(request());

        assertEquals("one two", result.content());
        var captured = server.requests.get(0);
        assertEquals("/v1/text/chatcompletion_v2", captured.path());
        assertEquals("GroupId=group-7", captured.query());
    }

    @Test
    void requiresGroupId() {
        var provider = new MiniMaxProvider("k", " ", server.baseUrl());

        var ex = assertThrows(MissingCredentialException.class, () -> provider.chat(request()));
        assertTrue(ex.getMessage().contains("MINIMAX_GROUP_ID"));
        assertTrue(server.requests.isEmpty());
    }
}
