package com.arbiter.providers;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * MiniMax chatcompletion_v2. Needs a group id next to the key, and some
 * deployments put the delta at the top level instead of under {@code choices}.
 */
public class MiniMaxProvider extends OpenAiCompatibleProvider {

    private final String groupId;

    public MiniMaxProvider(String apiKey, String groupId) {
        this(apiKey, groupId, AdapterKind.MINIMAX.defaultBaseUrl());
    }

    public MiniMaxProvider(String apiKey, String groupId, String baseUrl) {
        super(apiKey, baseUrl);
        this.groupId = groupId;
    }

    @Override
    public String id() {
        return "minimax";
    }

    @Override
    protected String credentialName() {
        return "MINIMAX_API_KEY";
    }

    @Override
    protected void checkCredentials() {
        super.checkCredentials();
        if (groupId == null || groupId.isBlank()) {
            throw new MissingCredentialException(id(), "MINIMAX_GROUP_ID");
        }
    }

    @Override
    protected String completionsPath() {
        return "/text/chatcompletion_v2?GroupId=" + URLEncoder.encode(groupId, StandardCharsets.UTF_8);
    }

    @Override
    protected StreamChunk decode(JsonNode event) {
        var chunk = super.decode(event);
        var topLevel = event.path("delta");
        if (chunk == null) {
            return topLevel.isObject() ? StreamChunk.text(text(topLevel.path("content"))) : null;
        }
        if (!chunk.hasContent() && topLevel.isObject()) {
            return new StreamChunk(text(topLevel.path("content")), chunk.inputTokens(), chunk.outputTokens());
        }
        return chunk;
    }
}
