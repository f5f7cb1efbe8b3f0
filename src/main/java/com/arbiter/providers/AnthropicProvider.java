package com.arbiter.providers;

import com.arbiter.shared.model.ImageBlock;
import com.arbiter.shared.model.Message;
import com.arbiter.shared.model.Role;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Native Messages API stream. Usage is exact: input tokens arrive on
 * {@code message_start}, output tokens on {@code message_delta}.
 */
public class AnthropicProvider extends StreamingProvider {

    static final String API_VERSION = "2023-06-01";

    public AnthropicProvider(String apiKey) {
        this(apiKey, AdapterKind.ANTHROPIC.defaultBaseUrl());
    }

    public AnthropicProvider(String apiKey, String baseUrl) {
        super(apiKey, baseUrl);
    }

    @Override
    public String id() {
        return "anthropic";
    }

    @Override
    protected String credentialName() {
        return "ANTHROPIC_API_KEY";
    }

    @Override
    protected HttpRequest.Builder newRequest(String baseUrl, String apiKey) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/messages"))
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION);
    }

    @Override
    protected Map<String, Object> requestBody(ChatRequest request) {
        var system = new StringBuilder();
        var messages = new ArrayList<Map<String, Object>>();
        for (Message m : request.messages()) {
            if (m.role() == Role.SYSTEM) {
                if (system.length() > 0) system.append("\n\n");
                system.append(m.content());
            } else {
                messages.add(Map.of(
                        "role", m.role() == Role.ASSISTANT ? "assistant" : "user",
                        "content", m.images().isEmpty() ? m.content() : contentBlocks(m)));
            }
        }
        var body = new LinkedHashMap<String, Object>();
        body.put("model", request.model());
        body.put("max_tokens", request.maxTokens());
        if (system.length() > 0) body.put("system", system.toString());
        body.put("messages", List.copyOf(messages));
        body.put("stream", true);
        return body;
    }

    // images first, then the text
    private static List<Map<String, Object>> contentBlocks(Message m) {
        var blocks = new ArrayList<Map<String, Object>>();
        for (ImageBlock image : m.images()) {
            blocks.add(Map.of("type", "image", "source", Map.of(
                    "type", "base64",
                    "media_type", image.mediaType(),
                    "data", image.data())));
        }
        blocks.add(Map.of("type", "text", "text", m.content()));
        return blocks;
    }

    @Override
    protected StreamChunk decode(JsonNode event) {
        var typeNode = event.path("type");
        if (!typeNode.isTextual()) return null;
        var type = typeNode.asText();

        if ("content_block_delta".equals(type)) {
            return StreamChunk.text(text(event.path("delta").path("text")));
        }
        if ("message_start".equals(type)) {
            return new StreamChunk("", intOrNull(event.path("message").path("usage"), "input_tokens"), null);
        }
        if ("message_delta".equals(type)) {
            return new StreamChunk("", null, intOrNull(event.path("usage"), "output_tokens"));
        }
        if ("error".equals(type)) {
            var error = event.path("error");
            throw new BackendException(id(), 200,
                    error.path("type").asText("error") + ": " + error.path("message").asText(""));
        }
        return StreamChunk.EMPTY;
    }
}
