package com.arbiter.providers;

import com.arbiter.shared.model.Message;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic chat-completions streaming protocol: {@code choices[0].delta.content}
 * deltas, optional {@code usage} on the terminal chunk.
 */
public abstract class OpenAiCompatibleProvider extends StreamingProvider {

    protected OpenAiCompatibleProvider(String apiKey, String baseUrl) {
        super(apiKey, baseUrl);
    }

    protected String completionsPath() {
        return "/chat/completions";
    }

    @Override
    protected HttpRequest.Builder newRequest(String baseUrl, String apiKey) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + completionsPath()))
                .header("Authorization", "Bearer " + apiKey);
    }

    @Override
    protected Map<String, Object> requestBody(ChatRequest request) {
        var body = new LinkedHashMap<String, Object>();
        body.put("model", request.model());
        body.put("messages", request.messages().stream().map(Message::toWire).toList());
        body.put("max_tokens", request.maxTokens());
        body.put("stream", true);
        return body;
    }

    @Override
    protected StreamChunk decode(JsonNode event) {
        var choices = event.path("choices");
        var usage = event.path("usage");
        if (!choices.isArray() && !usage.isObject()) return null;
        return new StreamChunk(
                text(choices.path(0).path("delta").path("content")),
                intOrNull(usage, "prompt_tokens"),
                intOrNull(usage, "completion_tokens"));
    }
}
