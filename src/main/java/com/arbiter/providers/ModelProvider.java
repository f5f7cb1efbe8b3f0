package com.arbiter.providers;

import java.util.function.Consumer;

public interface ModelProvider {
    String id();
    CompletionResult chat(ChatRequest request);
    CompletionResult chatStream(ChatRequest request, Consumer<ChatEvent> listener);
}
