package com.arbiter.orchestration;

import com.arbiter.shared.model.Message;

import java.util.List;

public interface ChatOrchestrator {
    CompletionResponse complete(CompletionRequest request);
    FanOutResponse fanOut(List<Message> messages);
}
