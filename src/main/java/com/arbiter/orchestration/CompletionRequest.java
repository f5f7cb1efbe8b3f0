package com.arbiter.orchestration;

import com.arbiter.shared.model.Message;

import java.util.List;

/**
 * Single-completion request. {@code modelId} may be {@code auto-router}; null
 * {@code maxTokens} or {@code timeoutMs} use the configured defaults.
 */
public record CompletionRequest(String modelId, List<Message> messages, Integer maxTokens, Long timeoutMs) {}
