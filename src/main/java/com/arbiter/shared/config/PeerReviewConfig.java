package com.arbiter.shared.config;

import java.util.List;

public record PeerReviewConfig(List<String> roster, String chairman) {

    public static final List<String> DEFAULT_ROSTER = List.of(
        "anthropic/claude-sonnet-4.5",
        "meta-llama/llama-3.3-70b-instruct:cerebras",
        "meta-llama/llama-4-maverick:groq",
        "deepseek/deepseek-chat",
        "minimax/minimax-m2",
        "moonshotai/kimi-k2",
        "qwen/qwen-2.5-72b-instruct",
        "z-ai/glm-4-32b"
    );

    public static PeerReviewConfig defaults() {
        return new PeerReviewConfig(DEFAULT_ROSTER, "anthropic/claude-sonnet-4.5");
    }
}
