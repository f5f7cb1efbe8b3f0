package com.arbiter.streaming;

public record WindTunnelResult(String content, String modelId, int inputTokens, int outputTokens, long latency, double cost) {}
