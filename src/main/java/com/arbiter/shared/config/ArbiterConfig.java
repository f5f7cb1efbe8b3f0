package com.arbiter.shared.config;

import java.util.Map;

public record ArbiterConfig(
    int serverPort,
    Map<String, String> apiKeys,
    Map<String, String> baseUrls,
    CompletionConfig completion,
    PeerReviewConfig peerReview,
    WindTunnelConfig windTunnel
) {
    public String apiKey(String name) {
        return apiKeys.getOrDefault(name, "");
    }

    public String baseUrl(String adapter, String fallback) {
        var url = baseUrls.get(adapter);
        return url != null && !url.isBlank() ? url : fallback;
    }
}
