package com.arbiter.streaming;

import java.util.List;

public record WindTunnelRequest(String modelId, String prompt, List<Attachment> files) {

    public WindTunnelRequest {
        files = files != null ? List.copyOf(files) : List.of();
    }
}
