package com.arbiter.gateway.http;

import java.util.List;

public record AllRankRequest(String question, List<Candidate> candidates) {

    public record Candidate(String modelName, String content) {}
}
