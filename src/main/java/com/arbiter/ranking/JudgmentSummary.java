package com.arbiter.ranking;

public record JudgmentSummary(String modelName, String reasoning, boolean failed, String error) {

    public static JudgmentSummary of(Judgment j) {
        return new JudgmentSummary(j.judgeName(), j.reasoning(), j.failed(), j.error());
    }
}
