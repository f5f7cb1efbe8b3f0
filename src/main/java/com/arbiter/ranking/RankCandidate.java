package com.arbiter.ranking;

import com.arbiter.observability.CostStats;

/**
 * One answer entering a ranking round, in roster order.
 */
public record RankCandidate(String modelId, String modelName, String content, boolean isOriginal, CostStats costStats) {

    public RankCandidate(String modelName, String content) {
        this(modelName, modelName, content, false, null);
    }
}
