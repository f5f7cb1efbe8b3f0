package com.arbiter.ranking;

import com.arbiter.observability.CostStats;

public record RankedEntry(
    int place,
    int originalIndex,
    String modelName,
    double averageRank,
    boolean isOriginal,
    String content,
    CostStats costStats
) {}
