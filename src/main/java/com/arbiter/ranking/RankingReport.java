package com.arbiter.ranking;

import java.util.List;

/**
 * Outcome of a peer-review round. {@code originalPlacement}, {@code originalModelId}
 * and {@code betterResponses} are only set in single mode; {@code chairmanSynthesis}
 * is null when synthesis failed.
 */
public record RankingReport(
    RankingMode mode,
    List<RankedEntry> results,
    Integer originalPlacement,
    String originalModelId,
    List<RankedEntry> betterResponses,
    String chairmanSynthesis,
    List<JudgmentSummary> judgments
) {}
