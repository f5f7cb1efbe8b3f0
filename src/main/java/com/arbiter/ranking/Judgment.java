package com.arbiter.ranking;

import java.util.List;

/**
 * One judge's ranks, indexed by label position. A failed judgment carries the
 * neutral rank for every label.
 */
public record Judgment(
    String judgeId,
    String judgeName,
    List<Integer> rankings,
    String reasoning,
    boolean failed,
    String error
) {
    public Judgment {
        rankings = List.copyOf(rankings);
    }
}
