package com.arbiter.ranking;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RankAggregatorTest {

    private final RankAggregator aggregator = new RankAggregator();

    private final List<RankCandidate> candidates = List.of(
            new RankCandidate("m0", "Model Zero", "zero", false, null),
            new RankCandidate("m1", "Model One", "one", true, null),
            new RankCandidate("m2", "Model Two", "two", false, null));

    // label A -> original 2, B -> original 0, C -> original 1
    private final Anonymization anonymization = new Anonymization(List.of(
            new AnonymizedEntry("A", "two", 2),
            new AnonymizedEntry("B", "zero", 0),
            new AnonymizedEntry("C", "one", 1)));

    private static Judgment judge(String name, Integer... ranks) {
        return new Judgment(name, name, List.of(ranks), "because", false, null);
    }

    @Test
    void deanonymizesAndSortsByMeanRank() {
        var ranked = aggregator.aggregate(candidates, anonymization, List.of(
                judge("j1", 1, 2, 3),
                judge("j2", 1, 3, 2),
                judge("j3", 2, 1, 3)));

        // original 2 (label A): 1,1,2 -> 1.3 ; original 0 (B): 2,3,1 -> 2.0 ; original 1 (C): 3,2,3 -> 2.7
        assertEquals(List.of("Model Two", "Model Zero", "Model One"),
                ranked.stream().map(RankedEntry::modelName).toList());
        assertEquals(List.of(1.3, 2.0, 2.7), ranked.stream().map(RankedEntry::averageRank).toList());
        assertEquals(List.of(1, 2, 3), ranked.stream().map(RankedEntry::place).toList());
        assertEquals(2, ranked.get(0).originalIndex());
        assertTrue(ranked.get(2).isOriginal());
        assertEquals("one", ranked.get(2).content());
    }

    @Test
    void allFailedJudgesFallBackToRosterOrder() {
        var ranked = aggregator.aggregate(candidates, anonymization, List.of(
                JudgmentParser.neutral("j1", "j1", 3, "bad"),
                JudgmentParser.neutral("j2", "j2", 3, "bad")));

        assertEquals(List.of(0, 1, 2), ranked.stream().map(RankedEntry::originalIndex).toList());
        assertTrue(ranked.stream().allMatch(r -> r.averageRank() == 2.0));
    }

    @Test
    void tiesKeepRosterOrder() {
        // original 0 (B) and original 1 (C) both average 2.5
        var ranked = aggregator.aggregate(candidates, anonymization, List.of(
                judge("j1", 1, 2, 3),
                judge("j2", 1, 3, 2)));

        assertEquals(List.of(2, 0, 1), ranked.stream().map(RankedEntry::originalIndex).toList());
        assertEquals(2.5, ranked.get(1).averageRank());
        assertEquals(2.5, ranked.get(2).averageRank());
    }

    @Test
    void meansStayWithinBoundsAndNonDecreasing() {
        var ranked = aggregator.aggregate(candidates, anonymization, List.of(
                judge("j1", 3, 1, 2),
                judge("j2", 2, 1, 3),
                JudgmentParser.neutral("j3", "j3", 3, "x")));

        double previous = 0;
        for (var r : ranked) {
            assertTrue(r.averageRank() >= 1 && r.averageRank() <= 3);
            assertTrue(r.averageRank() >= previous);
            previous = r.averageRank();
        }
    }

    @Test
    void candidateCountMustMatchLabels() {
        assertThrows(IllegalArgumentException.class,
                () -> aggregator.aggregate(candidates.subList(0, 2), anonymization, List.of()));
    }
}
