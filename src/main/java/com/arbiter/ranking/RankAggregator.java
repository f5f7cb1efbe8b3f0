package com.arbiter.ranking;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * De-anonymizes judgments and computes each candidate's mean rank. Failed judges
 * still count with their neutral rank. Ties keep roster order.
 */
public class RankAggregator {

    public List<RankedEntry> aggregate(List<RankCandidate> candidates, Anonymization anonymization,
                                       List<Judgment> judgments) {
        if (candidates.size() != anonymization.size()) {
            throw new IllegalArgumentException("Expected " + anonymization.size() + " candidates, got " + candidates.size());
        }

        var unsorted = new ArrayList<RankedEntry>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            int labelIndex = anonymization.labelIndexOf(i);
            double mean = candidates.size();
            if (!judgments.isEmpty()) {
                double sum = 0;
                for (var j : judgments) sum += j.rankings().get(labelIndex);
                mean = sum / judgments.size();
            }
            var c = candidates.get(i);
            unsorted.add(new RankedEntry(0, i, c.modelName(), Math.round(mean * 10) / 10.0,
                    c.isOriginal(), c.content(), c.costStats()));
        }

        // List.sort is stable
        unsorted.sort(Comparator.comparingDouble(RankedEntry::averageRank));

        var placed = new ArrayList<RankedEntry>(unsorted.size());
        for (int i = 0; i < unsorted.size(); i++) {
            var e = unsorted.get(i);
            placed.add(new RankedEntry(i + 1, e.originalIndex(), e.modelName(), e.averageRank(),
                    e.isOriginal(), e.content(), e.costStats()));
        }
        return List.copyOf(placed);
    }
}
