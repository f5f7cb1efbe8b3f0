package com.arbiter.ranking;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shuffles a result set and hands out labels from a fixed alphabet. Inject a
 * seeded {@link Random} for reproducible assignments.
 */
public class Anonymizer {

    public static final List<String> LABELS = List.of("A", "B", "C", "D", "E", "F", "G", "H");

    private final Random random;

    public Anonymizer() {
        this(new SecureRandom());
    }

    public Anonymizer(Random random) {
        this.random = random;
    }

    public Anonymization anonymize(List<String> contents) {
        if (contents.isEmpty() || contents.size() > LABELS.size()) {
            throw new IllegalArgumentException("Can anonymize 1.." + LABELS.size() + " entries, got " + contents.size());
        }
        var order = new ArrayList<Integer>(contents.size());
        for (int i = 0; i < contents.size(); i++) order.add(i);
        Collections.shuffle(order, random);

        var entries = new ArrayList<AnonymizedEntry>(order.size());
        for (int i = 0; i < order.size(); i++) {
            int original = order.get(i);
            entries.add(new AnonymizedEntry(LABELS.get(i), contents.get(original), original));
        }
        return new Anonymization(entries);
    }
}
