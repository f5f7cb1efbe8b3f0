package com.arbiter.ranking;

import java.util.List;

/**
 * Label to roster-position bijection for one ranking round. Entries are in label
 * order (A, B, ...).
 */
public record Anonymization(List<AnonymizedEntry> entries) {

    public Anonymization {
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    /** Position in label order of the entry that came from {@code originalIndex}. */
    public int labelIndexOf(int originalIndex) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).originalIndex() == originalIndex) return i;
        }
        throw new IllegalArgumentException("No label for original index " + originalIndex);
    }

    public String labelOf(int originalIndex) {
        return entries.get(labelIndexOf(originalIndex)).label();
    }
}
