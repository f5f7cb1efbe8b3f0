package com.arbiter.context;

import com.arbiter.shared.model.Message;

import java.util.List;

/**
 * Character-length token estimate: one token per four characters, rounded up.
 * An approximation only; backends that report exact usage take precedence.
 */
public final class TokenEstimator {

    private static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static int estimate(Message message) {
        return estimate(message.content());
    }

    /** Estimates the whole conversation as one text, matching how adapters bill input. */
    public static int estimateInput(List<Message> messages) {
        int chars = 0;
        for (var m : messages) chars += m.content().length();
        return (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /** Sum of per-message estimates, used for budget checks. */
    public static int estimateTurns(List<Message> messages) {
        int total = 0;
        for (var m : messages) total += estimate(m);
        return total;
    }
}
