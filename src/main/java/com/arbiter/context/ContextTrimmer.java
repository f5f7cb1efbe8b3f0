package com.arbiter.context;

import com.arbiter.shared.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a conversation under a token budget by dropping the oldest turns.
 * The most recent message is always kept, even when it alone exceeds the budget.
 */
public class ContextTrimmer {

    private static final Logger log = LoggerFactory.getLogger(ContextTrimmer.class);

    public static final int DEFAULT_BUDGET = 8000;

    private final int defaultBudget;

    public ContextTrimmer() {
        this(DEFAULT_BUDGET);
    }

    public ContextTrimmer(int defaultBudget) {
        if (defaultBudget <= 0) throw new IllegalArgumentException("budget must be positive: " + defaultBudget);
        this.defaultBudget = defaultBudget;
    }

    public TrimResult trim(List<Message> messages) {
        return trim(messages, defaultBudget);
    }

    public TrimResult trim(List<Message> messages, int maxTokens) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("conversation must contain at least one message");
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("budget must be positive: " + maxTokens);
        }

        int total = TokenEstimator.estimateTurns(messages);
        if (total <= maxTokens) {
            return new TrimResult(List.copyOf(messages), false);
        }

        var kept = new ArrayList<>(messages);
        int dropped = 0;
        while (total > maxTokens && kept.size() > 1) {
            total -= TokenEstimator.estimate(kept.remove(0));
            dropped++;
        }
        log.info("Trimmed {} oldest message(s), {} kept, ~{} tokens (budget {})",
                dropped, kept.size(), total, maxTokens);
        return new TrimResult(List.copyOf(kept), dropped > 0);
    }
}
