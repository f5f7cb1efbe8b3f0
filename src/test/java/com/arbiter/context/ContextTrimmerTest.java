package com.arbiter.context;

import com.arbiter.shared.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextTrimmerTest {

    // 40 chars -> 10 tokens
    private static Message turn(char c) {
        return Message.user(String.valueOf(c).repeat(40));
    }

    private final ContextTrimmer trimmer = new ContextTrimmer();

    @Test
    void underBudgetIsUnchanged() {
        var messages = List.of(turn('a'), turn('b'));
        var result = trimmer.trim(messages, 20);
        assertEquals(messages, result.messages());
        assertFalse(result.wasTrimmed());
    }

    @Test
    void dropsOldestUntilWithinBudget() {
        var messages = List.of(turn('a'), turn('b'), turn('c'));
        var result = trimmer.trim(messages, 25);
        assertEquals(List.of(turn('b'), turn('c')), result.messages());
        assertTrue(result.wasTrimmed());
    }

    @Test
    void keepsMostRecentEvenWhenItAloneExceedsBudget() {
        var huge = Message.user("x".repeat(1000));
        var result = trimmer.trim(List.of(turn('a'), huge), 5);
        assertEquals(List.of(huge), result.messages());
        assertTrue(result.wasTrimmed());
    }

    @Test
    void singleOversizedMessageIsNotTrimmed() {
        var huge = Message.user("x".repeat(1000));
        var result = trimmer.trim(List.of(huge), 5);
        assertEquals(1, result.messages().size());
        assertFalse(result.wasTrimmed());
    }

    @Test
    void trimmingIsIdempotent() {
        var once = trimmer.trim(List.of(turn('a'), turn('b'), turn('c'), turn('d')), 25);
        var twice = trimmer.trim(once.messages(), 25);
        assertEquals(once.messages(), twice.messages());
        assertFalse(twice.wasTrimmed());
    }

    @Test
    void usesConfiguredDefaultBudget() {
        var small = new ContextTrimmer(15);
        assertEquals(1, small.trim(List.of(turn('a'), turn('b'))).messages().size());
        assertEquals(8000, ContextTrimmer.DEFAULT_BUDGET);
    }

    @Test
    void rejectsEmptyConversationAndNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> trimmer.trim(List.of(), 10));
        assertThrows(IllegalArgumentException.class, () -> trimmer.trim(List.of(turn('a')), 0));
        assertThrows(IllegalArgumentException.class, () -> new ContextTrimmer(-1));
    }

    @Test
    void estimatesRoundUp() {
        assertEquals(0, TokenEstimator.estimate(""));
        assertEquals(1, TokenEstimator.estimate("a"));
        assertEquals(1, TokenEstimator.estimate("abcd"));
        assertEquals(2, TokenEstimator.estimate("abcde"));
    }
}
