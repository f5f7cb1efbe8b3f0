package com.arbiter.ranking;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JudgmentParserTest {

    private final JudgmentParser parser = new JudgmentParser();

    @Test
    void extractsJsonFromSurroundingProse() {
        var raw = "Here is my verdict:\n{\"rankings\": [2, 3, 1], \"reasoning\": \"C was most precise\"}\nThanks!";
        var j = parser.parse("groq", "Groq", raw, 3);
        assertFalse(j.failed());
        assertEquals(List.of(2, 3, 1), j.rankings());
        assertEquals("C was most precise", j.reasoning());
        assertNull(j.error());
    }

    @Test
    void missingReasoningIsEmpty() {
        var j = parser.parse("groq", "Groq", "{\"rankings\":[1,2]}", 2);
        assertFalse(j.failed());
        assertEquals("", j.reasoning());
    }

    @Test
    void wrongLengthIsNeutral() {
        var j = parser.parse("groq", "Groq", "{\"rankings\":[1,2],\"reasoning\":\"x\"}", 3);
        assertTrue(j.failed());
        assertEquals(List.of(2, 2, 2), j.rankings());
        assertEquals("", j.reasoning());
    }

    @Test
    void duplicateRanksAreNeutral() {
        var j = parser.parse("groq", "Groq", "{\"rankings\":[1,1,2,3]}", 4);
        assertTrue(j.failed());
        assertEquals(List.of(2, 2, 2, 2), j.rankings());
    }

    @Test
    void outOfRangeOrNonIntegerRanksAreNeutral() {
        assertTrue(parser.parse("g", "G", "{\"rankings\":[0,1,2]}", 3).failed());
        assertTrue(parser.parse("g", "G", "{\"rankings\":[1,2,4]}", 3).failed());
        assertTrue(parser.parse("g", "G", "{\"rankings\":[1.5,2,3]}", 3).failed());
        assertTrue(parser.parse("g", "G", "{\"rankings\":[\"1\",\"2\",\"3\"]}", 3).failed());
    }

    @Test
    void noJsonOrMalformedJsonIsNeutral() {
        var none = parser.parse("g", "G", "I refuse to rank these.", 8);
        assertTrue(none.failed());
        assertEquals("No JSON found in response", none.error());
        assertEquals(8, none.rankings().size());
        assertTrue(none.rankings().stream().allMatch(r -> r == 4));

        assertTrue(parser.parse("g", "G", "{rankings: [1,2]", 2).failed());
        assertTrue(parser.parse("g", "G", null, 2).failed());
    }

    @Test
    void neutralRankIsHalfRounded() {
        assertEquals(4, JudgmentParser.neutralRank(8));
        assertEquals(2, JudgmentParser.neutralRank(3));
        assertEquals(3, JudgmentParser.neutralRank(5));
        assertEquals(1, JudgmentParser.neutralRank(1));
    }
}
