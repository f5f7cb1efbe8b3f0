package com.arbiter.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores a prompt's complexity without calling a model. Any code marker vetoes
 * scoring and selects the code route with {@link #CODE_SCORE}.
 */
public class QueryClassifier {

    public static final int CODE_SCORE = -999;

    // matched case-sensitively against the raw query
    private static final List<String> CODE_MARKERS = List.of(
            "```", "function ", "def ", "const ", "import ", "class ", "export ",
            "async ", "await ", "return ", "if (", "for (", "while (");

    private static final List<String> DEEP_KEYWORDS = List.of(
            "analyze", "explain why", "compare", "contrast",
            "step by step", "in depth", "detailed", "comprehensive",
            "write an essay", "write a story", "draft", "compose");

    private static final List<String> EXPLANATORY_KEYWORDS = List.of(
            "why", "should i", "would", "could you explain",
            "pros and cons", "advantages", "disadvantages");

    private static final List<String> LOOKUP_STARTS = List.of(
            "what is", "who is", "when did", "define", "how many");

    private static final List<String> FAST_KEYWORDS = List.of(
            "capital of", "population of", "who won", "what year",
            "translate", "say in", "how do you say");

    public RoutingDecision classify(String query) {
        var raw = query != null ? query : "";
        var signals = new ArrayList<String>();

        for (var marker : CODE_MARKERS) {
            if (raw.contains(marker)) {
                signals.add("code: \"" + marker.trim() + "\"");
                return RouteTable.decide(Route.CODE, CODE_SCORE, signals);
            }
        }

        var lower = raw.toLowerCase(Locale.ROOT).trim();
        int words = wordCount(raw);
        int score = 0;

        if (words > 30) {
            score += 2;
            signals.add("long query (" + words + " words): +2");
        }
        for (var kw : DEEP_KEYWORDS) {
            if (lower.contains(kw)) {
                score += 2;
                signals.add("\"" + kw + "\": +2");
            }
        }
        for (var kw : EXPLANATORY_KEYWORDS) {
            if (lower.contains(kw)) {
                score += 1;
                signals.add("\"" + kw + "\": +1");
            }
        }
        if (words < 10) {
            score -= 2;
            signals.add("short query (" + words + " words): -2");
        }
        for (var start : LOOKUP_STARTS) {
            if (lower.startsWith(start)) {
                score -= 1;
                signals.add("starts with \"" + start + "\": -1");
                break;
            }
        }
        for (var kw : FAST_KEYWORDS) {
            if (lower.contains(kw)) {
                score -= 1;
                signals.add("\"" + kw + "\": -1");
            }
        }

        return RouteTable.decide(RouteTable.forScore(score), score, signals);
    }

    private static int wordCount(String query) {
        var trimmed = query.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
