package com.arbiter.ranking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.regex.Pattern;

/**
 * Extracts {@code {"rankings": [...], "reasoning": "..."}} from free model output.
 * Anything short of a full permutation of 1..K becomes a neutral judgment.
 */
public class JudgmentParser {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static int neutralRank(int k) {
        return (int) Math.round(k / 2.0);
    }

    public static Judgment neutral(String judgeId, String judgeName, int k, String error) {
        return new Judgment(judgeId, judgeName, Collections.nCopies(k, neutralRank(k)), "", true, error);
    }

    public Judgment parse(String judgeId, String judgeName, String raw, int k) {
        var m = JSON_OBJECT.matcher(raw != null ? raw : "");
        if (!m.find()) return neutral(judgeId, judgeName, k, "No JSON found in response");

        try {
            var node = MAPPER.readTree(m.group());
            var rankings = node.path("rankings");
            if (!rankings.isArray() || rankings.size() != k) {
                return neutral(judgeId, judgeName, k, "Invalid rankings format");
            }
            var ranks = new ArrayList<Integer>(k);
            var seen = new HashSet<Integer>();
            for (var r : rankings) {
                if (!r.canConvertToInt() || !r.isIntegralNumber()) {
                    return neutral(judgeId, judgeName, k, "Invalid rankings format");
                }
                int rank = r.asInt();
                if (rank < 1 || rank > k || !seen.add(rank)) {
                    return neutral(judgeId, judgeName, k, "Rankings are not a permutation of 1.." + k);
                }
                ranks.add(rank);
            }
            var reasoning = node.path("reasoning");
            return new Judgment(judgeId, judgeName, ranks, reasoning.isTextual() ? reasoning.asText() : "", false, null);
        } catch (JsonProcessingException e) {
            return neutral(judgeId, judgeName, k, "Malformed JSON: " + e.getOriginalMessage());
        }
    }
}
