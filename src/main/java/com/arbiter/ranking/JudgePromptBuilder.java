package com.arbiter.ranking;

import java.util.stream.Collectors;

public class JudgePromptBuilder {

    public String build(String question, Anonymization anonymization) {
        int k = anonymization.size();
        var labels = anonymization.entries().stream().map(AnonymizedEntry::label).collect(Collectors.joining(", "));
        var responses = anonymization.entries().stream()
                .map(e -> "Response " + e.label() + ": " + e.content())
                .collect(Collectors.joining("\n\n"));
        var example = new StringBuilder();
        for (int i = 1; i <= k; i++) {
            if (i > 1) example.append(',');
            example.append(i);
        }

        return """
                You are a judge evaluating AI responses. Below are %d anonymous responses (%s) to the question: "%s"

                %s

                Rank these responses from best (1) to worst (%d) based on accuracy and insight.
                Respond with ONLY a JSON object: {"rankings": [%s], "reasoning": "brief explanation"}

                The rankings array should contain %d numbers representing the rank position for responses %s in that order.\
                """.formatted(k, labels, question, responses, k, example, k, labels);
    }
}
