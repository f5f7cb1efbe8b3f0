package com.arbiter.ranking;

import com.arbiter.providers.CompletionGateway;
import com.arbiter.shared.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Asks the chairman backend for one answer that cites the ranked entries. Runs with
 * twice the default timeout. Returns null on any failure; ranking never depends on it.
 */
public class ChairmanSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ChairmanSynthesizer.class);

    private final CompletionGateway gateway;
    private final String chairmanId;

    public ChairmanSynthesizer(CompletionGateway gateway, String chairmanId) {
        this.gateway = gateway;
        this.chairmanId = chairmanId;
    }

    public String synthesize(String question, List<RankedEntry> ranked, List<Judgment> judgments) {
        var prompt = buildPrompt(question, ranked, judgments);
        var timeout = gateway.defaults().defaultTimeout().multipliedBy(2);
        try {
            var result = gateway.dispatch(chairmanId, List.of(Message.user(prompt)), null, timeout);
            log.info("Chairman synthesis by {} done in {}ms", chairmanId, result.totalMs());
            return result.content();
        } catch (RuntimeException e) {
            log.warn("Chairman synthesis failed, continuing without it: {}", e.getMessage());
            return null;
        }
    }

    String buildPrompt(String question, List<RankedEntry> ranked, List<Judgment> judgments) {
        var responses = ranked.stream()
                .map(r -> r.place() + ". " + r.modelName() + " (avg rank: " + r.averageRank() + "): " + r.content())
                .collect(Collectors.joining("\n\n"));
        var critiques = judgments.stream()
                .filter(j -> !j.failed())
                .map(j -> j.judgeName() + ": " + j.reasoning())
                .collect(Collectors.joining("\n"));
        var exampleCitation = ranked.isEmpty() ? "Model Name" : ranked.get(0).modelName();

        return """
                You are the Chairman synthesizing a council's collective wisdom.

                Original question: %s

                Here are %d AI responses ranked by democratic peer review (lowest average rank = best):
                %s

                Peer critiques from the judges:
                %s

                Create a final synthesized answer that:
                - Incorporates the best insights from top-ranked responses
                - Cites which model contributed each key point using brackets: [Model Name]
                - Is better than any single response

                Format: Natural flowing answer with inline citations like [%s].\
                """.formatted(question, ranked.size(), responses, critiques, exampleCitation);
    }
}
