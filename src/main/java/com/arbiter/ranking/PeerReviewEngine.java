package com.arbiter.ranking;

import com.arbiter.context.ContextTrimmer;
import com.arbiter.observability.MetricsConfig;
import com.arbiter.orchestration.FanOutEntry;
import com.arbiter.orchestration.FanOutOrchestrator;
import com.arbiter.providers.BackendDescriptor;
import com.arbiter.providers.ModelCatalog;
import com.arbiter.providers.ModelRoute;
import com.arbiter.shared.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Blind peer review. Every roster backend judges the anonymized set, its own answer
 * included, and the mean ranks decide placement.
 *
 * <ul>
 *   <li>single mode: one original answer; the whole roster is queried fresh and the
 *       original's placement is reported</li>
 *   <li>all mode: an already collected roster-sized result set is ranked as is</li>
 * </ul>
 */
public class PeerReviewEngine {

    private static final Logger log = LoggerFactory.getLogger(PeerReviewEngine.class);

    private final FanOutOrchestrator fanOut;
    private final List<BackendDescriptor> roster;
    private final ContextTrimmer trimmer;
    private final Anonymizer anonymizer;
    private final ChairmanSynthesizer chairman;
    private final MetricsConfig metrics;
    private final JudgePromptBuilder promptBuilder = new JudgePromptBuilder();
    private final JudgmentParser parser = new JudgmentParser();
    private final RankAggregator aggregator = new RankAggregator();

    public PeerReviewEngine(FanOutOrchestrator fanOut, List<BackendDescriptor> roster, ContextTrimmer trimmer,
                            Anonymizer anonymizer, ChairmanSynthesizer chairman, MetricsConfig metrics) {
        if (roster.size() > Anonymizer.LABELS.size()) {
            throw new IllegalArgumentException("Peer-review roster supports at most " + Anonymizer.LABELS.size() + " backends");
        }
        this.fanOut = fanOut;
        this.roster = List.copyOf(roster);
        this.trimmer = trimmer;
        this.anonymizer = anonymizer;
        this.chairman = chairman;
        this.metrics = metrics;
    }

    /**
     * @param originalModel logical id or display name of the model that produced the
     *                      answer under evaluation
     */
    public RankingReport evaluateSingle(String question, List<Message> history, String originalModel) {
        var conversation = new ArrayList<Message>(history);
        conversation.add(Message.user(question));
        var trimmed = trimmer.trim(conversation).messages();

        var originalName = ModelCatalog.findByIdOrDisplayName(originalModel)
                .map(ModelRoute::displayName)
                .orElse(originalModel);
        log.info("Single-mode review, original model: {}", originalName);

        var entries = fanOut.runAll(roster, trimmed);
        var candidates = new ArrayList<RankCandidate>(entries.size());
        for (FanOutEntry e : entries) {
            boolean isOriginal = e.modelName().equals(originalName) || e.backendId().equals(originalModel);
            candidates.add(new RankCandidate(e.backendId(), e.modelName(), e.displayContent(), isOriginal, e.costStats()));
        }

        var round = rank(question, candidates);
        Integer placement = null;
        var better = new ArrayList<RankedEntry>();
        for (var r : round.ranked()) {
            if (r.isOriginal()) {
                placement = r.place();
                break;
            }
            better.add(r);
        }
        if (placement == null) better.clear();

        return new RankingReport(RankingMode.SINGLE, round.ranked(), placement, originalName, List.copyOf(better),
                round.synthesis(), round.summaries());
    }

    public RankingReport evaluateAll(String question, List<RankCandidate> candidates) {
        if (candidates.size() != roster.size()) {
            throw new IllegalArgumentException("Expected " + roster.size() + " responses (one per roster backend), found "
                    + candidates.size());
        }
        var named = new ArrayList<RankCandidate>(candidates.size());
        for (var c : candidates) {
            named.add(new RankCandidate(c.modelId(), ModelCatalog.displayName(c.modelName()), c.content(),
                    false, c.costStats()));
        }
        var round = rank(question, named);
        return new RankingReport(RankingMode.ALL, round.ranked(), null, null, List.of(), round.synthesis(), round.summaries());
    }

    private Round rank(String question, List<RankCandidate> candidates) {
        int k = candidates.size();
        var anonymization = anonymizer.anonymize(candidates.stream().map(RankCandidate::content).toList());
        for (int i = 0; i < k; i++) {
            log.debug("{} is Response {}", candidates.get(i).modelName(), anonymization.labelOf(i));
        }
        var prompt = promptBuilder.build(question, anonymization);

        log.info("Starting peer review with {} judges over {} responses", roster.size(), k);
        var judged = fanOut.runAll(roster, List.of(Message.user(prompt)));
        var judgments = new ArrayList<Judgment>(judged.size());
        for (var j : judged) {
            Judgment judgment = j.succeeded()
                    ? parser.parse(j.backendId(), j.modelName(), j.result().content(), k)
                    : JudgmentParser.neutral(j.backendId(), j.modelName(), k, j.error());
            if (judgment.failed()) {
                metrics.judgeFailures().increment();
                log.warn("Judge {} degraded to neutral ranking: {}", j.modelName(), judgment.error());
            }
            judgments.add(judgment);
        }

        var ranked = aggregator.aggregate(candidates, anonymization, judgments);
        var synthesis = chairman.synthesize(question, ranked, judgments);
        return new Round(ranked, judgments, synthesis);
    }

    private record Round(List<RankedEntry> ranked, List<Judgment> judgments, String synthesis) {

        List<JudgmentSummary> summaries() {
            return judgments.stream().map(JudgmentSummary::of).toList();
        }
    }
}
