package com.arbiter.gateway.http;

import com.arbiter.ranking.PeerReviewEngine;
import com.arbiter.ranking.RankCandidate;
import com.arbiter.ranking.RankingReport;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class RankingController {

    private final PeerReviewEngine engine;

    public RankingController(PeerReviewEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/v1/rank/single")
    public RankingReport single(@RequestBody SingleRankRequest body) {
        Requests.requireText(body.question(), "Question");
        Requests.requireText(body.originalModel(), "Original model");
        return engine.evaluateSingle(body.question(), body.history() != null ? body.history() : List.of(),
                body.originalModel());
    }

    @PostMapping("/v1/rank/all")
    public RankingReport all(@RequestBody AllRankRequest body) {
        Requests.requireText(body.question(), "Question");
        var candidates = Requests.requireNonEmpty(body.candidates(), "Candidates").stream()
                .map(c -> new RankCandidate(c.modelName(), c.content()))
                .toList();
        return engine.evaluateAll(body.question(), candidates);
    }
}
