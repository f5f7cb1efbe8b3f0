package com.arbiter.orchestration;

import com.arbiter.context.ContextTrimmer;
import com.arbiter.observability.CostCalculator;
import com.arbiter.providers.BackendDescriptor;
import com.arbiter.providers.CompletionGateway;
import com.arbiter.providers.ModelCatalog;
import com.arbiter.routing.QueryClassifier;
import com.arbiter.routing.RoutingDecision;
import com.arbiter.shared.model.Message;
import com.arbiter.shared.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

public class DefaultChatOrchestrator implements ChatOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatOrchestrator.class);

    private final CompletionGateway gateway;
    private final FanOutOrchestrator fanOut;
    private final ContextTrimmer trimmer;
    private final QueryClassifier classifier;
    private final List<BackendDescriptor> roster;

    public DefaultChatOrchestrator(CompletionGateway gateway, FanOutOrchestrator fanOut,
                                   ContextTrimmer trimmer, QueryClassifier classifier,
                                   List<BackendDescriptor> roster) {
        this.gateway = gateway;
        this.fanOut = fanOut;
        this.trimmer = trimmer;
        this.classifier = classifier;
        this.roster = List.copyOf(roster);
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        var trimmed = trimmer.trim(request.messages());
        var timeout = request.timeoutMs() != null ? Duration.ofMillis(request.timeoutMs()) : null;

        RoutingDecision decision = null;
        var modelId = request.modelId();
        if (ModelCatalog.AUTO_ROUTER.equals(modelId)) {
            decision = classifier.classify(lastUserMessage(request.messages()));
            modelId = decision.modelId();
            log.info("[Auto Router] Routing to: {}", decision.modelName());
        }

        var result = gateway.dispatch(modelId, trimmed.messages(), request.maxTokens(), timeout);
        if (decision != null) logDecision(lastUserMessage(request.messages()), decision, result.ttftMs());

        return new CompletionResponse(result.content(), modelId, ModelCatalog.displayName(modelId),
                CostCalculator.stats(modelId, result), trimmed.wasTrimmed(), decision);
    }

    @Override
    public FanOutResponse fanOut(List<Message> messages) {
        var trimmed = trimmer.trim(messages);
        return new FanOutResponse(fanOut.runAll(roster, trimmed.messages()), trimmed.wasTrimmed());
    }

    static String lastUserMessage(List<Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).role() == Role.USER) return messages.get(i).content();
        }
        return "";
    }

    private static void logDecision(String query, RoutingDecision decision, long ttftMs) {
        var shown = query.length() > 100 ? query.substring(0, 100) + "..." : query;
        log.info("Auto-router decision: query=\"{}\", score={}, signals=[{}], route={} -> {}, TTFT={}ms",
                shown, decision.score(),
                decision.signals().isEmpty() ? "none" : String.join(", ", decision.signals()),
                decision.routeLabel(), decision.modelName(), ttftMs);
    }
}
