package com.arbiter.gateway;

import com.arbiter.context.ContextTrimmer;
import com.arbiter.observability.DoctorCommand;
import com.arbiter.observability.MetricsConfig;
import com.arbiter.orchestration.ChatOrchestrator;
import com.arbiter.orchestration.DefaultChatOrchestrator;
import com.arbiter.orchestration.FanOutOrchestrator;
import com.arbiter.providers.AdapterKind;
import com.arbiter.providers.BackendDescriptor;
import com.arbiter.providers.CompletionGateway;
import com.arbiter.providers.ProviderFactory;
import com.arbiter.providers.StreamingProvider;
import com.arbiter.ranking.Anonymizer;
import com.arbiter.ranking.ChairmanSynthesizer;
import com.arbiter.ranking.PeerReviewEngine;
import com.arbiter.routing.QueryClassifier;
import com.arbiter.shared.config.ArbiterConfig;
import com.arbiter.streaming.WindTunnelService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
public class ArbiterWiring {

    private static final Logger log = LoggerFactory.getLogger(ArbiterWiring.class);

    private final ArbiterConfig config;
    private final Map<AdapterKind, StreamingProvider> providers;
    private final List<BackendDescriptor> roster;

    public ArbiterWiring(ObjectProvider<ArbiterConfig> registered) {
        this.config = ArbiterApp.configOrLoad(registered.getIfAvailable());
        this.providers = ProviderFactory.createAll(config);
        providers.forEach((kind, p) -> {
            if (!p.hasCredentials()) log.warn("{} credentials not configured, its models will fail on use", kind.id());
        });
        this.roster = config.peerReview().roster().stream().map(BackendDescriptor::of).toList();
    }

    @Bean
    public MetricsConfig metricsConfig() {
        return new MetricsConfig();
    }

    @Bean
    public CompletionGateway completionGateway(MetricsConfig metrics) {
        var gateway = new CompletionGateway(config.completion(), metrics);
        providers.forEach(gateway::register);
        return gateway;
    }

    @Bean(destroyMethod = "close")
    public FanOutOrchestrator fanOutOrchestrator(CompletionGateway gateway) {
        return new FanOutOrchestrator(gateway);
    }

    @Bean
    public ContextTrimmer contextTrimmer() {
        return new ContextTrimmer(config.completion().contextBudget());
    }

    @Bean
    public ChatOrchestrator chatOrchestrator(CompletionGateway gateway, FanOutOrchestrator fanOut,
                                             ContextTrimmer trimmer) {
        return new DefaultChatOrchestrator(gateway, fanOut, trimmer, new QueryClassifier(), roster);
    }

    @Bean
    public PeerReviewEngine peerReviewEngine(CompletionGateway gateway, FanOutOrchestrator fanOut,
                                             ContextTrimmer trimmer, MetricsConfig metrics) {
        var chairman = new ChairmanSynthesizer(gateway, config.peerReview().chairman());
        return new PeerReviewEngine(fanOut, roster, trimmer, new Anonymizer(), chairman, metrics);
    }

    @Bean
    public WindTunnelService windTunnelService(CompletionGateway gateway) {
        return new WindTunnelService(gateway, config.windTunnel());
    }

    @Bean
    public DoctorCommand doctorCommand() {
        var byName = new LinkedHashMap<String, StreamingProvider>();
        providers.forEach((kind, p) -> byName.put(kind.id(), p));
        return new DoctorCommand(byName);
    }
}
