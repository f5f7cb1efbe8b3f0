package com.arbiter.observability;

import com.arbiter.providers.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer completionLatency(String adapter) {
        return Timer.builder("arbiter.completion.latency").tag("adapter", adapter).register(registry);
    }

    public Counter completionCalls(String adapter) {
        return Counter.builder("arbiter.completion.calls").tag("adapter", adapter).register(registry);
    }

    public Counter completionFailures(FailureKind kind) {
        return Counter.builder("arbiter.completion.failures").tag("kind", kind.name()).register(registry);
    }

    public Counter judgeFailures() {
        return Counter.builder("arbiter.judge.failures").register(registry);
    }
}
