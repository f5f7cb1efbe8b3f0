package com.arbiter.orchestration;

import com.arbiter.observability.CostCalculator;
import com.arbiter.providers.BackendDescriptor;
import com.arbiter.providers.CompletionGateway;
import com.arbiter.providers.FailureKind;
import com.arbiter.providers.ProviderException;
import com.arbiter.shared.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one request against every roster backend concurrently. Each slot settles
 * independently: a failing backend is recorded in its own entry and never
 * affects siblings. Nothing is retried.
 *
 * <p>Callers that abandon the outer request do not cancel in-flight siblings;
 * those run until they finish or hit their own deadline.
 */
public class FanOutOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FanOutOrchestrator.class);

    private final CompletionGateway gateway;
    private final ExecutorService executor;

    public FanOutOrchestrator(CompletionGateway gateway) {
        this(gateway, newDaemonPool());
    }

    public FanOutOrchestrator(CompletionGateway gateway, ExecutorService executor) {
        this.gateway = gateway;
        this.executor = executor;
    }

    public List<FanOutEntry> runAll(List<BackendDescriptor> roster, List<Message> messages) {
        return runAll(roster, messages, null, null);
    }

    /** Result has one entry per roster backend, in roster order. */
    public List<FanOutEntry> runAll(List<BackendDescriptor> roster, List<Message> messages,
                                    Integer maxTokens, Duration timeout) {
        // unknown ids are caller bugs: fail before anything is sent
        roster.forEach(b -> gateway.resolve(b.id()));

        log.info("Fan-out to {} backends", roster.size());
        var futures = new ArrayList<CompletableFuture<FanOutEntry>>(roster.size());
        for (var backend : roster) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> runOne(backend, messages, maxTokens, timeout), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        var entries = new ArrayList<FanOutEntry>(roster.size());
        for (var f : futures) entries.add(f.join());
        long ok = entries.stream().filter(FanOutEntry::succeeded).count();
        log.info("Fan-out settled: {}/{} succeeded", ok, entries.size());
        return List.copyOf(entries);
    }

    private FanOutEntry runOne(BackendDescriptor backend, List<Message> messages, Integer maxTokens, Duration timeout) {
        try {
            var result = gateway.dispatch(backend.id(), messages, maxTokens, timeout);
            return FanOutEntry.success(backend.id(), backend.displayName(), result,
                    CostCalculator.stats(backend.id(), result));
        } catch (ProviderException e) {
            log.warn("[{}] failed in fan-out ({}): {}", backend.id(), e.kind(), e.getMessage());
            return FanOutEntry.failure(backend.id(), backend.displayName(), e.getMessage(), e.kind());
        } catch (RuntimeException e) {
            log.warn("[{}] unexpected failure in fan-out", backend.id(), e);
            return FanOutEntry.failure(backend.id(), backend.displayName(), String.valueOf(e.getMessage()),
                    FailureKind.INTERNAL);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ExecutorService newDaemonPool() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "fan-out-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
