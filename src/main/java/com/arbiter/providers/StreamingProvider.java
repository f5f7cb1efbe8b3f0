package com.arbiter.providers;

import com.arbiter.context.TokenEstimator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Base for adapters that stream server-sent events over HTTP. Subclasses own the
 * request shape and the chunk format; this class owns the deadline, first-token
 * timing, accumulation and failure mapping.
 *
 * <p>The deadline is armed when the request is sent and disarmed when the stream
 * completes. When it fires the body subscription and the in-flight exchange are
 * cancelled and the call fails with {@link CompletionTimeoutException}.
 */
public abstract class StreamingProvider implements ModelProvider {

    private static final Logger log = LoggerFactory.getLogger(StreamingProvider.class);

    protected final ObjectMapper mapper = new ObjectMapper();
    private final String apiKey;
    private final String baseUrl;
    private final HttpClient httpClient;

    protected StreamingProvider(String apiKey, String baseUrl) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** Name of the credential reported when it is missing, e.g. {@code GROQ_API_KEY}. */
    protected abstract String credentialName();

    protected abstract HttpRequest.Builder newRequest(String baseUrl, String apiKey);

    protected abstract Map<String, Object> requestBody(ChatRequest request);

    /**
     * Decodes one {@code data:} payload. Returns null when the event does not have a
     * shape this backend is known to send.
     */
    protected abstract StreamChunk decode(JsonNode event);

    protected void checkCredentials() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new MissingCredentialException(id(), credentialName());
        }
    }

    public boolean hasCredentials() {
        try {
            checkCredentials();
            return true;
        } catch (MissingCredentialException e) {
            return false;
        }
    }

    @Override
    public CompletionResult chat(ChatRequest request) {
        return chatStream(request, event -> {});
    }

    @Override
    public CompletionResult chatStream(ChatRequest request, Consumer<ChatEvent> listener) {
        checkCredentials();
        log.info("[{}] Streaming call, model: {}", id(), request.model());

        byte[] body;
        try {
            body = mapper.writeValueAsBytes(requestBody(request));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode request for " + id(), e);
        }

        var httpReq = newRequest(baseUrl, apiKey)
                .header("Content-Type", "application/json")
                .timeout(request.timeout())
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        var stream = new SseStream(System.nanoTime(), listener);
        var inflight = httpClient.sendAsync(httpReq, info -> {
            stream.status(info.statusCode());
            return HttpResponse.BodySubscribers.fromLineSubscriber(stream);
        });
        inflight.whenComplete((resp, err) -> {
            if (err != null) stream.fail(err);
        });

        try {
            stream.done.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abort(stream, inflight);
            log.warn("[{}] No completion within {} ms, request aborted", id(), request.timeout().toMillis());
            throw new CompletionTimeoutException(id(), request.timeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(stream, inflight);
            throw new BackendException(id(), "interrupted", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause(), request);
        }
        return stream.finish(request);
    }

    private static void abort(SseStream stream, CompletableFuture<?> inflight) {
        stream.cancel();
        inflight.cancel(true);
    }

    private RuntimeException translate(Throwable failure, ChatRequest request) {
        var cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ProviderException) {
            log.warn("[{}] {}", id(), cause.getMessage());
            return (ProviderException) cause;
        }
        if (cause instanceof HttpTimeoutException) {
            log.warn("[{}] HTTP timeout: {}", id(), cause.getMessage());
            return new CompletionTimeoutException(id(), request.timeout());
        }
        if (cause instanceof IOException) {
            log.warn("[{}] I/O failure: {}", id(), cause.getMessage());
            return new BackendException(id(), String.valueOf(cause.getMessage()), cause);
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new BackendException(id(), String.valueOf(cause.getMessage()), cause);
    }

    protected static String text(JsonNode node) {
        return node.isTextual() ? node.asText() : "";
    }

    protected static Integer intOrNull(JsonNode parent, String field) {
        var n = parent.path(field);
        return n.isNumber() ? n.asInt() : null;
    }

    private final class SseStream implements Flow.Subscriber<String> {

        final CompletableFuture<Void> done = new CompletableFuture<>();

        private final long startNanos;
        private final Consumer<ChatEvent> listener;
        private final StringBuilder content = new StringBuilder();
        private final StringBuilder errorBody = new StringBuilder();
        private volatile int status;
        private volatile boolean cancelled;
        private volatile Flow.Subscription subscription;
        private boolean firstSeen;
        private long ttftMs;
        private Integer inputTokens;
        private Integer outputTokens;
        private int dataLines;
        private int recognized;
        private int malformed;

        SseStream(long startNanos, Consumer<ChatEvent> listener) {
            this.startNanos = startNanos;
            this.listener = listener;
        }

        void status(int code) {
            this.status = code;
        }

        @Override
        public void onSubscribe(Flow.Subscription s) {
            subscription = s;
            if (cancelled) {
                s.cancel();
            } else {
                s.request(Long.MAX_VALUE);
            }
        }

        @Override
        public void onNext(String line) {
            if (cancelled || done.isDone()) return;
            if (status / 100 != 2) {
                errorBody.append(line).append('\n');
                return;
            }
            try {
                accept(line);
            } catch (RuntimeException e) {
                fail(e);
                cancel();
            }
        }

        @Override
        public void onError(Throwable t) {
            fail(t);
        }

        @Override
        public void onComplete() {
            if (status / 100 != 2) {
                fail(new BackendException(id(), status, errorBody.toString().trim()));
            } else if (recognized == 0) {
                fail(new StreamProtocolException(id(), "No recognizable stream events ("
                        + dataLines + " data lines, " + malformed + " malformed)"));
            } else {
                done.complete(null);
            }
        }

        void fail(Throwable t) {
            done.completeExceptionally(t);
        }

        void cancel() {
            cancelled = true;
            var s = subscription;
            if (s != null) s.cancel();
        }

        private void accept(String raw) {
            var line = raw.trim();
            if (!line.startsWith("data:")) return;
            var data = line.substring(5).trim();
            if (data.isEmpty() || "[DONE]".equals(data)) return;
            dataLines++;

            JsonNode node;
            try {
                node = mapper.readTree(data);
            } catch (JsonProcessingException e) {
                malformed++;
                log.debug("[{}] Skipping malformed stream line: {}", id(), data);
                return;
            }
            var chunk = decode(node);
            if (chunk == null) return;
            recognized++;

            if (chunk.inputTokens() != null) inputTokens = chunk.inputTokens();
            if (chunk.outputTokens() != null) outputTokens = chunk.outputTokens();
            if (chunk.hasContent()) {
                long elapsed = elapsedMs();
                boolean first = !firstSeen;
                if (first) {
                    firstSeen = true;
                    ttftMs = elapsed;
                    log.info("[{}] TTFT: {}ms", id(), ttftMs);
                }
                content.append(chunk.delta());
                listener.accept(new ChatEvent(chunk.delta(), first, elapsed));
            }
        }

        CompletionResult finish(ChatRequest request) {
            long totalMs = elapsedMs();
            var text = content.toString();
            int in = inputTokens != null ? inputTokens : TokenEstimator.estimateInput(request.messages());
            int out = outputTokens != null ? outputTokens : TokenEstimator.estimate(text);
            double tps = CompletionResult.throughput(out, totalMs);
            log.info("[{}] Model: {}, TTFT: {}ms, Total: {}ms, tokens: {}/{}{}, throughput: {} tok/s",
                    id(), request.model(), ttftMs, totalMs, in, out,
                    inputTokens != null || outputTokens != null ? " (reported)" : " (estimated)", tps);
            return new CompletionResult(text, in, out, ttftMs, totalMs, tps);
        }

        private long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }
}
