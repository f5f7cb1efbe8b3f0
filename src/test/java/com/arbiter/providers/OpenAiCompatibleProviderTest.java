package com.arbiter.providers;

import com.arbiter.shared.model.Message;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SseServer server;

    @BeforeEach
    void start() throws Exception {
        server = new SseServer();
    }

    @AfterEach
    void stop() {
        server.close();
    }

    private ChatRequest request(Duration timeout) {
        return new ChatRequest("llama-3.3-70b-versatile",
                List.of(Message.system("be brief"), Message.user("hello there")), 256, timeout);
    }

    @Test
    void accumulatesDeltasAndUsesReportedUsage() throws Exception {
        server.respond(200,
                "data: {\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}",
                "",
                "data: {\"choices\":[{\"delta\":{\"content\":\"Hello\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"content\":\", world\"}}]}",
                "data: {\"choices\":[],\"usage\":{\"prompt_tokens\":12,\"completion_tokens\":3}}",
                "data: [DONE]");
        var provider = new GroqProvider("test-key", server.baseUrl());
        var events = new ArrayList<ChatEvent>();

        var result = provider.chatStream(request(Duration.ofSeconds(5)), events::add);

        assertEquals("Hello, world", result.content());
        assertEquals(12, result.inputTokens());
        assertEquals(3, result.outputTokens());
        assertEquals(2, events.size());
        assertTrue(events.get(0).firstToken());
        assertFalse(events.get(1).firstToken());
        assertTrue(result.ttftMs() <= result.totalMs());

        var captured = server.requests.get(0);
        assertEquals("/v1/chat/completions", captured.path());
        assertEquals("Bearer test-key", captured.headers().getFirst("Authorization"));
        var body = MAPPER.readTree(captured.body());
        assertEquals("llama-3.3-70b-versatile", body.get("model").asText());
        assertTrue(body.get("stream").asBoolean());
        assertEquals(256, body.get("max_tokens").asInt());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
    }

    @Test
    void estimatesTokensWhenBackendReportsNoUsage() {
        server.respond(200,
                "data: {\"choices\":[{\"delta\":{\"content\":\"abcdefghi\"}}]}",
                "data: [DONE]");
        var provider = new TogetherProvider("k", server.baseUrl());

        var result = provider.chat(request(Duration.ofSeconds(5)));

        // "be brief" + "hello there" = 19 chars -> 5; "abcdefghi" = 9 chars -> 3
        assertEquals(5, result.inputTokens());
        assertEquals(3, result.outputTokens());
    }

    @Test
    void skipsMalformedLinesWhenOthersParse() {
        server.respond(200,
                "data: {not json",
                "event: ping",
                "data: {\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}",
                "data: [DONE]");
        var provider = new CerebrasProvider("k", server.baseUrl());

        assertEquals("ok", provider.chat(request(Duration.ofSeconds(5))).content());
    }

    @Test
    void unrecognizableStreamIsProtocolError() {
        server.respond(200,
                "data: {\"something\":\"else\"}",
                "data: {broken",
                "data: [DONE]");
        var provider = new GroqProvider("k", server.baseUrl());

        var ex = assertThrows(StreamProtocolException.class, () -> provider.chat(request(Duration.ofSeconds(5))));
        assertEquals(FailureKind.PROTOCOL, ex.kind());
        assertEquals("groq", ex.providerId());
    }

    @Test
    void errorStatusBecomesBackendException() {
        server.respond(401, "{\"error\":{\"message\":\"Invalid API Key\"}}");
        var provider = new GroqProvider("bad", server.baseUrl());

        var ex = assertThrows(BackendException.class, () -> provider.chat(request(Duration.ofSeconds(5))));
        assertEquals(401, ex.status());
        assertEquals(FailureKind.BACKEND, ex.kind());
        assertTrue(ex.getMessage().contains("Invalid API Key"));
    }

    @Test
    void missingKeyFailsBeforeAnyRequest() {
        var provider = new GroqProvider("", server.baseUrl());

        var ex = assertThrows(MissingCredentialException.class, () -> provider.chat(request(Duration.ofSeconds(5))));
        assertEquals(FailureKind.CONFIG, ex.kind());
        assertTrue(ex.getMessage().contains("GROQ_API_KEY"));
        assertTrue(server.requests.isEmpty());
        assertFalse(provider.hasCredentials());
    }

    @Test
    void slowHeadersTimeOutWithDistinctMessage() {
        server.delayBeforeHeaders(3000).respond(200, "data: {\"choices\":[{\"delta\":{\"content\":\"late\"}}]}");
        var provider = new GroqProvider("k", server.baseUrl());

        long start = System.nanoTime();
        var ex = assertThrows(CompletionTimeoutException.class,
                () -> provider.chat(request(Duration.ofMillis(300))));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(FailureKind.TIMEOUT, ex.kind());
        assertEquals(CompletionTimeoutException.USER_MESSAGE, ex.getMessage());
        assertTrue(elapsedMs < 2500, "call should be aborted at the deadline, took " + elapsedMs + "ms");
    }

    @Test
    void stalledStreamIsAbortedAtDeadline() {
        server.stallAfterFirstLine(3000).respond(200,
                "data: {\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}",
                "data: {\"choices\":[{\"delta\":{\"content\":\" never\"}}]}",
                "data: [DONE]");
        var provider = new DeepSeekProvider("k", server.baseUrl());
        var events = new ArrayList<ChatEvent>();

        long start = System.nanoTime();
        assertThrows(CompletionTimeoutException.class,
                () -> provider.chatStream(request(Duration.ofMillis(400)), events::add));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 2500, "took " + elapsedMs + "ms");
        assertTrue(events.size() <= 1);
    }

    @Test
    void openRouterSendsTitleHeader() {
        server.respond(200, "data: {\"choices\":[{\"delta\":{\"content\":\"hi\"}}]}", "data: [DONE]");
        var provider = new OpenRouterProvider("k", server.baseUrl());

        provider.chat(request(Duration.ofSeconds(5)));

        assertEquals("model-arbiter", server.requests.get(0).headers().getFirst("X-Title"));
    }
}
