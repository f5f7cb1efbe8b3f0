package com.arbiter.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".arbiter", "config.yaml"
    );

    // api-keys entry -> environment variable that overrides it
    private static final Map<String, String> KEY_ENV = Map.of(
        "anthropic", "ANTHROPIC_API_KEY",
        "groq", "GROQ_API_KEY",
        "cerebras", "CEREBRAS_API_KEY",
        "deepseek", "DEEPSEEK_API_KEY",
        "minimax", "MINIMAX_API_KEY",
        "minimax-group-id", "MINIMAX_GROUP_ID",
        "openrouter", "OPENROUTER_API_KEY",
        "together", "TOGETHER_API_KEY"
    );

    public static ArbiterConfig load() {
        return load(DEFAULT_PATH, System::getenv);
    }

    public static ArbiterConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static ArbiterConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var keys = (Map<String, Object>) raw.getOrDefault("api-keys", Map.of());
        var urls = (Map<String, Object>) raw.getOrDefault("base-urls", Map.of());
        var completion = (Map<String, Object>) raw.getOrDefault("completion", Map.of());
        var peerReview = (Map<String, Object>) raw.getOrDefault("peer-review", Map.of());
        var windTunnel = (Map<String, Object>) raw.getOrDefault("wind-tunnel", Map.of());

        var apiKeys = new HashMap<String, String>();
        keys.forEach((k, v) -> apiKeys.put(k, String.valueOf(v)));
        KEY_ENV.forEach((key, var) -> {
            var val = env.apply(var);
            if (val != null && !val.isBlank()) apiKeys.put(key, val);
        });

        var baseUrls = new HashMap<String, String>();
        urls.forEach((k, v) -> baseUrls.put(k, String.valueOf(v)));

        var port = env.apply("ARBITER_PORT");
        return new ArbiterConfig(
            Integer.parseInt(port != null ? port : String.valueOf(server.getOrDefault("port", 8080))),
            Map.copyOf(apiKeys),
            Map.copyOf(baseUrls),
            parseCompletion(completion),
            parsePeerReview(peerReview),
            parseWindTunnel(windTunnel)
        );
    }

    private static CompletionConfig parseCompletion(Map<String, Object> completion) {
        var defaults = CompletionConfig.defaults();
        return new CompletionConfig(
            intValue(completion, "default-max-tokens", defaults.defaultMaxTokens()),
            Duration.ofSeconds(intValue(completion, "default-timeout", (int) defaults.defaultTimeout().toSeconds())),
            intValue(completion, "context-budget", defaults.contextBudget())
        );
    }

    private static PeerReviewConfig parsePeerReview(Map<String, Object> peerReview) {
        var defaults = PeerReviewConfig.defaults();
        var roster = peerReview.containsKey("roster")
                ? ((List<?>) peerReview.get("roster")).stream().map(String::valueOf).toList()
                : defaults.roster();
        return new PeerReviewConfig(
            roster,
            String.valueOf(peerReview.getOrDefault("chairman", defaults.chairman()))
        );
    }

    private static WindTunnelConfig parseWindTunnel(Map<String, Object> windTunnel) {
        var defaults = WindTunnelConfig.defaults();
        return new WindTunnelConfig(
            intValue(windTunnel, "max-tokens", defaults.maxTokens()),
            Duration.ofSeconds(intValue(windTunnel, "timeout", (int) defaults.timeout().toSeconds())),
            intValue(windTunnel, "assumed-response-tokens", defaults.assumedResponseTokens())
        );
    }

    private static int intValue(Map<String, Object> section, String key, int fallback) {
        return Integer.parseInt(String.valueOf(section.getOrDefault(key, fallback)));
    }
}
