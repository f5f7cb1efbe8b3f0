package com.arbiter.streaming;

import com.arbiter.observability.CostCalculator;
import com.arbiter.providers.AdapterKind;
import com.arbiter.providers.CompletionGateway;
import com.arbiter.providers.ModelRoute;
import com.arbiter.shared.config.WindTunnelConfig;
import com.arbiter.shared.model.ImageBlock;
import com.arbiter.shared.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Single-model path: one prompt, one backend, tokens pushed to the caller as they
 * arrive.
 */
public class WindTunnelService {

    private static final Logger log = LoggerFactory.getLogger(WindTunnelService.class);

    static final String NO_THINK = " /no_think";

    private final CompletionGateway gateway;
    private final WindTunnelConfig config;

    public WindTunnelService(CompletionGateway gateway, WindTunnelConfig config) {
        this.gateway = gateway;
        this.config = config;
    }

    /**
     * Streams one completion into {@code sink}. An unknown model id is rejected before
     * the stream opens; every later failure ends the stream with an error event.
     */
    public void stream(WindTunnelRequest request, StreamEventSink sink) {
        var route = gateway.resolve(request.modelId());
        var session = new StreamSession(sink, config.assumedResponseTokens());
        log.info("[Wind Tunnel] Streaming {}, files: {}", request.modelId(), request.files().size());

        try {
            var result = gateway.dispatchStream(request.modelId(), buildMessages(request, route),
                    config.maxTokens(), config.timeout(),
                    event -> {
                        if (event.firstToken()) {
                            log.info("[Wind Tunnel] {} first token after {}ms", request.modelId(), event.elapsedMs());
                        }
                        session.token(event.delta(), event.elapsedMs());
                    });
            double cost = CostCalculator.cost(request.modelId(), result.inputTokens(), result.outputTokens());
            session.complete(result.content(), result.inputTokens(), result.outputTokens(), result.totalMs(), cost);
            log.info("[Wind Tunnel] {} completed in {}ms, {} tokens", request.modelId(), result.totalMs(),
                    result.outputTokens());
        } catch (RuntimeException e) {
            if (session.isTerminated()) {
                // the sink itself broke; nothing more can be delivered
                log.warn("[Wind Tunnel] {} lost its caller: {}", request.modelId(), e.getMessage());
                throw e;
            }
            log.warn("[Wind Tunnel] {} failed: {}", request.modelId(), e.getMessage());
            session.fail(String.valueOf(e.getMessage()));
        }
    }

    public WindTunnelResult run(WindTunnelRequest request) {
        var route = gateway.resolve(request.modelId());
        long start = System.nanoTime();
        var result = gateway.dispatch(request.modelId(), buildMessages(request, route),
                config.maxTokens(), config.timeout());
        long latency = (System.nanoTime() - start) / 1_000_000;
        double cost = CostCalculator.cost(request.modelId(), result.inputTokens(), result.outputTokens());
        log.info("[Wind Tunnel] {} responded in {}ms, cost: ${}", request.modelId(), latency,
                String.format("%.6f", cost));
        return new WindTunnelResult(result.content(), request.modelId(), result.inputTokens(),
                result.outputTokens(), latency, cost);
    }

    List<Message> buildMessages(WindTunnelRequest request, ModelRoute route) {
        boolean vision = route.adapter() == AdapterKind.ANTHROPIC;
        var prompt = withAttachments(request.prompt(), request.files(), request.modelId(), vision);
        // Qwen3 answers into a reasoning field in thinking mode and leaves content empty
        if (route.nativeModel().toLowerCase(Locale.ROOT).contains("qwen3")) {
            prompt = prompt + NO_THINK;
        }
        var images = vision ? images(request.files(), request.modelId()) : List.<ImageBlock>of();
        return List.of(Message.user(prompt, images));
    }

    static List<ImageBlock> images(List<Attachment> files, String modelId) {
        var images = new ArrayList<ImageBlock>();
        for (var f : files) {
            if (!f.isImage()) continue;
            var image = ImageBlock.fromDataUrl(f.dataUrl());
            if (image.isPresent()) {
                images.add(image.get());
                log.info("[Wind Tunnel] Added image {} ({}) for {}", f.name(), image.get().mediaType(), modelId);
            } else {
                log.warn("[Wind Tunnel] Image {} has no base64 data URL, skipped", f.name());
            }
        }
        return images;
    }

    /** Inlines text files ahead of the prompt; non-vision models get a note about dropped images. */
    static String withAttachments(String prompt, List<Attachment> files, String modelId, boolean vision) {
        if (files.isEmpty()) return prompt;
        var textParts = new ArrayList<String>();
        int images = 0;
        for (var f : files) {
            if (f.isText()) {
                textParts.add("[File: " + f.name() + "]\n" + f.textContent() + "\n");
            } else if (f.isImage() && !vision) {
                images++;
            }
        }
        var enhanced = textParts.isEmpty() ? prompt : String.join("\n", textParts) + "\n" + prompt;
        if (images > 0) {
            log.warn("[Wind Tunnel] {} image attachment(s) ignored for {}", images, modelId);
            enhanced = "[Note: " + images + " image(s) were uploaded but this model does not support vision]\n\n" + enhanced;
        }
        return enhanced;
    }
}
