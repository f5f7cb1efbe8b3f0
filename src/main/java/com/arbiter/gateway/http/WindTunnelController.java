package com.arbiter.gateway.http;

import com.arbiter.providers.ModelCatalog;
import com.arbiter.streaming.NdjsonEventWriter;
import com.arbiter.streaming.WindTunnelRequest;
import com.arbiter.streaming.WindTunnelResult;
import com.arbiter.streaming.WindTunnelService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@RestController
public class WindTunnelController {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final WindTunnelService service;
    private final ObjectMapper mapper;

    public WindTunnelController(WindTunnelService service, ObjectMapper mapper) {
        this.service = service;
        this.mapper = mapper;
    }

    @PostMapping("/v1/wind-tunnel/stream")
    public ResponseEntity<StreamingResponseBody> stream(@RequestBody WindTunnelRequest body) {
        validate(body);
        StreamingResponseBody stream = out -> service.stream(body, new NdjsonEventWriter(out, mapper));
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .header("Cache-Control", "no-cache, no-store, must-revalidate")
                .header("X-Accel-Buffering", "no")
                .body(stream);
    }

    @PostMapping("/v1/wind-tunnel/run")
    public WindTunnelResult run(@RequestBody WindTunnelRequest body) {
        validate(body);
        return service.run(body);
    }

    private static void validate(WindTunnelRequest body) {
        Requests.requireText(body.modelId(), "Model ID");
        Requests.requireText(body.prompt(), "Prompt");
        // unknown ids must fail before the stream is committed
        ModelCatalog.resolve(body.modelId());
    }
}
