package com.arbiter.gateway.http;

import com.arbiter.observability.DoctorCommand;
import com.arbiter.orchestration.ChatOrchestrator;
import com.arbiter.orchestration.CompletionRequest;
import com.arbiter.orchestration.CompletionResponse;
import com.arbiter.orchestration.FanOutResponse;
import com.arbiter.providers.ModelCatalog;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class CompletionController {

    private final ChatOrchestrator orchestrator;
    private final DoctorCommand doctor;

    public CompletionController(ChatOrchestrator orchestrator, DoctorCommand doctor) {
        this.orchestrator = orchestrator;
        this.doctor = doctor;
    }

    @PostMapping("/v1/completions")
    public CompletionResponse complete(@RequestBody CompletionRequest body) {
        Requests.requireText(body.modelId(), "Model ID");
        Requests.requireNonEmpty(body.messages(), "Messages");
        return orchestrator.complete(body);
    }

    @PostMapping("/v1/fan-out")
    public FanOutResponse fanOut(@RequestBody FanOutRequest body) {
        return orchestrator.fanOut(Requests.requireNonEmpty(body.messages(), "Messages"));
    }

    @GetMapping("/v1/models")
    public List<ModelInfo> models() {
        return ModelCatalog.all().stream()
                .map(r -> new ModelInfo(r.modelId(), r.displayName(), r.adapter().id()))
                .toList();
    }

    @GetMapping(value = "/v1/doctor", produces = MediaType.TEXT_PLAIN_VALUE)
    public String doctor() {
        return doctor.run();
    }
}
