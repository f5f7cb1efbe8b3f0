package com.arbiter.gateway;

import com.arbiter.shared.config.ArbiterConfig;
import com.arbiter.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.arbiter.gateway")
public class ArbiterApp {

    private static final Logger log = LoggerFactory.getLogger(ArbiterApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        var app = new SpringApplication(ArbiterApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.addInitializers(ctx -> ctx.getBeanFactory().registerSingleton("arbiterConfig", config));
        app.run(args);
        log.info("model-arbiter listening on port {}, peer-review roster: {} backends",
                config.serverPort(), config.peerReview().roster().size());
    }

    static ArbiterConfig configOrLoad(ArbiterConfig registered) {
        return registered != null ? registered : ConfigLoader.load();
    }
}
