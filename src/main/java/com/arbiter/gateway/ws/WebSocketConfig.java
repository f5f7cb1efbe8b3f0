package com.arbiter.gateway.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Mounts the wind tunnel stream as a WebSocket endpoint next to the NDJSON one.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final WindTunnelWebSocketHandler windTunnel;
    private final String windTunnelPath;
    private final String[] allowedOrigins;

    public WebSocketConfig(WindTunnelWebSocketHandler windTunnel,
                           @Value("${arbiter.ws.path:/ws/wind-tunnel}") String windTunnelPath,
                           @Value("${arbiter.ws.allowed-origins:*}") String[] allowedOrigins) {
        this.windTunnel = windTunnel;
        this.windTunnelPath = windTunnelPath;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        log.info("Wind tunnel WebSocket at {}", windTunnelPath);
        registry.addHandler(windTunnel, windTunnelPath).setAllowedOrigins(allowedOrigins);
    }
}
