package com.arbiter.gateway.ws;

import com.arbiter.providers.UnknownModelException;
import com.arbiter.streaming.ErrorEvent;
import com.arbiter.streaming.StreamEvent;
import com.arbiter.streaming.WindTunnelRequest;
import com.arbiter.streaming.WindTunnelService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Client sends {@code {modelId, prompt, files?}}; the server pushes the stream events
 * as text frames and closes after the terminal one.
 */
@Component
public class WindTunnelWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WindTunnelWebSocketHandler.class);

    private final WindTunnelService service;
    private final ObjectMapper mapper;

    public WindTunnelWebSocketHandler(WindTunnelService service, ObjectMapper mapper) {
        this.service = service;
        this.mapper = mapper;
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        WindTunnelRequest request;
        try {
            request = mapper.readValue(message.getPayload(), WindTunnelRequest.class);
        } catch (JsonProcessingException e) {
            send(session, new ErrorEvent("Malformed request: " + e.getOriginalMessage()));
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        if (request.modelId() == null || request.prompt() == null || request.prompt().isBlank()) {
            send(session, new ErrorEvent("Model ID and prompt are required"));
            session.close(CloseStatus.BAD_DATA);
            return;
        }

        try {
            service.stream(request, event -> send(session, event));
        } catch (UnknownModelException e) {
            send(session, new ErrorEvent(e.getMessage()));
        } catch (UncheckedIOException e) {
            log.warn("WebSocket {} closed mid-stream: {}", session.getId(), e.getMessage());
            session.close(CloseStatus.SERVER_ERROR);
            return;
        }
        session.close(CloseStatus.NORMAL);
    }

    private void send(WebSocketSession session, StreamEvent event) {
        try {
            session.sendMessage(new TextMessage(mapper.writeValueAsString(event)));
        } catch (IOException e) {
            log.warn("WebSocket {} dropped while sending {}", session.getId(), event.type());
            throw new UncheckedIOException(e);
        }
    }
}
