package com.arbiter.gateway.http;

import com.arbiter.providers.FailureKind;
import com.arbiter.providers.ProviderException;
import com.arbiter.providers.UnknownModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownModelException.class)
    public ResponseEntity<Map<String, String>> unknownModel(UnknownModelException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage(), FailureKind.UNKNOWN_MODEL.name());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage(), "INVALID_REQUEST");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        return body(HttpStatus.BAD_REQUEST, "Malformed request body", "INVALID_REQUEST");
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, String>> provider(ProviderException e) {
        log.warn("Request failed at {} ({}): {}", e.providerId(), e.kind(), e.getMessage());
        var status = e.kind() == FailureKind.TIMEOUT ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        return body(status, e.getMessage(), e.kind().name());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String kind) {
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(error), "kind", kind));
    }
}
