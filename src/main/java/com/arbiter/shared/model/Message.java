package com.arbiter.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One conversation turn. Order within a conversation is turn order. {@code images}
 * is empty except on wind tunnel turns for vision-capable backends.
 */
public record Message(
    Role role,
    String content,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ImageBlock> images
) {

    public Message {
        Objects.requireNonNull(role, "role");
        content = content != null ? content : "";
        images = images != null ? List.copyOf(images) : List.of();
    }

    public static Message user(String content) {
        return user(content, List.of());
    }

    public static Message user(String content, List<ImageBlock> images) {
        return new Message(Role.USER, content, images);
    }

    public static Message assistant(String content) {
        return new Message(Role.ASSISTANT, content, List.of());
    }

    public static Message system(String content) {
        return new Message(Role.SYSTEM, content, List.of());
    }

    /** Text-only wire form; images are sent by adapters that understand them. */
    public Map<String, Object> toWire() {
        return Map.of("role", role.wireName(), "content", content);
    }
}
