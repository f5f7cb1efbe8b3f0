package com.arbiter.streaming;

/**
 * Uploaded file. {@code text} attachments carry {@code textContent}; {@code image}
 * attachments carry a base64 {@code dataUrl}.
 */
public record Attachment(String name, String type, String textContent, String dataUrl) {

    public boolean isText() {
        return "text".equals(type) && textContent != null;
    }

    public boolean isImage() {
        return "image".equals(type);
    }
}
