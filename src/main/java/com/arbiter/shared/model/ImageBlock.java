package com.arbiter.shared.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Base64 image attached to a user turn. Only vision-capable adapters send it.
 */
public record ImageBlock(String mediaType, String data) {

    private static final Pattern DATA_URL = Pattern.compile("^data:([^;]+);base64,(.+)$", Pattern.DOTALL);

    /** Parses {@code data:<media type>;base64,<data>}; anything else is empty. */
    public static Optional<ImageBlock> fromDataUrl(String dataUrl) {
        if (dataUrl == null) return Optional.empty();
        var m = DATA_URL.matcher(dataUrl);
        return m.matches() ? Optional.of(new ImageBlock(m.group(1), m.group(2))) : Optional.empty();
    }
}
