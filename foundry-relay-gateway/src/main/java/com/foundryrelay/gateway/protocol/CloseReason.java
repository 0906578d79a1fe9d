package com.foundryrelay.gateway.protocol;

import java.nio.charset.StandardCharsets;

/**
 * WebSocket close-reason truncation.
 * <p>
 * A close frame carries at most 123 bytes of reason text.
 */
public final class CloseReason {

    private CloseReason() {
    }

    /** Maximum bytes allowed in a close-reason payload. */
    public static final int CLOSE_REASON_MAX_BYTES = 120;

    public static String truncate(String reason) {
        return truncate(reason, CLOSE_REASON_MAX_BYTES);
    }

    /**
     * Truncate a close-reason string so its UTF-8 form fits in
     * {@code maxBytes}. A trailing partial character is dropped.
     */
    public static String truncate(String reason, int maxBytes) {
        if (reason == null || reason.isEmpty()) {
            return "";
        }
        byte[] encoded = reason.getBytes(StandardCharsets.UTF_8);
        if (encoded.length <= maxBytes) {
            return reason;
        }
        int end = maxBytes;
        // back up to a UTF-8 lead byte
        while (end > 0 && (encoded[end] & 0xC0) == 0x80) {
            end--;
        }
        return new String(encoded, 0, end, StandardCharsets.UTF_8);
    }
}
