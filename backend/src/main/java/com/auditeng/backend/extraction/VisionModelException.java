package com.auditeng.backend.extraction;

import java.util.Locale;

/**
 * Failure returned by the vision model provider.
 */
public class VisionModelException extends Exception {

    private final int statusCode;

    public VisionModelException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public VisionModelException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429 || isRateLimitMessage(getMessage());
    }

    /**
     * Recognises provider rate-limit errors by their message text.
     */
    public static boolean isRateLimitMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("rate limit") || lower.contains("429") || lower.contains("too many requests");
    }
}
