package com.auditeng.backend.extractor;

import java.util.regex.Pattern;

/**
 * Validation and preparation of submitted image payloads.
 */
public final class ImageInputs {

    private static final Pattern DATA_URL = Pattern.compile("^data:image/(png|jpeg|jpg|gif|webp);base64,.+", Pattern.DOTALL);
    private static final Pattern RAW_BASE64 = Pattern.compile("^[A-Za-z0-9+/]+=*$");
    private static final int MIN_RAW_BASE64_LENGTH = 100;

    private ImageInputs() {
    }

    /**
     * Accepts http(s) URLs, image data URLs and raw base64 longer than 100 characters.
     */
    public static boolean isValid(String image) {
        if (image == null || image.isBlank()) {
            return false;
        }
        String trimmed = image.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return true;
        }
        if (trimmed.startsWith("data:")) {
            return DATA_URL.matcher(trimmed).matches();
        }
        return trimmed.length() > MIN_RAW_BASE64_LENGTH && RAW_BASE64.matcher(trimmed).matches();
    }

    /**
     * Returns the image in a form the vision model accepts. Raw base64 becomes a JPEG data URL.
     *
     * @throws IllegalArgumentException when the payload is not a supported image
     */
    public static String prepare(String image) {
        if (!isValid(image)) {
            throw new IllegalArgumentException("Invalid image input: expected an http(s) URL, an image data URL or base64");
        }
        String trimmed = image.trim();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://") || trimmed.startsWith("data:")) {
            return trimmed;
        }
        return "data:image/jpeg;base64," + trimmed;
    }
}
