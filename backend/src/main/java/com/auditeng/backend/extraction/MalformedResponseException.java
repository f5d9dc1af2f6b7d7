package com.auditeng.backend.extraction;

/**
 * Thrown when a model response cannot be read as JSON at all.
 */
public class MalformedResponseException extends RuntimeException {

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
