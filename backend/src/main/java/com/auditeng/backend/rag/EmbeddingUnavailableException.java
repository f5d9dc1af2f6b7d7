package com.auditeng.backend.rag;

/**
 * The configured embedding provider could not embed a document. Nothing is stored for it.
 */
public class EmbeddingUnavailableException extends RuntimeException {

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
