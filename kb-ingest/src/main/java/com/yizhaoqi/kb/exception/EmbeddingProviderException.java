package com.yizhaoqi.kb.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Failure talking to the embedding provider. Transient failures (rate limits, timeouts, 5xx) may be
 * retried; permanent ones (bad request, wrong vector dimension) may not.
 */
@Getter
public class EmbeddingProviderException extends KnowledgeBaseException {

    private final boolean transientFailure;

    private EmbeddingProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, transientFailure ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY, cause);
        this.transientFailure = transientFailure;
    }

    public static EmbeddingProviderException transientFailure(String message, Throwable cause) {
        return new EmbeddingProviderException(message, true, cause);
    }

    public static EmbeddingProviderException permanent(String message) {
        return new EmbeddingProviderException(message, false, null);
    }

    public static EmbeddingProviderException permanent(String message, Throwable cause) {
        return new EmbeddingProviderException(message, false, cause);
    }
}
