package com.yizhaoqi.kb.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base of every domain error raised by the ingestion and retrieval services. The status is the
 * transport code a caller should map the failure to.
 */
@Getter
public class KnowledgeBaseException extends RuntimeException {

    private final HttpStatus status;

    public KnowledgeBaseException(String message, HttpStatus status) {
        super(message);
        this.status = status;
    }

    public KnowledgeBaseException(String message, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
