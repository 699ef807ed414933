package com.yizhaoqi.kb.exception;

import com.yizhaoqi.kb.entity.ExtractionFailureKind;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Raised by a single extraction strategy. The extractor turns it into a failed
 * {@link com.yizhaoqi.kb.entity.ExtractionOutcome}; it does not cross the pipeline boundary.
 */
@Getter
public class ExtractionException extends KnowledgeBaseException {

    private final ExtractionFailureKind kind;
    private final String format;

    public ExtractionException(ExtractionFailureKind kind, String format, String message) {
        super(message, HttpStatus.UNPROCESSABLE_ENTITY);
        this.kind = kind;
        this.format = format;
    }

    public ExtractionException(ExtractionFailureKind kind, String format, String message, Throwable cause) {
        super(message, HttpStatus.UNPROCESSABLE_ENTITY, cause);
        this.kind = kind;
        this.format = format;
    }
}
