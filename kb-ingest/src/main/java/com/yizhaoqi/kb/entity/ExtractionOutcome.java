package com.yizhaoqi.kb.entity;

import java.util.Objects;

/**
 * Either the extracted content or the reason extraction failed, never both.
 */
public final class ExtractionOutcome {

    private final ExtractedContent content;
    private final ExtractionError error;

    private ExtractionOutcome(ExtractedContent content, ExtractionError error) {
        this.content = content;
        this.error = error;
    }

    public static ExtractionOutcome success(ExtractedContent content) {
        return new ExtractionOutcome(Objects.requireNonNull(content), null);
    }

    public static ExtractionOutcome failure(ExtractionError error) {
        return new ExtractionOutcome(null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return content != null;
    }

    public ExtractedContent getContent() {
        if (content == null) {
            throw new IllegalStateException("Extraction failed: " + error.message());
        }
        return content;
    }

    public ExtractionError getError() {
        if (error == null) {
            throw new IllegalStateException("Extraction succeeded");
        }
        return error;
    }
}
