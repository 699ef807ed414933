package com.yizhaoqi.kb.entity;

/**
 * Why an extraction produced no content. {@code message} is what ends up in the document's error_message.
 */
public record ExtractionError(ExtractionFailureKind kind, String format, String message) {
}
