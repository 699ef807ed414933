package com.yizhaoqi.kb.entity;

/**
 * Returned as soon as a processing run has been queued. {@code runId} identifies that run in logs
 * and in the processing message; it carries no meaning for the caller.
 */
public record IngestionHandle(Long documentId, String runId, DocumentResponse document) {
}
