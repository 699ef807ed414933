package com.yizhaoqi.kb.entity;

/**
 * What one processing run did with its document.
 */
public record ProcessingResult(Long documentId, Outcome outcome, int chunkCount, String error) {

    public enum Outcome {
        READY,
        FAILED,
        SKIPPED
    }

    public static ProcessingResult ready(Long documentId, int chunkCount) {
        return new ProcessingResult(documentId, Outcome.READY, chunkCount, null);
    }

    public static ProcessingResult failed(Long documentId, String error) {
        return new ProcessingResult(documentId, Outcome.FAILED, 0, error);
    }

    public static ProcessingResult skipped(Long documentId, String reason) {
        return new ProcessingResult(documentId, Outcome.SKIPPED, 0, reason);
    }
}
