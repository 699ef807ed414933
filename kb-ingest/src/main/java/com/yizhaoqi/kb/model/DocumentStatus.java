package com.yizhaoqi.kb.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Processing status of a knowledge document.
 *
 * <pre>
 * pending    -> processing   (orchestrator claims the document)
 * processing -> ready        (pipeline completed)
 * processing -> failed       (a step raised, or the run was cancelled)
 * ready      -> pending      (reprocess)
 * failed     -> pending      (reprocess)
 * pending    -> pending      (reprocess of a run whose message never arrived)
 * </pre>
 */
public enum DocumentStatus {

    PENDING,
    PROCESSING,
    READY,
    FAILED;

    public static final Set<DocumentStatus> REPROCESSABLE = EnumSet.of(PENDING, READY, FAILED);

    public boolean canTransitionTo(DocumentStatus target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> target == PROCESSING;
            case PROCESSING -> target == READY || target == FAILED;
            case READY, FAILED -> target == PENDING;
        };
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
