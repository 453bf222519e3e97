package com.devicepush.orchestrator.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a configuration job.
 *
 * <pre>
 * PENDING -> QUEUED -> SENT -> { ACKNOWLEDGED | COMPLETED | FAILED }
 * any non-terminal state -> CANCELLED
 * </pre>
 * {@code FAILED} is also reachable before {@code SENT} when a job cannot be admitted or started.
 */
public enum JobStatus {
    PENDING,
    QUEUED,
    SENT,
    ACKNOWLEDGED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == ACKNOWLEDGED || this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<JobStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(QUEUED, FAILED, CANCELLED);
            case QUEUED -> EnumSet.of(SENT, FAILED, CANCELLED);
            case SENT -> EnumSet.of(ACKNOWLEDGED, COMPLETED, FAILED, CANCELLED);
            case ACKNOWLEDGED, COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
