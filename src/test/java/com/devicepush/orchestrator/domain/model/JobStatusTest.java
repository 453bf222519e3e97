package com.devicepush.orchestrator.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStatusTest {

    @Test
    void forwardPathIsAllowed() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.QUEUED));
        assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.SENT));
        assertTrue(JobStatus.SENT.canTransitionTo(JobStatus.ACKNOWLEDGED));
        assertTrue(JobStatus.SENT.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.SENT.canTransitionTo(JobStatus.FAILED));
    }

    @Test
    void cancellationOnlyFromNonTerminalStates() {
        for (JobStatus status : JobStatus.values()) {
            assertTrue(status.isTerminal() != status.canTransitionTo(JobStatus.CANCELLED), status::name);
        }
    }

    @Test
    void terminalStatesHaveNoOutgoingTransitions() {
        for (JobStatus from : JobStatus.values()) {
            if (!from.isTerminal()) {
                continue;
            }
            for (JobStatus to : JobStatus.values()) {
                assertFalse(from.canTransitionTo(to), from + " -> " + to);
            }
        }
    }

    @Test
    void cannotSkipOrGoBackwards() {
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.SENT));
        assertFalse(JobStatus.QUEUED.canTransitionTo(JobStatus.ACKNOWLEDGED));
        assertFalse(JobStatus.SENT.canTransitionTo(JobStatus.QUEUED));
        assertFalse(JobStatus.QUEUED.canTransitionTo(JobStatus.PENDING));
    }
}
