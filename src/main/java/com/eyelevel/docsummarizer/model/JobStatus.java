package com.eyelevel.docsummarizer.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Defines the lifecycle states of a summarization job.
 * <p>
 * Allowed transitions: {@code PENDING -> RUNNING -> {COMPLETED, FAILED}}, plus
 * {@code PENDING -> CANCELLED} and {@code RUNNING -> CANCELLED}. No transition leaves a terminal state.
 */
public enum JobStatus {
    /**
     * The job has been created and is waiting to be started.
     */
    PENDING,
    /**
     * The pipeline is executing, either on a worker thread or on the caller's thread.
     */
    RUNNING,
    /**
     * Every stage succeeded and the final result is available.
     */
    COMPLETED,
    /**
     * A stage failed; the failing stage and its message are recorded on the job.
     */
    FAILED,
    /**
     * The job was cancelled by request before it reached another terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(final JobStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<JobStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
