package dev.leadtracker.model;

import lombok.Getter;

/**
 * Thrown when a status change is not part of the job lifecycle graph.
 */
@Getter
public class InvalidTransitionException extends IllegalStateException {

    private final transient JobStatus from;
    private final transient JobStatus to;

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(String.format("Job %s cannot move from %s to %s", jobId, from.getValue(), to.getValue()));
        this.from = from;
        this.to = to;
    }
}
