package dev.leadtracker.service;

import dev.leadtracker.model.InvalidTransitionException;
import dev.leadtracker.model.Job;
import dev.leadtracker.model.JobStatus;
import dev.leadtracker.store.JobStore;
import dev.leadtracker.store.JobUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Named status transitions over the job store. Nothing here fires automatically;
 * every move is an explicit caller action.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycle {

    private final JobStore jobStore;

    /**
     * Move a job to {@code target}. Moving to the current status is a no-op.
     *
     * @throws InvalidTransitionException when the lifecycle does not allow the move
     */
    public Job transition(String jobId, JobStatus target) {
        Job job = jobStore.update(jobId, JobUpdate.status(target));
        log.info("Job {} is now {}", jobId, job.getStatus().getValue());
        return job;
    }

    /** Pending to in progress. */
    public Job start(String jobId) {
        return transition(jobId, JobStatus.IN_PROGRESS);
    }

    /** In progress back to pending. */
    public Job pause(String jobId) {
        return requireThen(jobId, JobStatus.IN_PROGRESS, JobStatus.PENDING);
    }

    public Job apply(String jobId) {
        return transition(jobId, JobStatus.APPLIED);
    }

    /**
     * Reopen an applied job for more work.
     */
    public Job unapply(String jobId) {
        return requireThen(jobId, JobStatus.APPLIED, JobStatus.IN_PROGRESS);
    }

    public Job discard(String jobId) {
        return transition(jobId, JobStatus.DISCARDED);
    }

    /**
     * Bring a discarded job back as pending.
     */
    public Job restore(String jobId) {
        return requireThen(jobId, JobStatus.DISCARDED, JobStatus.PENDING);
    }

    private Job requireThen(String jobId, JobStatus expected, JobStatus target) {
        JobStatus current = jobStore.require(jobId).getStatus();
        if (current != expected) {
            throw new InvalidTransitionException(jobId, current, target);
        }
        return transition(jobId, target);
    }
}
