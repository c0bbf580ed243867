package dev.leadtracker.store;

import dev.leadtracker.model.Job;
import dev.leadtracker.model.JobQuestion;
import dev.leadtracker.model.JobStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable collection of one user's jobs.
 * <p>
 * Every mutation is write-through: when a method returns, the change is on disk.
 * Implementations: {@link dev.leadtracker.store.file.FileJobStore} (one JSON document
 * rewritten per change) and {@link dev.leadtracker.store.jdbc.JdbcJobStore}
 * (normalized tables, one statement per change).
 */
public interface JobStore {

    /**
     * Owner of every job in this store.
     */
    String username();

    /**
     * Create a job with a fresh id, status PENDING and dateFound now, and persist it.
     *
     * @throws DuplicateLinkException when the link is non-empty and already stored
     */
    Job add(NewJob newJob);

    Optional<Job> get(String id);

    default Job require(String id) {
        return get(id).orElseThrow(() -> new UnknownJobException(id));
    }

    /**
     * Whether a committed job already uses this link. Always false for a blank link.
     */
    boolean hasLink(String link);

    List<Job> findAll();

    int countByStatus(JobStatus status);

    int countTotal();

    default Map<JobStatus, Integer> countsByStatus() {
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, countByStatus(status));
        }
        return counts;
    }

    /**
     * Apply and persist a single-field change.
     *
     * @return the job as stored after the change
     * @throws UnknownJobException        when no job has this id
     * @throws dev.leadtracker.model.InvalidTransitionException for a status change outside the lifecycle
     */
    Job update(String id, JobUpdate update);

    default Job addQuestion(String id, String question) {
        List<JobQuestion> questions = new ArrayList<>(require(id).getQuestions());
        questions.add(JobQuestion.unanswered(question));
        return update(id, JobUpdate.questions(questions));
    }

    /**
     * Set the answer of the first question whose text matches. Unknown questions are ignored.
     */
    default Job answerQuestion(String id, String question, String answer) {
        Job job = require(id);
        List<JobQuestion> questions = new ArrayList<>(job.getQuestions());
        for (int i = 0; i < questions.size(); i++) {
            if (questions.get(i).question().equals(question)) {
                questions.set(i, questions.get(i).withAnswer(answer));
                return update(id, JobUpdate.questions(questions));
            }
        }
        return job;
    }

    default Job clearQuestions(String id) {
        return update(id, JobUpdate.questions(List.of()));
    }

    /**
     * Physically delete a job. Normal use discards instead.
     */
    void purge(String id);

    /**
     * Insert a complete job as-is, keeping its id, dateFound and status. Used by migration.
     *
     * @return false when the id or the link already exists and nothing was written
     */
    boolean importJob(Job job);
}
