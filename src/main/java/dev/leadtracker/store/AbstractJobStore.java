package dev.leadtracker.store;

import dev.leadtracker.model.InvalidTransitionException;
import dev.leadtracker.model.Job;
import dev.leadtracker.model.JobStatus;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Shared job semantics for both backends: id allocation, link uniqueness, lifecycle
 * checks, cover-letter invalidation and PDF path handling. Subclasses only move rows.
 */
@Slf4j
public abstract class AbstractJobStore implements JobStore {

    private final String username;
    protected final Clock clock;

    protected AbstractJobStore(String username, Clock clock) {
        this.username = Objects.requireNonNull(username, "username");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String username() {
        return username;
    }

    /**
     * Persist a brand new job with all its fields.
     */
    protected abstract void insert(Job job);

    /**
     * Persist one field of an existing job. {@code updated} already carries the new value.
     */
    protected abstract void persist(Job updated, JobField field);

    protected abstract void delete(String id);

    @Override
    public synchronized Job add(NewJob newJob) {
        String link = newJob.getLink() == null ? "" : newJob.getLink().trim();
        if (hasLink(link)) {
            throw new DuplicateLinkException(link);
        }

        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .company(newJob.getCompany() == null ? "" : newJob.getCompany())
                .title(newJob.getTitle() == null ? "" : newJob.getTitle())
                .link(link)
                .location(newJob.getLocation() == null ? "" : newJob.getLocation())
                .description(newJob.getDescription() == null ? "" : newJob.getDescription())
                .fullDescription(newJob.getFullDescription() == null ? "" : newJob.getFullDescription())
                .addressee(newJob.getAddressee())
                .status(JobStatus.PENDING)
                .dateFound(clock.instant())
                .queryIds(newJob.getQueryIds() == null ? List.of() : List.copyOf(newJob.getQueryIds()))
                .build();

        insert(job);
        log.debug("Added job {} ({} at {})", job.getId(), job.getTitle(), job.getCompany());
        return job;
    }

    @Override
    public synchronized Job update(String id, JobUpdate update) {
        Job current = require(id);

        switch (update.field()) {
            case STATUS -> {
                JobStatus target = (JobStatus) update.value();
                if (current.getStatus() == target) {
                    return current;
                }
                if (!current.getStatus().canTransitionTo(target)) {
                    throw new InvalidTransitionException(id, current.getStatus(), target);
                }
            }
            case COVER_LETTER_PDF_PATH -> {
                Path path = (Path) update.value();
                if (path != null && !Files.exists(path)) {
                    log.warn("Ignoring cover letter path for job {}: {} does not exist", id, path);
                    return current;
                }
            }
            default -> {
                // no precondition
            }
        }

        Job updated = update.applyTo(current);
        persist(updated, update.field());

        if (update.field() == JobField.FULL_DESCRIPTION
                && !Objects.equals(current.getFullDescription(), updated.getFullDescription())
                && !updated.getCoverLetterTopics().isEmpty()) {
            // topics were drawn from the old description
            updated = updated.toBuilder().coverLetterTopics(List.of()).build();
            persist(updated, JobField.COVER_LETTER_TOPICS);
        }

        if (update.field() == JobField.COVER_LETTER_PDF_PATH) {
            deleteReplacedPdf(current.getCoverLetterPdfPath(), updated.getCoverLetterPdfPath());
        }
        return updated;
    }

    @Override
    public synchronized void purge(String id) {
        require(id);
        delete(id);
        log.info("Purged job {}", id);
    }

    @Override
    public synchronized boolean importJob(Job job) {
        if (get(job.getId()).isPresent() || hasLink(job.getLink())) {
            return false;
        }
        insert(job);
        return true;
    }

    /**
     * Drop a PDF path whose file has disappeared since it was stored.
     */
    protected Job healPdfPath(Job job) {
        Path path = job.getCoverLetterPdfPath();
        if (path != null && !Files.exists(path)) {
            return job.toBuilder().coverLetterPdfPath(null).build();
        }
        return job;
    }

    private void deleteReplacedPdf(Path previous, Path next) {
        if (previous == null || previous.equals(next)) {
            return;
        }
        try {
            Files.deleteIfExists(previous);
        } catch (IOException e) {
            log.warn("Could not delete previous cover letter {}: {}", previous, e.getMessage());
        }
    }
}
