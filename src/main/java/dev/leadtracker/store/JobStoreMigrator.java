package dev.leadtracker.store;

import dev.leadtracker.model.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Copies every job from one backend into another, field by field, keeping ids,
 * discovery dates and statuses. Jobs whose id or link already exist in the target are skipped.
 */
@Slf4j
@Component
public class JobStoreMigrator {

    public record MigrationResult(int copied, int skipped) {
    }

    public MigrationResult migrate(JobStore source, JobStore target) {
        int copied = 0;
        int skipped = 0;
        for (Job job : source.findAll()) {
            if (target.importJob(job)) {
                copied++;
            } else {
                skipped++;
                log.debug("Skipping job {} ({}): already present in target", job.getId(), job.getLink());
            }
        }
        log.info("Migrated jobs for {}: {} copied, {} skipped", source.username(), copied, skipped);
        return new MigrationResult(copied, skipped);
    }
}
