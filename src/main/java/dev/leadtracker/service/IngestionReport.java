package dev.leadtracker.service;

import dev.leadtracker.model.Job;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one pipeline run. Partial success is normal: the counters show which
 * external calls failed without the run failing.
 */
@Value
@Builder
public class IngestionReport {

    int queriesSearched;
    int queriesFailed;
    int queriesSkippedRecent;
    int leadsFound;
    int leadsRecovered;
    int leadsMissingLink;
    int duplicatesInBatch;
    int alreadyStored;
    int enriched;
    int enrichmentFailed;
    boolean filterFailedOpen;
    int rejected;

    @Builder.Default
    List<Job> committed = List.of();

    public static IngestionReport empty() {
        return IngestionReport.builder().build();
    }

    public String summary() {
        return String.format(
                "queries searched=%d failed=%d skipped=%d | leads found=%d recovered=%d | "
                        + "no-link=%d duplicates=%d already-stored=%d | enriched=%d enrich-failed=%d | "
                        + "filter %s rejected=%d | committed=%d",
                queriesSearched, queriesFailed, queriesSkippedRecent, leadsFound, leadsRecovered,
                leadsMissingLink, duplicatesInBatch, alreadyStored, enriched, enrichmentFailed,
                filterFailedOpen ? "FAILED OPEN" : "ok", rejected, committed.size());
    }
}
