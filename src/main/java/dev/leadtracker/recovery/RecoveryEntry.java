package dev.leadtracker.recovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.leadtracker.model.Lead;
import dev.leadtracker.util.Timestamps;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One line of the recovery log: the raw leads a single query produced in a run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecoveryEntry(
        @JsonProperty("query_str") String queryText,
        String timestamp,
        List<Lead> jobs,
        boolean failed) {

    public RecoveryEntry {
        jobs = jobs == null ? List.of() : jobs;
    }

    /**
     * Whether the entry was written less than {@code threshold} before {@code now}.
     * An unreadable or zone-less timestamp is never recent.
     */
    public boolean isRecent(Instant now, Duration threshold) {
        return Timestamps.parseZoned(timestamp)
                .map(written -> Duration.between(written, now).compareTo(threshold) < 0)
                .orElse(false);
    }
}
