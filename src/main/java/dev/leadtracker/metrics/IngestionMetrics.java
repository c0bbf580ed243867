package dev.leadtracker.metrics;

import dev.leadtracker.service.IngestionReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for ingestion runs.
 */
@Component
public class IngestionMetrics {

    // Counters
    private final Counter queriesSearchedCounter;
    private final Counter queriesFailedCounter;
    private final Counter leadsFoundCounter;
    private final Counter leadsRecoveredCounter;
    private final Counter duplicatesDroppedCounter;
    private final Counter enrichmentFailuresCounter;
    private final Counter filterFailOpenCounter;
    private final Counter jobsCommittedCounter;

    private final Timer searchTimer;

    // Gauges
    private final AtomicInteger lastRunLeadsFound = new AtomicInteger(0);
    private final AtomicInteger lastRunJobsCommitted = new AtomicInteger(0);

    public IngestionMetrics(MeterRegistry registry) {
        this.queriesSearchedCounter = Counter.builder("lead_tracker_queries_searched_total")
                .description("Total search queries sent to the model")
                .register(registry);

        this.queriesFailedCounter = Counter.builder("lead_tracker_queries_failed_total")
                .description("Total searches that failed or returned unparsable output")
                .register(registry);

        this.leadsFoundCounter = Counter.builder("lead_tracker_leads_found_total")
                .description("Total leads returned by searches")
                .register(registry);

        this.leadsRecoveredCounter = Counter.builder("lead_tracker_leads_recovered_total")
                .description("Total leads replayed from the recovery log")
                .register(registry);

        this.duplicatesDroppedCounter = Counter.builder("lead_tracker_duplicates_dropped_total")
                .description("Total leads dropped as duplicates within a batch or of stored jobs")
                .register(registry);

        this.enrichmentFailuresCounter = Counter.builder("lead_tracker_enrichment_failures_total")
                .description("Total leads whose full description could not be fetched")
                .register(registry);

        this.filterFailOpenCounter = Counter.builder("lead_tracker_filter_fail_open_total")
                .description("Total runs where the suitability filter failed and kept every lead")
                .register(registry);

        this.jobsCommittedCounter = Counter.builder("lead_tracker_jobs_committed_total")
                .description("Total jobs added to the job store")
                .register(registry);

        this.searchTimer = Timer.builder("lead_tracker_search_duration")
                .description("Time spent on one search query")
                .register(registry);

        Gauge.builder("lead_tracker_last_run_leads_found", lastRunLeadsFound, AtomicInteger::get)
                .description("Leads found in last run")
                .register(registry);

        Gauge.builder("lead_tracker_last_run_jobs_committed", lastRunJobsCommitted, AtomicInteger::get)
                .description("Jobs committed in last run")
                .register(registry);
    }

    /**
     * Record one search and its outcome.
     */
    public void recordSearch(int leads, boolean failed, Duration elapsed) {
        queriesSearchedCounter.increment();
        if (failed) {
            queriesFailedCounter.increment();
        }
        leadsFoundCounter.increment(leads);
        searchTimer.record(elapsed);
    }

    /**
     * Fold a finished run into the counters and last-run gauges.
     */
    public void recordRun(IngestionReport report) {
        leadsRecoveredCounter.increment(report.getLeadsRecovered());
        duplicatesDroppedCounter.increment((double) report.getDuplicatesInBatch() + report.getAlreadyStored());
        enrichmentFailuresCounter.increment(report.getEnrichmentFailed());
        if (report.isFilterFailedOpen()) {
            filterFailOpenCounter.increment();
        }
        jobsCommittedCounter.increment(report.getCommitted().size());
        lastRunLeadsFound.set(report.getLeadsFound());
        lastRunJobsCommitted.set(report.getCommitted().size());
    }
}
