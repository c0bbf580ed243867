package dev.leadtracker.service;

import dev.leadtracker.config.IngestionProperties;
import dev.leadtracker.entity.SearchQuery;
import dev.leadtracker.metrics.IngestionMetrics;
import dev.leadtracker.model.Job;
import dev.leadtracker.model.Lead;
import dev.leadtracker.recovery.RecoveryEntry;
import dev.leadtracker.recovery.RecoveryLog;
import dev.leadtracker.service.LeadDeduplicator.DedupeResult;
import dev.leadtracker.service.LeadSearcher.SearchOutcome;
import dev.leadtracker.service.SuitabilityFilter.FilterOutcome;
import dev.leadtracker.store.JobStore;
import dev.leadtracker.store.NewJob;
import dev.leadtracker.store.QueryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lead ingestion: Recover, Search, Dedupe, Enrich, Filter, Commit.
 * <p>
 * Phases run in order and items within a phase one at a time. Every searched query
 * is appended to the recovery log before the next one starts; the log is cleared
 * only once the whole batch has been committed, so a killed run resumes from it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private static final String SEPARATOR = "========================================";

    private final RecoveryLog recoveryLog;
    private final QueryStore queryStore;
    private final JobStore jobStore;
    private final LeadSearcher leadSearcher;
    private final LeadDeduplicator leadDeduplicator;
    private final DescriptionEnricher descriptionEnricher;
    private final SuitabilityFilter suitabilityFilter;
    private final IngestionMetrics metrics;
    private final IngestionProperties properties;
    private final Clock clock;

    private final Object commitLock = new Object();

    /**
     * Execute one run.
     *
     * @return counters and committed jobs; errors only on storage failure
     */
    public Mono<IngestionReport> run(IngestionRequest request) {
        log.info(SEPARATOR);
        log.info("Lead Ingestion Starting");
        log.info(SEPARATOR);

        return Mono.fromCallable(() -> recover(request))
                .flatMap(run -> {
                    if (run.queries.isEmpty() && run.candidates.isEmpty()) {
                        log.warn("No search queries to run and nothing to recover. Generate queries first.");
                        return Mono.just(IngestionReport.empty());
                    }
                    if (run.queries.isEmpty()) {
                        log.info("All queries already searched recently. Processing {} recovered leads...",
                                run.candidates.size());
                    }
                    return search(run)
                            .then(Mono.defer(() -> process(run, request)));
                });
    }

    /**
     * Replay the recovery log and pick the queries still to search.
     */
    private RunState recover(IngestionRequest request) {
        Instant now = clock.instant();
        List<RecoveryEntry> entries = recoveryLog.readAll();
        RunState run = new RunState();

        for (RecoveryEntry entry : entries) {
            run.candidates.addAll(entry.jobs());
        }
        run.report.leadsRecovered(run.candidates.size());
        if (!entries.isEmpty()) {
            log.info("Found {} search results from a previous session ({} leads)", entries.size(),
                    run.candidates.size());
        }

        Set<String> recentlyAttempted = entries.stream()
                .filter(entry -> entry.isRecent(now, request.getRecentThreshold()))
                .filter(entry -> !(request.isRetryFailedQueries() && entry.failed()))
                .map(RecoveryEntry::queryText)
                .collect(Collectors.toSet());

        List<SearchQuery> selected = queryStore.activeQueries().stream()
                .filter(query -> request.getQueryIds().isEmpty() || request.getQueryIds().contains(query.getQueryId()))
                .toList();
        if (request.getMaxQueries() != null && selected.size() > request.getMaxQueries()) {
            selected = selected.subList(0, request.getMaxQueries());
        }

        for (SearchQuery query : selected) {
            if (recentlyAttempted.contains(query.getQueryText())) {
                run.queriesSkippedRecent++;
                log.debug("Skipping query {}: searched within the last {}", query.getQueryId(),
                        request.getRecentThreshold());
            } else {
                run.queries.add(query);
            }
        }
        run.report.queriesSkippedRecent(run.queriesSkippedRecent);
        return run;
    }

    private Mono<Void> search(RunState run) {
        if (run.queries.isEmpty()) {
            return Mono.empty();
        }
        log.info("Searching with {} queries...", run.queries.size());
        int total = run.queries.size();

        return Flux.fromIterable(run.queries)
                .index()
                .concatMap(indexed -> {
                    SearchQuery query = indexed.getT2();
                    log.info("[{}/{}] {}", indexed.getT1() + 1, total, abbreviate(query.getQueryText()));
                    Instant started = clock.instant();
                    return leadSearcher.search(query, properties.getSearchTimeout())
                            .doOnNext(outcome -> record(run, query, outcome,
                                    Duration.between(started, clock.instant())));
                })
                .then()
                .doOnSuccess(ignored -> log.info("Found {} leads in total", run.leadsFound));
    }

    /**
     * Durably note one searched query before moving on.
     */
    private void record(RunState run, SearchQuery query, SearchOutcome outcome, Duration elapsed) {
        List<Lead> leads = outcome.leads();
        queryStore.writeResult(query.getQueryId(), leads.size());
        recoveryLog.append(query.getQueryText(), leads, outcome.failed());
        run.candidates.addAll(leads);
        run.leadsFound += leads.size();
        run.queriesSearched++;
        if (outcome.failed()) {
            run.queriesFailed++;
        }
        metrics.recordSearch(leads.size(), outcome.failed(), elapsed);
    }

    private Mono<IngestionReport> process(RunState run, IngestionRequest request) {
        run.report.queriesSearched(run.queriesSearched)
                .queriesFailed(run.queriesFailed)
                .leadsFound(run.leadsFound);

        DedupeResult dedupe = leadDeduplicator.dedupe(run.candidates);
        run.report.leadsMissingLink(dedupe.missingLink())
                .duplicatesInBatch(dedupe.batchDuplicates())
                .alreadyStored(dedupe.alreadyStored());

        List<Lead> fresh = dedupe.fresh();
        if (fresh.isEmpty()) {
            log.info("No new leads to process");
            return Mono.fromCallable(() -> finish(run, List.of()));
        }

        Mono<List<Lead>> enriched = request.isFetchDescriptions()
                ? enrich(run, fresh)
                : Mono.just(fresh);

        return enriched
                .flatMap(leads -> {
                    log.info("Filtering {} leads for suitability...", leads.size());
                    return suitabilityFilter.filter(leads);
                })
                .map(outcome -> {
                    run.report.filterFailedOpen(outcome.failedOpen())
                            .rejected(outcome.rejected().size());
                    writeNegativeResults(outcome);
                    log.info("  {} suitable leads remaining", outcome.kept().size());
                    return finish(run, commit(outcome.kept()));
                });
    }

    private Mono<List<Lead>> enrich(RunState run, List<Lead> leads) {
        log.info("Fetching full descriptions for {} leads...", leads.size());
        int total = leads.size();

        return Flux.fromIterable(leads)
                .index()
                .concatMap(indexed -> {
                    Lead lead = indexed.getT2();
                    if (lead.getFullDescription() != null && !lead.getFullDescription().isBlank()) {
                        return Mono.just(lead);
                    }
                    log.info("  [{}/{}] {} at {}...", indexed.getT1() + 1, total, lead.getTitle(), lead.getCompany());
                    return descriptionEnricher.fullDescription(lead.getLink())
                            .onErrorResume(e -> {
                                log.warn("    Enrichment failed for {}: {}", lead.getLink(), e.getMessage());
                                return Mono.just("");
                            })
                            .map(description -> {
                                if (description.isEmpty()) {
                                    run.enrichmentFailed++;
                                    log.info("    No description extracted");
                                } else {
                                    lead.setFullDescription(description);
                                    run.enriched++;
                                    log.info("    Got {} chars", description.length());
                                }
                                return lead;
                            });
                })
                .collectList()
                .doOnSuccess(ignored -> run.report.enriched(run.enriched).enrichmentFailed(run.enrichmentFailed));
    }

    /**
     * Charge every rejected lead against each query that produced it.
     */
    private void writeNegativeResults(FilterOutcome outcome) {
        Map<Integer, Integer> negative = new LinkedHashMap<>();
        for (Lead lead : outcome.rejected()) {
            if (lead.getQueryIds() == null) {
                continue;
            }
            for (Integer queryId : lead.getQueryIds()) {
                negative.merge(queryId, -1, Integer::sum);
            }
        }
        queryStore.writeResults(negative);
    }

    private List<Job> commit(List<Lead> leads) {
        if (leads.isEmpty()) {
            return List.of();
        }
        log.info("Adding {} jobs to the job store...", leads.size());
        List<Job> committed = new ArrayList<>(leads.size());
        synchronized (commitLock) {
            for (Lead lead : leads) {
                if (jobStore.hasLink(lead.getLink())) {
                    log.debug("Skipping {}: already committed", lead.getLink());
                    continue;
                }
                Job job = jobStore.add(toNewJob(lead));
                committed.add(job);
                log.info("  Added: {} at {} ({})", job.getTitle(), job.getCompany(), job.getId());
            }
        }
        return committed;
    }

    private IngestionReport finish(RunState run, List<Job> committed) {
        recoveryLog.clear();
        IngestionReport report = run.report.committed(committed).build();
        metrics.recordRun(report);

        log.info(SEPARATOR);
        log.info("INGESTION SUMMARY: {}", report.summary());
        log.info("Total jobs: {}", jobStore.countTotal());
        log.info(SEPARATOR);
        return report;
    }

    private static NewJob toNewJob(Lead lead) {
        return NewJob.builder()
                .company(orDefault(lead.getCompany(), "Unknown"))
                .title(orDefault(lead.getTitle(), "Unknown"))
                .link(lead.getLink())
                .location(orDefault(lead.getLocation(), ""))
                .description(orDefault(lead.getDescription(), ""))
                .fullDescription(orDefault(lead.getFullDescription(), ""))
                .addressee(addressee(lead.getAddressee()))
                .queryIds(lead.getQueryIds() == null ? List.of() : List.copyOf(lead.getQueryIds()))
                .build();
    }

    private static String addressee(String value) {
        // models write a literal "null" when told "or null if not found"
        if (value == null || value.isBlank() || "null".equalsIgnoreCase(value.strip())) {
            return null;
        }
        return value.strip();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String abbreviate(String text) {
        return text.length() > 60 ? text.substring(0, 60) + "..." : text;
    }

    /**
     * Mutable state of one run.
     */
    private static final class RunState {
        private final List<SearchQuery> queries = new ArrayList<>();
        private final List<Lead> candidates = new ArrayList<>();
        private final IngestionReport.IngestionReportBuilder report = IngestionReport.builder();
        private int queriesSkippedRecent;
        private int queriesSearched;
        private int queriesFailed;
        private int leadsFound;
        private int enriched;
        private int enrichmentFailed;
    }
}
