package dev.leadtracker;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.leadtracker.config.IngestionProperties;
import dev.leadtracker.config.StorageProperties;
import dev.leadtracker.service.IngestionPipeline;
import dev.leadtracker.service.IngestionReport;
import dev.leadtracker.service.IngestionRequest;
import dev.leadtracker.store.JobStore;
import dev.leadtracker.store.JobStoreMigrator;
import dev.leadtracker.store.file.FileJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Runs one ingestion, after importing a legacy job file when one is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  private static final String SEPARATOR = "========================================";

  private final IngestionPipeline ingestionPipeline;
  private final IngestionProperties ingestionProperties;
  private final StorageProperties storageProperties;
  private final JobStore jobStore;
  private final JobStoreMigrator jobStoreMigrator;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Value("${scanner.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  /**
   * Executes the pipeline and handles the post-execution wait.
   *
   * @return Number of jobs committed
   */
  public int execute() {
    log.info(SEPARATOR);
    log.info("Lead Tracker Starting");
    log.info(SEPARATOR);

    try {
      importLegacyJobs();

      IngestionReport report = ingestionPipeline.run(IngestionRequest.from(ingestionProperties)).block();
      int count = report != null ? report.getCommitted().size() : 0;

      log.info(SEPARATOR);
      log.info("Lead Tracker Completed Successfully");
      log.info("Jobs added: {}", count);
      log.info(SEPARATOR);

      handleMetricsWait();

      return count;
    } catch (Exception e) {
      log.error("Lead Tracker failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Pipeline execution failed", e);
    }
  }

  private void importLegacyJobs() {
    Path importFile = storageProperties.getImportFile();
    if (importFile == null) {
      return;
    }
    if (!Files.exists(importFile)) {
      log.warn("Import file {} does not exist - skipping import", importFile);
      return;
    }
    log.info("Importing jobs from {}", importFile);
    FileJobStore legacy = new FileJobStore(importFile, storageProperties.getUsername(), objectMapper, clock);
    jobStoreMigrator.migrate(legacy, jobStore);
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
