package dev.leadtracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.leadtracker.recovery.RecoveryLog;
import dev.leadtracker.store.JobStore;
import dev.leadtracker.store.file.FileJobStore;
import dev.leadtracker.store.jdbc.JdbcJobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Wires the job store backend and the recovery log for the configured user.
 */
@Slf4j
@Configuration
public class StorageConfig {

    static final String JOBS_FILE = "jobs.json";
    static final String RECOVERY_FILE = "search_temp.jsonl";

    @Bean
    public JobStore jobStore(StorageProperties storage, ObjectMapper objectMapper, Clock clock,
            NamedParameterJdbcTemplate jdbc, TransactionTemplate transactions) {
        JobStore store = switch (storage.getBackend()) {
            case FILE -> new FileJobStore(storage.userDir().resolve(JOBS_FILE), storage.getUsername(),
                    objectMapper, clock);
            case DATABASE -> new JdbcJobStore(jdbc, transactions, storage.getUsername(), clock);
        };
        log.info("Job store: {} backend for user {} ({} jobs)", storage.getBackend(), storage.getUsername(),
                store.countTotal());
        return store;
    }

    @Bean
    public RecoveryLog recoveryLog(StorageProperties storage, ObjectMapper objectMapper, Clock clock) {
        return new RecoveryLog(storage.userDir().resolve(RECOVERY_FILE), objectMapper, clock);
    }
}
