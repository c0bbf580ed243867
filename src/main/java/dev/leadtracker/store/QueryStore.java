package dev.leadtracker.store;

import dev.leadtracker.config.StorageProperties;
import dev.leadtracker.entity.QueryResult;
import dev.leadtracker.entity.SearchQuery;
import dev.leadtracker.repository.QueryResultRepository;
import dev.leadtracker.repository.SearchQueryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Durable collection of the configured user's search queries and their run history.
 * Every write runs in its own transaction; database and transaction failures both
 * surface as {@link StorageException}.
 */
@Slf4j
@Service
public class QueryStore {

    private final SearchQueryRepository queryRepository;
    private final QueryResultRepository resultRepository;
    private final String username;
    private final TransactionTemplate transactions;
    private final Clock clock;

    public QueryStore(SearchQueryRepository queryRepository, QueryResultRepository resultRepository,
            TransactionTemplate transactions, StorageProperties storageProperties, Clock clock) {
        this.queryRepository = queryRepository;
        this.resultRepository = resultRepository;
        this.transactions = transactions;
        this.username = storageProperties.getUsername();
        this.clock = clock;
    }

    /**
     * Persist new query strings. Ids continue from the highest id ever issued,
     * removed queries included, so an id is never reused.
     *
     * @return the saved queries in input order
     */
    public List<SearchQuery> save(List<String> queryTexts) {
        return write("save queries", () -> {
            int nextId = queryRepository.findMaxQueryId(username) + 1;
            LocalDateTime now = now();
            List<SearchQuery> saved = new ArrayList<>(queryTexts.size());
            for (String text : queryTexts) {
                saved.add(queryRepository.save(SearchQuery.builder()
                        .username(username)
                        .queryId(nextId++)
                        .queryText(text)
                        .removed(false)
                        .createdAt(now)
                        .build()));
            }
            log.info("Saved {} search queries for {}", saved.size(), username);
            return saved;
        });
    }

    /**
     * Active (non-removed) queries in id order.
     */
    public List<SearchQuery> activeQueries() {
        return storage("read queries", () -> queryRepository.findByUsernameAndRemovedFalseOrderByQueryId(username));
    }

    /**
     * Every query ever saved, removed ones included.
     */
    public List<SearchQuery> allQueries() {
        return storage("read queries", () -> queryRepository.findByUsernameOrderByQueryId(username));
    }

    public long count() {
        return storage("count queries", () -> queryRepository.countByUsernameAndRemovedFalse(username));
    }

    /**
     * Soft-delete the given queries. Unknown and already removed ids are ignored.
     */
    public void remove(Collection<Integer> queryIds) {
        if (queryIds.isEmpty()) {
            return;
        }
        write("remove queries", () -> {
            List<SearchQuery> queries = queryRepository.findByUsernameAndQueryIdIn(username, queryIds);
            List<SearchQuery> changed = queries.stream().filter(query -> !query.isRemoved()).toList();
            changed.forEach(query -> query.setRemoved(true));
            queryRepository.saveAll(changed);
            log.info("Removed {} search queries", changed.size());
            return null;
        });
    }

    /**
     * Soft-delete every active query.
     */
    public void clear() {
        write("clear queries", () -> {
            remove(activeQueries().stream().map(SearchQuery::getQueryId).toList());
            return null;
        });
    }

    /**
     * Append one run-history row. Earlier rows are never touched.
     */
    public void writeResult(int queryId, int potentialLeads) {
        write("write query result", () -> resultRepository.save(QueryResult.builder()
                .username(username)
                .queryId(queryId)
                .timestamp(now())
                .potentialLeads(potentialLeads)
                .build()));
    }

    /**
     * Append one run-history row per entry, all with the same timestamp.
     */
    public void writeResults(Map<Integer, Integer> potentialLeadsByQuery) {
        if (potentialLeadsByQuery.isEmpty()) {
            return;
        }
        LocalDateTime now = now();
        List<QueryResult> rows = potentialLeadsByQuery.entrySet().stream()
                .map(entry -> QueryResult.builder()
                        .username(username)
                        .queryId(entry.getKey())
                        .timestamp(now)
                        .potentialLeads(entry.getValue())
                        .build())
                .toList();
        write("write query results", () -> resultRepository.saveAll(rows));
    }

    public List<QueryResult> results(int queryId) {
        return storage("read query results",
                () -> resultRepository.findByUsernameAndQueryIdOrderByTimestamp(username, queryId));
    }

    /**
     * Sum of every logged lead count for the query.
     */
    public int resultsTotal(int queryId) {
        return storage("sum query results", () -> (int) resultRepository.sumPotentialLeads(username, queryId));
    }

    private LocalDateTime now() {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private <T> T write(String action, Supplier<T> operation) {
        return storage(action, () -> transactions.execute(status -> operation.get()));
    }

    private <T> T storage(String action, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure: could not {} for {}: {}", action, username, e.getMessage());
            throw new StorageException("Could not " + action, e);
        }
    }
}
