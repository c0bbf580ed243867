package dev.leadtracker.store;

import dev.leadtracker.config.StorageProperties;
import dev.leadtracker.entity.QueryResult;
import dev.leadtracker.entity.SearchQuery;
import dev.leadtracker.repository.QueryResultRepository;
import dev.leadtracker.repository.SearchQueryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private SearchQueryRepository queryRepository;

    @Mock
    private QueryResultRepository resultRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private QueryStore queryStore;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setUsername("alice");
        queryStore = new QueryStore(queryRepository, resultRepository, new TransactionTemplate(transactionManager),
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private SearchQuery query(int id, boolean removed) {
        return SearchQuery.builder().username("alice").queryId(id).queryText("query " + id).removed(removed)
                .createdAt(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC)).build();
    }

    @Nested
    @DisplayName("Saving queries")
    class Saving {

        @Test
        @DisplayName("Should continue ids after the highest ever issued")
        void shouldAssignIdsAfterMax() {
            when(queryRepository.findMaxQueryId("alice")).thenReturn(7);
            when(queryRepository.save(any(SearchQuery.class))).thenAnswer(invocation -> invocation.getArgument(0));

            List<SearchQuery> saved = queryStore.save(List.of("java remote", "kotlin berlin"));

            assertThat(saved).extracting(SearchQuery::getQueryId).containsExactly(8, 9);
            assertThat(saved).extracting(SearchQuery::getQueryText).containsExactly("java remote", "kotlin berlin");
            assertThat(saved).allSatisfy(query -> {
                assertThat(query.isRemoved()).isFalse();
                assertThat(query.getUsername()).isEqualTo("alice");
                assertThat(query.getCreatedAt()).isEqualTo(LocalDateTime.of(2026, 3, 1, 10, 0));
            });
        }

        @Test
        @DisplayName("Should start at one for a new user")
        void shouldStartAtOne() {
            when(queryRepository.findMaxQueryId("alice")).thenReturn(0);
            when(queryRepository.save(any(SearchQuery.class))).thenAnswer(invocation -> invocation.getArgument(0));

            assertThat(queryStore.save(List.of("first"))).extracting(SearchQuery::getQueryId).containsExactly(1);
        }

        @Test
        @DisplayName("Should wrap data access failures")
        void shouldWrapFailures() {
            when(queryRepository.findMaxQueryId("alice")).thenThrow(new DataAccessResourceFailureException("disk"));

            assertThatThrownBy(() -> queryStore.save(List.of("first"))).isInstanceOf(StorageException.class);
        }
    }

    @Nested
    @DisplayName("Removing queries")
    class Removing {

        @Test
        @DisplayName("Should only flag queries that are still active")
        void shouldFlagActiveOnly() {
            SearchQuery active = query(1, false);
            SearchQuery removed = query(2, true);
            when(queryRepository.findByUsernameAndQueryIdIn("alice", List.of(1, 2, 99)))
                    .thenReturn(List.of(active, removed));

            queryStore.remove(List.of(1, 2, 99));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<SearchQuery>> captor = ArgumentCaptor.forClass(List.class);
            verify(queryRepository).saveAll(captor.capture());
            assertThat(captor.getValue()).containsExactly(active);
            assertThat(active.isRemoved()).isTrue();
        }

        @Test
        @DisplayName("Should do nothing for an empty id list")
        void shouldIgnoreEmpty() {
            queryStore.remove(List.of());

            verify(queryRepository, never()).findByUsernameAndQueryIdIn(any(), any());
        }

        @Test
        @DisplayName("Should soft delete every active query on clear")
        void shouldClear() {
            when(queryRepository.findByUsernameAndRemovedFalseOrderByQueryId("alice"))
                    .thenReturn(List.of(query(1, false), query(3, false)));
            when(queryRepository.findByUsernameAndQueryIdIn("alice", List.of(1, 3)))
                    .thenReturn(List.of(query(1, false), query(3, false)));

            queryStore.clear();

            verify(queryRepository).saveAll(anyList());
        }
    }

    @Nested
    @DisplayName("Result log")
    class ResultLog {

        @Test
        @DisplayName("Should append one row per write")
        void shouldAppendResult() {
            queryStore.writeResult(4, 6);

            ArgumentCaptor<QueryResult> captor = ArgumentCaptor.forClass(QueryResult.class);
            verify(resultRepository).save(captor.capture());
            assertThat(captor.getValue().getQueryId()).isEqualTo(4);
            assertThat(captor.getValue().getPotentialLeads()).isEqualTo(6);
            assertThat(captor.getValue().getId()).isNull();
            assertThat(captor.getValue().getTimestamp()).isEqualTo(LocalDateTime.of(2026, 3, 1, 10, 0));
        }

        @Test
        @DisplayName("Should append a row for every query in a batch")
        void shouldAppendBatch() {
            Map<Integer, Integer> negative = new LinkedHashMap<>();
            negative.put(1, -2);
            negative.put(5, -1);

            queryStore.writeResults(negative);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<QueryResult>> captor = ArgumentCaptor.forClass(List.class);
            verify(resultRepository).saveAll(captor.capture());
            assertThat(captor.getValue()).extracting(QueryResult::getQueryId, QueryResult::getPotentialLeads)
                    .containsExactly(tuple(1, -2),
                            tuple(5, -1));
        }

        @Test
        @DisplayName("Should skip an empty batch")
        void shouldSkipEmptyBatch() {
            queryStore.writeResults(Map.of());

            verify(resultRepository, never()).saveAll(anyList());
        }

        @Test
        @DisplayName("Should sum every logged count")
        void shouldSumResults() {
            when(resultRepository.sumPotentialLeads("alice", 4)).thenReturn(9L);

            assertThat(queryStore.resultsTotal(4)).isEqualTo(9);
        }
    }

    @Nested
    @DisplayName("Transaction failures")
    class TransactionFailures {

        @Test
        @DisplayName("Should wrap a transaction that cannot be opened")
        void shouldWrapBeginFailure() {
            when(transactionManager.getTransaction(any())).thenThrow(new CannotCreateTransactionException("locked"));

            assertThatThrownBy(() -> queryStore.save(List.of("first")))
                    .isInstanceOf(StorageException.class)
                    .hasCauseInstanceOf(CannotCreateTransactionException.class);
            verify(queryRepository, never()).save(any(SearchQuery.class));
        }

        @Test
        @DisplayName("Should wrap a failed commit")
        void shouldWrapCommitFailure() {
            doThrow(new TransactionSystemException("commit failed")).when(transactionManager).commit(any());

            assertThatThrownBy(() -> queryStore.writeResult(4, 2))
                    .isInstanceOf(StorageException.class)
                    .hasMessage("Could not write query result")
                    .hasCauseInstanceOf(TransactionSystemException.class);
        }
    }
}
