package dev.leadtracker.store;

import dev.leadtracker.ExitManager;
import dev.leadtracker.PipelineRunner;
import dev.leadtracker.entity.QueryResult;
import dev.leadtracker.entity.SearchQuery;
import dev.leadtracker.repository.QueryResultRepository;
import dev.leadtracker.repository.SearchQueryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class QueryStoreIntegrationTest {

    @MockitoBean
    private PipelineRunner pipelineRunner;

    @MockitoBean
    private ExitManager exitManager;

    @Autowired
    private QueryStore queryStore;

    @Autowired
    private SearchQueryRepository queryRepository;

    @Autowired
    private QueryResultRepository resultRepository;

    @BeforeEach
    void setUp() {
        resultRepository.deleteAll();
        queryRepository.deleteAll();
    }

    @Test
    @DisplayName("Should never reuse the id of a removed query")
    void shouldNotReuseRemovedIds() {
        List<SearchQuery> first = queryStore.save(List.of("java remote", "kotlin berlin"));
        queryStore.remove(List.of(first.get(1).getQueryId()));

        List<SearchQuery> second = queryStore.save(List.of("scala anywhere"));

        assertThat(second.get(0).getQueryId()).isEqualTo(3);
        assertThat(queryStore.activeQueries()).extracting(SearchQuery::getQueryText)
                .containsExactly("java remote", "scala anywhere");
        assertThat(queryStore.allQueries()).hasSize(3);
        assertThat(queryStore.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep removed queries on clear")
    void shouldSoftDeleteOnClear() {
        queryStore.save(List.of("java remote", "kotlin berlin"));

        queryStore.clear();
        queryStore.clear();

        assertThat(queryStore.activeQueries()).isEmpty();
        assertThat(queryStore.allQueries()).allMatch(SearchQuery::isRemoved);
    }

    @Test
    @DisplayName("Should append results and sum them per query")
    void shouldAppendResults() {
        queryStore.save(List.of("java remote", "kotlin berlin"));

        queryStore.writeResult(1, 5);
        queryStore.writeResult(2, 1);
        queryStore.writeResults(Map.of(1, -2));

        assertThat(queryStore.results(1)).extracting(QueryResult::getPotentialLeads).containsExactlyInAnyOrder(5, -2);
        assertThat(queryStore.resultsTotal(1)).isEqualTo(3);
        assertThat(queryStore.resultsTotal(2)).isEqualTo(1);
        assertThat(queryStore.resultsTotal(9)).isZero();
    }
}
