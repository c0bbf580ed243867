package dev.leadtracker.service;

import dev.leadtracker.config.IngestionProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * What one pipeline run should do.
 */
@Value
@Builder
public class IngestionRequest {

    /** Restrict the search to these query ids; empty means every active query. */
    @Builder.Default
    List<Integer> queryIds = List.of();

    /** Search at most this many queries; null means no cap. */
    Integer maxQueries;

    @Builder.Default
    boolean fetchDescriptions = true;

    @Builder.Default
    Duration recentThreshold = Duration.ofHours(12);

    boolean retryFailedQueries;

    public static IngestionRequest from(IngestionProperties properties) {
        return IngestionRequest.builder()
                .queryIds(properties.getQueryIds() == null ? List.of() : List.copyOf(properties.getQueryIds()))
                .maxQueries(properties.getMaxQueries())
                .fetchDescriptions(properties.isFetchDescriptions())
                .recentThreshold(properties.getRecentThreshold())
                .retryFailedQueries(properties.isRetryFailedQueries())
                .build();
    }
}
