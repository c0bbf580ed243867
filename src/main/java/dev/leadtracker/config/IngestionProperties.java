package dev.leadtracker.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Knobs for one ingestion run.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    /** Recovery-log entries younger than this suppress re-searching their query. */
    @NotNull
    private Duration recentThreshold = Duration.ofHours(12);

    private boolean fetchDescriptions = true;

    /** When non-empty only these query ids are searched. */
    private List<Integer> queryIds = new ArrayList<>();

    /** Cap on the number of queries searched, applied after the id filter. */
    @Positive
    private Integer maxQueries;

    /** Let queries whose last search failed be searched again inside the recency window. */
    private boolean retryFailedQueries = false;

    @NotNull
    private Duration searchTimeout = Duration.ofSeconds(300);
    @NotNull
    private Duration extractTimeout = Duration.ofSeconds(60);
    @NotNull
    private Duration filterTimeout = Duration.ofSeconds(120);

    /** Scraped pages shorter than this are not worth sending to the model. */
    @Min(0)
    private int minScrapedLength = 100;

    /** Extracted descriptions shorter than this count as missing. */
    @Min(0)
    private int minDescriptionLength = 50;

    /** Scraped text is cut to this many characters before extraction. */
    @Positive
    private int maxPageChars = 30000;
}
