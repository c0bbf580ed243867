package dev.leadtracker.service;

import dev.leadtracker.ai.TextCompletionClient;
import dev.leadtracker.config.IngestionProperties;
import dev.leadtracker.scrape.Scraper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Fetches a posting page and has the model cut the job description out of it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DescriptionEnricher {

    private final Scraper scraper;
    private final TextCompletionClient completionClient;
    private final IngestionProperties properties;

    /**
     * Full description for the posting at {@code link}, or an empty string when the
     * page cannot be scraped, is too short, or holds no recognizable description.
     * Never errors.
     */
    public Mono<String> fullDescription(String link) {
        if (link == null || link.isBlank()) {
            return Mono.just("");
        }

        return scraper.fetch(link)
                .onErrorResume(e -> {
                    log.warn("    Could not scrape {}: {}", link, e.getMessage());
                    return Mono.just("");
                })
                .defaultIfEmpty("")
                .flatMap(pageText -> {
                    if (pageText.length() < properties.getMinScrapedLength()) {
                        log.debug("    Page {} too short to hold a description ({} chars)", link, pageText.length());
                        return Mono.just("");
                    }
                    return extract(link, truncate(pageText));
                });
    }

    private Mono<String> extract(String link, String pageText) {
        return completionClient.complete(IngestionPrompts.extractDescription(pageText), properties.getExtractTimeout())
                .map(completion -> {
                    if (!completion.success()) {
                        log.warn("    Description extraction failed for {}: {}", link, completion.text());
                        return "";
                    }
                    String description = completion.text().strip();
                    if (IngestionPrompts.NO_DESCRIPTION.equals(description)
                            || description.length() < properties.getMinDescriptionLength()) {
                        return "";
                    }
                    return description;
                })
                .onErrorResume(e -> {
                    log.warn("    Description extraction failed for {}: {}", link, e.getMessage());
                    return Mono.just("");
                });
    }

    private String truncate(String pageText) {
        int max = properties.getMaxPageChars();
        return pageText.length() > max ? pageText.substring(0, max) : pageText;
    }
}
