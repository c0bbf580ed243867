package dev.leadtracker.scrape;

import reactor.core.publisher.Mono;

/**
 * Fetches the readable text of a web page.
 */
public interface Scraper {

    /**
     * @return the page text, one non-empty line per block; errors on network or HTTP failure
     */
    Mono<String> fetch(String url);
}
