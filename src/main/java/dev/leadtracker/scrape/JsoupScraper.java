package dev.leadtracker.scrape;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.TextNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Scraper that downloads with WebClient and flattens the HTML to text with Jsoup.
 */
@Slf4j
@Component
public class JsoupScraper implements Scraper {

    private static final String USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36";

    private static final String BLOCK_ELEMENTS = "br, p, div, li, tr, section, article, h1, h2, h3, h4, h5, h6";

    private final WebClient webClient;
    private final Duration timeout;

    public JsoupScraper(WebClient.Builder webClientBuilder,
            @Value("${scraper.timeout:30s}") Duration timeout) {
        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .defaultHeader("User-Agent", USER_AGENT)
                .defaultHeader("Accept", "text/html,application/xhtml+xml,*/*;q=0.8")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> fetch(String url) {
        return webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .defaultIfEmpty("")
                .map(JsoupScraper::toText)
                .doOnNext(text -> log.debug("Scraped {} chars from {}", text.length(), url));
    }

    static String toText(String html) {
        Document document = Jsoup.parse(html);
        document.select("script, style, noscript").remove();
        document.select(BLOCK_ELEMENTS).forEach(element -> element.after(new TextNode("\n")));
        String raw = document.body() == null ? "" : document.body().wholeText();
        return Arrays.stream(raw.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }
}
