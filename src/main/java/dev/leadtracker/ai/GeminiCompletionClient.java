package dev.leadtracker.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * TextCompletionClient over the Google AI Studio (Gemini) REST API.
 * Uses simple API key authentication. Web search is mapped to Gemini's
 * {@code google_search} grounding tool.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiCompletionClient implements TextCompletionClient {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String geminiPath;
    private final int maxRetries;
    private final Duration retryBackoff;

    @Autowired
    public GeminiCompletionClient(
            @Value("${app.ai.gemini.api-key:}") String apiKey,
            @Value("${app.ai.gemini.model:gemini-flash-latest}") String model,
            @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath) {
        this(apiKey, model, baseUrl, geminiPath, 3, Duration.ofSeconds(2));
    }

    GeminiCompletionClient(String apiKey, String model, String baseUrl, String geminiPath,
            int maxRetries, Duration retryBackoff) {
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);
        this.maxRetries = maxRetries;
        this.retryBackoff = retryBackoff;

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! Every completion will fail.");
        } else {
            log.info("Gemini text completion enabled with model: {} (Key present)", this.model);
        }
    }

    @Override
    public Mono<Completion> complete(String prompt, Duration timeout, List<String> tools) {
        if (!isEnabled()) {
            return Mono.just(Completion.failure("Gemini API key is not configured"));
        }

        GeminiRequest request = buildRequest(prompt, tools);
        String uri = String.format(geminiPath, model) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .retryWhen(Retry.backoff(maxRetries, retryBackoff)
                        .filter(this::isRetryableError)
                        .doBeforeRetry(retrySignal -> log.info("Retrying Gemini call (Attempt {})",
                                retrySignal.totalRetries() + 1)))
                .timeout(timeout)
                .map(this::toCompletion)
                .onErrorResume(e -> {
                    log.warn("Gemini completion failed: {}", e.getMessage());
                    return Mono.just(Completion.failure(String.valueOf(e.getMessage())));
                });
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    private GeminiRequest buildRequest(String prompt, List<String> tools) {
        List<Map<String, Object>> geminiTools = tools.contains(WEB_SEARCH)
                ? List.of(Map.of("google_search", Map.of()))
                : List.of();
        return new GeminiRequest(
                List.of(new GeminiRequest.Content(List.of(new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(0.3, 8192),
                geminiTools);
    }

    private Completion toCompletion(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            log.warn("Gemini returned no candidates or null response");
            return Completion.failure("no candidates");
        }

        var candidate = response.candidates().get(0);

        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            return Completion.failure("empty candidate, finish reason " + candidate.finishReason());
        }

        // grounded answers arrive split over several parts
        String text = candidate.content().parts().stream()
                .map(GeminiResponse.Candidate.Content.Part::text)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());

        return text.isBlank() ? Completion.failure("blank answer") : Completion.ok(text);
    }

    private boolean isRetryableError(Throwable e) {
        if (e instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return false;
    }

    // Request DTOs
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig,
            List<Map<String, Object>> tools) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(
                Content content,
                String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
