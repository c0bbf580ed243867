package dev.leadtracker.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;

/**
 * TextCompletionClient over the Groq Cloud chat completions API.
 * Groq has no tool use here, so search prompts rely on the model's own knowledge.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "groq")
public class GroqCompletionClient implements TextCompletionClient {

  private static final String CHAT_PATH = "/chat/completions";

  private final WebClient webClient;
  private final String apiKey;
  private final String model;

  public GroqCompletionClient(
      @Value("${app.ai.groq.api-key:}") String apiKey,
      @Value("${app.ai.groq.model:llama-3.3-70b-versatile}") String model,
      @Value("${app.ai.groq.base-url:https://api.groq.com/openai/v1}") String baseUrl) {

    this.apiKey = apiKey;
    this.model = model;
    this.webClient = WebClient.builder()
        .baseUrl(baseUrl)
        .defaultHeader("Authorization", "Bearer " + apiKey)
        .defaultHeader("Content-Type", "application/json")
        .build();

    if (apiKey == null || apiKey.isBlank()) {
      log.warn("Groq API Key is missing! Every completion will fail.");
    } else {
      log.info("Groq text completion enabled with model: {}", this.model);
    }
  }

  @Override
  public Mono<Completion> complete(String prompt, Duration timeout, List<String> tools) {
    if (!isEnabled()) {
      return Mono.just(Completion.failure("Groq API key is not configured"));
    }
    if (!tools.isEmpty()) {
      log.debug("Groq ignores requested tools {}", tools);
    }

    // max_tokens is for the RESPONSE
    GroqRequest request = new GroqRequest(model, List.of(new GroqRequest.Message("user", prompt)), 0.2, 4096);

    return webClient.post()
        .uri(CHAT_PATH)
        .bodyValue(request)
        .retrieve()
        .bodyToMono(GroqResponse.class)
        .retryWhen(Retry.backoff(2, Duration.ofSeconds(2)).filter(this::isRetryableError))
        .timeout(timeout)
        .map(response -> {
          String content = extractContent(response);
          return content == null || content.isBlank()
              ? Completion.failure("blank answer")
              : Completion.ok(content);
        })
        .onErrorResume(e -> {
          log.warn("Groq completion failed: {}", e.getMessage());
          return Mono.just(Completion.failure(String.valueOf(e.getMessage())));
        });
  }

  private String extractContent(GroqResponse response) {
    if (response != null && response.choices() != null && !response.choices().isEmpty()
        && response.choices().get(0).message() != null) {
      return response.choices().get(0).message().content();
    }
    return null;
  }

  private boolean isRetryableError(Throwable e) {
    if (e instanceof WebClientResponseException responseException) {
      int status = responseException.getStatusCode().value();
      return status == 429 || status >= 500;
    }
    return false;
  }

  @Override
  public boolean isEnabled() {
    return apiKey != null && !apiKey.isBlank();
  }

  // DTOs
  record GroqRequest(String model, List<Message> messages, double temperature, int max_tokens) {
    record Message(String role, String content) {
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record GroqResponse(List<Choice> choices) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
      @JsonIgnoreProperties(ignoreUnknown = true)
      record Message(String content) {
      }
    }
  }
}
