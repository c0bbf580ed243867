package dev.leadtracker.ai;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * A natural-language model behind a prompt-in, text-out call.
 * <p>
 * Implementations never signal errors through the returned Mono: timeouts, HTTP
 * errors and empty answers all complete with {@link Completion#failure}.
 */
public interface TextCompletionClient {

    /** Tool name for web search, understood by providers that support it. */
    String WEB_SEARCH = "WebSearch";

    /** Tool name for fetching a page, understood by providers that support it. */
    String WEB_FETCH = "WebFetch";

    /**
     * Run a prompt.
     *
     * @param prompt  full prompt text
     * @param timeout upper bound for the whole call, retries included
     * @param tools   tools the model may use; unsupported ones are ignored
     */
    Mono<Completion> complete(String prompt, Duration timeout, List<String> tools);

    default Mono<Completion> complete(String prompt, Duration timeout) {
        return complete(prompt, timeout, List.of());
    }

    /**
     * Check if the provider is configured well enough to be called.
     */
    boolean isEnabled();
}
