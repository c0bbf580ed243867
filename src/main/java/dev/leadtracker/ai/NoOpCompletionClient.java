package dev.leadtracker.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * No-op implementation of TextCompletionClient.
 * Every call fails, so searches find nothing and the filter keeps everything.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class NoOpCompletionClient implements TextCompletionClient {

    public NoOpCompletionClient() {
        log.info("Text completion disabled - using no-op client");
    }

    @Override
    public Mono<Completion> complete(String prompt, Duration timeout, List<String> tools) {
        return Mono.just(Completion.failure("text completion is disabled"));
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
