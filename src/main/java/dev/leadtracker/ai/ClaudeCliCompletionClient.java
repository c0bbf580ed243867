package dev.leadtracker.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * TextCompletionClient that shells out to the {@code claude} command line tool in
 * print mode. Requested tools are passed through as {@code --allowedTools}.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "claude-cli")
public class ClaudeCliCompletionClient implements TextCompletionClient {

    private final String command;

    public ClaudeCliCompletionClient(@Value("${app.ai.claude-cli.command:claude}") String command) {
        this.command = command;
        log.info("Text completion through command line tool: {}", command);
    }

    @Override
    public Mono<Completion> complete(String prompt, Duration timeout, List<String> tools) {
        return Mono.fromCallable(() -> run(prompt, timeout, tools))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    log.warn("{} failed: {}", command, e.getMessage());
                    return Mono.just(Completion.failure(String.valueOf(e.getMessage())));
                });
    }

    @Override
    public boolean isEnabled() {
        return command != null && !command.isBlank();
    }

    List<String> commandLine(String prompt, List<String> tools) {
        List<String> line = new ArrayList<>(List.of(command, "-p", prompt));
        if (!tools.isEmpty()) {
            line.add("--allowedTools");
            line.add(String.join(",", tools));
        }
        return line;
    }

    /**
     * Runs the command on the calling thread. An interrupt kills the process and is
     * passed back to the caller through the thread's interrupt flag.
     */
    Completion run(String prompt, Duration timeout, List<String> tools) throws IOException, ExecutionException {
        Process process = new ProcessBuilder(commandLine(prompt, tools))
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));

        String output;
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("{} timed out after {}s", command, timeout.toSeconds());
                return Completion.failure("timed out after " + timeout.toSeconds() + "s");
            }
            output = stdout.get().trim();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            log.warn("{} interrupted, process killed", command);
            return Completion.failure("interrupted");
        }

        if (process.exitValue() != 0) {
            return Completion.failure(command + " exited with " + process.exitValue());
        }
        return output.isEmpty() ? Completion.failure("blank answer") : Completion.ok(output);
    }

    private static String readFully(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read process output", e);
        }
    }
}
