package dev.leadtracker.ai;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GroqCompletionClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MockWebServer mockWebServer;
    private GroqCompletionClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        client = new GroqCompletionClient("groq-key", "llama-test",
                "http://" + mockWebServer.getHostName() + ":" + mockWebServer.getPort() + "/openai/v1");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    @DisplayName("Should return the first choice and authenticate with the key")
    void shouldReturnFirstChoice() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse()
                .setBody("""
                        {"choices": [{"message": {"role": "assistant", "content": "[0, 2]"}}]}
                        """)
                .setHeader("Content-Type", "application/json"));

        StepVerifier.create(client.complete("filter", TIMEOUT, List.of(TextCompletionClient.WEB_SEARCH)))
                .assertNext(completion -> {
                    assertThat(completion.success()).isTrue();
                    assertThat(completion.text()).isEqualTo("[0, 2]");
                })
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/openai/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer groq-key");
        assertThat(request.getBody().readUtf8()).contains("\"model\":\"llama-test\"").contains("filter");
    }

    @Test
    @DisplayName("Should fail on a blank answer")
    void shouldFailOnBlankAnswer() {
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"choices\": [{\"message\": {\"content\": \"  \"}}]}")
                .setHeader("Content-Type", "application/json"));

        StepVerifier.create(client.complete("filter", TIMEOUT))
                .assertNext(completion -> assertThat(completion.success()).isFalse())
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fail on an unauthorized response")
    void shouldFailOnClientError() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401));

        StepVerifier.create(client.complete("filter", TIMEOUT))
                .assertNext(completion -> assertThat(completion.success()).isFalse())
                .verifyComplete();
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should be disabled without a key")
    void shouldBeDisabledWithoutKey() {
        GroqCompletionClient disabled = new GroqCompletionClient("", "llama-test", "http://localhost");

        assertThat(disabled.isEnabled()).isFalse();
        StepVerifier.create(disabled.complete("filter", TIMEOUT))
                .assertNext(completion -> assertThat(completion.success()).isFalse())
                .verifyComplete();
    }
}
