package dev.leadtracker.scrape;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JsoupScraperTest {

    private MockWebServer mockWebServer;
    private JsoupScraper scraper;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        scraper = new JsoupScraper(WebClient.builder(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Nested
    @DisplayName("Fetching pages")
    class Fetching {

        @Test
        @DisplayName("Should download the page as a browser and return its text")
        void shouldFetchText() throws InterruptedException {
            mockWebServer.enqueue(new MockResponse()
                    .setBody("<html><body><h1>Backend Engineer</h1><p>Build payment APIs.</p></body></html>")
                    .setHeader("Content-Type", "text/html"));

            StepVerifier.create(scraper.fetch(mockWebServer.url("/jobs/1").toString()))
                    .expectNext("Backend Engineer\nBuild payment APIs.")
                    .verifyComplete();

            RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
            assertThat(request.getHeader("User-Agent")).contains("Mozilla/5.0");
        }

        @Test
        @DisplayName("Should error on a missing page")
        void shouldErrorOnNotFound() {
            mockWebServer.enqueue(new MockResponse().setResponseCode(404));

            StepVerifier.create(scraper.fetch(mockWebServer.url("/gone").toString()))
                    .expectError(WebClientResponseException.NotFound.class)
                    .verify();
        }

        @Test
        @DisplayName("Should return empty text for an empty body")
        void shouldHandleEmptyBody() {
            mockWebServer.enqueue(new MockResponse().setResponseCode(200));

            StepVerifier.create(scraper.fetch(mockWebServer.url("/empty").toString()))
                    .expectNext("")
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Converting HTML")
    class Converting {

        @Test
        @DisplayName("Should put block elements on their own lines")
        void shouldSplitBlocks() {
            String text = JsoupScraper.toText("""
                    <div>Acme <b>Corp</b></div>
                    <ul><li>Java</li><li>Kafka</li></ul>
                    <p>Remote<br>Europe</p>
                    """);

            assertThat(text).isEqualTo("Acme Corp\nJava\nKafka\nRemote\nEurope");
        }

        @Test
        @DisplayName("Should drop scripts, styles and blank lines")
        void shouldDropNoise() {
            String text = JsoupScraper.toText("""
                    <html><head><style>body { color: red }</style></head>
                    <body>
                      <script>window.track = true;</script>
                      <noscript>Enable JavaScript</noscript>
                      <p>   Senior Engineer   </p>


                      <p>Apply now</p>
                    </body></html>
                    """);

            assertThat(text).isEqualTo("Senior Engineer\nApply now");
        }
    }
}
