package dev.careerpath.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careerpath.config.AiConfig;
import dev.careerpath.metrics.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiTextClientTest {

    private static final String PATH = "/v1beta/models/%s:generateContent";

    private MockWebServer mockWebServer;
    private SimpleMeterRegistry meterRegistry;
    private AiConfig aiConfig;
    private GeminiTextClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        aiConfig = new AiConfig();
        aiConfig.setMaxRetries(0);
        aiConfig.setRetryBackoff(Duration.ofMillis(10));
        aiConfig.setMinInterval(Duration.ZERO);
        aiConfig.setDefaultTimeout(Duration.ofSeconds(5));

        meterRegistry = new SimpleMeterRegistry();
        client = createClient("test-api-key");
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private GeminiTextClient createClient(String apiKey) {
        String baseUrl = mockWebServer.url("/").toString();
        return new GeminiTextClient(apiKey, "gemini-flash-latest", baseUrl, PATH, aiConfig,
                new PipelineMetrics(meterRegistry), new ObjectMapper());
    }

    private static MockResponse textResponse(String text) {
        String body = """
                {
                    "candidates": [{
                        "content": { "parts": [{ "text": %s }] },
                        "finishReason": "STOP"
                    }]
                }
                """.formatted(new ObjectMapper().valueToTree(text).toString());
        return new MockResponse()
                .setBody(body)
                .setHeader("Content-Type", "application/json");
    }

    @Test
    @DisplayName("Should report enabled only when an API key is present")
    void shouldReportEnabledOnlyWithApiKey() {
        assertThat(client.isEnabled()).isTrue();
        assertThat(createClient("").isEnabled()).isFalse();
        assertThat(client.getName()).isEqualTo("gemini");
    }

    @Test
    @DisplayName("Should return generated text and send the key and model")
    void shouldReturnGeneratedText() throws InterruptedException {
        mockWebServer.enqueue(textResponse("Learn SQL first."));

        StepVerifier.create(client.generate("How do I become a data analyst?", GenerationOptions.defaults()))
                .assertNext(text -> assertThat(text).isEqualTo("Learn SQL first."))
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getPath()).isEqualTo("/v1beta/models/gemini-flash-latest:generateContent?key=test-api-key");
        assertThat(request.getBody().readUtf8()).contains("How do I become a data analyst?");
    }

    @Test
    @DisplayName("Should request JSON output and parse fenced JSON")
    void shouldParseFencedJson() throws InterruptedException {
        mockWebServer.enqueue(textResponse("```json\n{\"insights\": []}\n```"));

        StepVerifier.create(client.generateJson("extract", GenerationOptions.json(512, Duration.ofSeconds(5))))
                .assertNext(node -> assertThat(node.has("insights")).isTrue())
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"responseMimeType\":\"application/json\"");
        assertThat(body).contains("\"maxOutputTokens\":512");
    }

    @Test
    @DisplayName("Should fail with MALFORMED_RESPONSE when no candidates are returned")
    void shouldFailWhenNoCandidates() {
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"candidates\": []}")
                .setHeader("Content-Type", "application/json"));

        StepVerifier.create(client.generate("prompt", null))
                .expectErrorSatisfies(e -> assertThat(((ExternalServiceException) e).getKind())
                        .isEqualTo(ExternalServiceException.Kind.MALFORMED_RESPONSE))
                .verify();
    }

    @Test
    @DisplayName("Should fail with MALFORMED_RESPONSE when JSON was requested but prose returned")
    void shouldFailWhenJsonIsMissing() {
        mockWebServer.enqueue(textResponse("Sorry, I cannot help with that."));

        StepVerifier.create(client.generateJson("extract", null))
                .expectErrorSatisfies(e -> assertThat(((ExternalServiceException) e).getKind())
                        .isEqualTo(ExternalServiceException.Kind.MALFORMED_RESPONSE))
                .verify();

        assertThat(meterRegistry.counter("career_pipeline_api_errors_total",
                "provider", "gemini", "kind", "MALFORMED_RESPONSE").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should classify 403 as AUTH_ERROR without retrying")
    void shouldNotRetryAuthErrors() {
        aiConfig.setMaxRetries(2);
        client = createClient("test-api-key");
        mockWebServer.enqueue(new MockResponse().setResponseCode(403).setBody("forbidden"));

        StepVerifier.create(client.generate("prompt", null))
                .expectErrorSatisfies(e -> assertThat(((ExternalServiceException) e).getKind())
                        .isEqualTo(ExternalServiceException.Kind.AUTH_ERROR))
                .verify();

        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry server errors and succeed")
    void shouldRetryServerErrors() {
        aiConfig.setMaxRetries(2);
        client = createClient("test-api-key");
        mockWebServer.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
        mockWebServer.enqueue(textResponse("Recovered"));

        StepVerifier.create(client.generate("prompt", null))
                .assertNext(text -> assertThat(text).isEqualTo("Recovered"))
                .verifyComplete();

        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail with TIMEOUT when the provider is too slow")
    void shouldTimeOut() {
        mockWebServer.enqueue(textResponse("late").setBodyDelay(2, TimeUnit.SECONDS));

        GenerationOptions options = GenerationOptions.builder().timeout(Duration.ofMillis(200)).build();

        StepVerifier.create(client.generate("prompt", options))
                .expectErrorSatisfies(e -> assertThat(((ExternalServiceException) e).getKind())
                        .isEqualTo(ExternalServiceException.Kind.TIMEOUT))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should fail with AUTH_ERROR without calling the API when the key is missing")
    void shouldFailWithoutKey() {
        GeminiTextClient noKey = createClient("");

        StepVerifier.create(noKey.generate("prompt", null))
                .expectErrorSatisfies(e -> assertThat(((ExternalServiceException) e).getKind())
                        .isEqualTo(ExternalServiceException.Kind.AUTH_ERROR))
                .verify();

        assertThat(mockWebServer.getRequestCount()).isZero();
    }
}
