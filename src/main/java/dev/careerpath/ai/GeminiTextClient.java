package dev.careerpath.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careerpath.config.AiConfig;
import dev.careerpath.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Text generation through the Google AI Studio (Gemini) REST API.
 * Uses simple API key authentication - no service account required.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiTextClient extends AbstractTextClient {

    private static final String NAME = "gemini";

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String geminiPath;

    public GeminiTextClient(
            @Value("${app.ai.gemini.api-key:}") String apiKey,
            @Value("${app.ai.gemini.model:gemini-flash-latest}") String model,
            @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath,
            AiConfig aiConfig,
            PipelineMetrics metrics,
            ObjectMapper objectMapper) {
        super(aiConfig, metrics, objectMapper);
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .codecs(config -> config.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! Text generation will fail.");
        } else {
            log.info("Gemini text generation enabled with model: {} (Key present)", this.model);
        }
    }

    @Override
    protected Mono<String> call(String prompt, GenerationOptions options) {
        GeminiRequest request = buildRequest(prompt, options);
        String uri = String.format(geminiPath, options.model()) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(Objects.requireNonNull(request))
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .mapNotNull(this::extractContent);
    }

    @Override
    protected String defaultModel() {
        return model;
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String getName() {
        return NAME;
    }

    private GeminiRequest buildRequest(String prompt, GenerationOptions options) {
        return new GeminiRequest(List.of(
                new GeminiRequest.Content(List.of(
                        new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(
                        options.temperature(),
                        options.maxTokens(),
                        options.wantsJson() ? "application/json" : null));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            log.warn("Gemini returned no candidates or null response");
            return null;
        }

        var candidate = response.candidates().get(0);

        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            log.warn("Gemini candidate has no content parts. Finish reason: {}", candidate.finishReason());
            return null;
        }

        return candidate.content().parts().get(0).text();
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record GenerationConfig(Double temperature, Integer maxOutputTokens, String responseMimeType) {
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
