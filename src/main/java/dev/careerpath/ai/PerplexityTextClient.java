package dev.careerpath.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.careerpath.config.AiConfig;
import dev.careerpath.metrics.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Text generation and web search through the Perplexity API.
 * Perplexity exposes an OpenAI-compatible chat completions endpoint backed by live search,
 * which makes it the preferred provider for narrative retrieval.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "perplexity")
public class PerplexityTextClient extends AbstractTextClient {

  private static final String NAME = "perplexity";
  private static final String SYSTEM_PROMPT = "You are a career research assistant. Be precise and cite real sources.";
  private static final String JSON_SYSTEM_PROMPT =
      "You are a data extraction assistant. Respond with valid JSON only, without markdown or commentary.";

  private final WebClient webClient;
  private final String apiKey;
  private final String model;

  public PerplexityTextClient(
      @Value("${app.ai.perplexity.api-key:}") String apiKey,
      @Value("${app.ai.perplexity.model:sonar}") String model,
      @Value("${app.ai.perplexity.base-url:https://api.perplexity.ai}") String baseUrl,
      AiConfig aiConfig,
      PipelineMetrics metrics,
      ObjectMapper objectMapper) {
    super(aiConfig, metrics, objectMapper);
    this.apiKey = apiKey;
    this.model = model;
    this.webClient = WebClient.builder()
        .baseUrl(Objects.requireNonNull(baseUrl))
        .defaultHeader("Authorization", "Bearer " + apiKey)
        .defaultHeader("Content-Type", "application/json")
        .codecs(config -> config.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
        .build();

    if (apiKey == null || apiKey.isBlank()) {
      log.warn("Perplexity API Key is missing! Text generation will fail.");
    } else {
      log.info("Perplexity text generation enabled with model: {}", this.model);
    }
  }

  @Override
  protected Mono<String> call(String prompt, GenerationOptions options) {
    return webClient.post()
        .uri("/chat/completions")
        .bodyValue(Objects.requireNonNull(buildRequest(prompt, options)))
        .retrieve()
        .bodyToMono(ChatResponse.class)
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

  private ChatRequest buildRequest(String prompt, GenerationOptions options) {
    List<Message> messages = new ArrayList<>();
    messages.add(new Message("system", options.wantsJson() ? JSON_SYSTEM_PROMPT : SYSTEM_PROMPT));
    messages.add(new Message("user", prompt));
    return new ChatRequest(options.model(), messages, options.maxTokens(), options.temperature());
  }

  private String extractContent(ChatResponse response) {
    if (response != null && response.choices() != null && !response.choices().isEmpty()
        && response.choices().get(0).message() != null) {
      return response.choices().get(0).message().content();
    }
    log.warn("Perplexity returned no choices");
    return null;
  }

  // OpenAI Compatible DTOs
  record ChatRequest(
      String model,
      List<Message> messages,
      @JsonProperty("max_tokens") Integer maxTokens,
      Double temperature) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Message(String role, String content) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ChatResponse(List<Choice> choices) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
    }
  }
}
