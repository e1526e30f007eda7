package dev.careerpath.ai;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Client used when no provider is configured. Every call fails with AUTH_ERROR,
 * so stages fall back or fail the same way they would with a missing key.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class DisabledTextClient implements TextGenerationClient {

    public DisabledTextClient() {
        log.info("Text generation disabled - no provider configured");
    }

    @Override
    public Mono<String> generate(String prompt, GenerationOptions options) {
        return Mono.error(notConfigured());
    }

    @Override
    public Mono<JsonNode> generateJson(String prompt, GenerationOptions options) {
        return Mono.error(notConfigured());
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String getName() {
        return "none";
    }

    private ExternalServiceException notConfigured() {
        return new ExternalServiceException(ExternalServiceException.Kind.AUTH_ERROR,
                "No text-generation provider configured");
    }
}
