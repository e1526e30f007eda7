package dev.careerpath.ai;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Uniform access to a text-generation or search provider.
 * Implementations report every failure as an {@link ExternalServiceException}.
 */
public interface TextGenerationClient {

    /**
     * Generate raw text for a prompt.
     *
     * @param prompt  The prompt to send
     * @param options Generation settings, null fields use the configured defaults
     * @return Mono with the non-empty response text
     */
    Mono<String> generate(String prompt, GenerationOptions options);

    /**
     * Generate a JSON document for a prompt. Markdown fences and surrounding prose are tolerated;
     * anything that does not contain a JSON object or array fails with MALFORMED_RESPONSE.
     *
     * @param prompt  The prompt to send
     * @param options Generation settings, the response format is forced to JSON
     * @return Mono with the parsed object or array
     */
    Mono<JsonNode> generateJson(String prompt, GenerationOptions options);

    /**
     * Check if the provider is configured and can be called.
     */
    boolean isEnabled();

    String getName();
}
