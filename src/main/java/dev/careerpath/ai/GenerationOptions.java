package dev.careerpath.ai;

import lombok.Builder;

import java.time.Duration;

/**
 * Per-call generation settings. Null fields fall back to the client's configured defaults.
 */
@Builder(toBuilder = true)
public record GenerationOptions(
        String model,
        Integer maxTokens,
        Double temperature,
        ResponseFormat responseFormat,
        Duration timeout) {

    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }

    public static GenerationOptions json(int maxTokens, Duration timeout) {
        return GenerationOptions.builder()
                .maxTokens(maxTokens)
                .responseFormat(ResponseFormat.JSON)
                .timeout(timeout)
                .build();
    }

    public boolean wantsJson() {
        return responseFormat == ResponseFormat.JSON;
    }
}
