package dev.careerpath.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Shared settings for text-generation providers.
 * Provider specific values (api key, model, base url) are read by each client.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.ai")
public class AiConfig {

    /**
     * Active provider: gemini, perplexity or none.
     */
    private String provider = "none";

    /**
     * Maximum number of calls in flight per client, shared by all runs.
     */
    private int concurrencyLimit = 4;

    /**
     * Minimum spacing between two call starts.
     */
    private Duration minInterval = Duration.ofMillis(250);

    private int maxRetries = 2;
    private Duration retryBackoff = Duration.ofSeconds(2);

    /**
     * Per-call timeout used when the caller does not set one.
     */
    private Duration defaultTimeout = Duration.ofSeconds(60);

    private int defaultMaxTokens = 2048;
    private double defaultTemperature = 0.3;
}
