package dev.careerpath.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for narrative retrieval: where to look and how to phrase the queries.
 * Loaded from application.yml under 'sources' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourcesConfig {

    /**
     * One query is issued per target.
     */
    private List<Target> targets = new ArrayList<>();

    /**
     * Query phrasings with {current} and {target} placeholders, rotated across targets.
     */
    private List<String> phrasings = new ArrayList<>();

    private Duration queryTimeout = Duration.ofSeconds(45);
    private int maxContentLength = 5000;
    private int minContentLength = 50;
    private int maxTokens = 4096;

    @Data
    public static class Target {
        private String name;
        private String site;
    }
}
