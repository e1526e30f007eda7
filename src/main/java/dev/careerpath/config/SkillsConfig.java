package dev.careerpath.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Skill vocabulary and gap thresholds.
 * Loaded from skills.yml under 'skills' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "skills")
public class SkillsConfig {

    private List<SkillDefinition> vocabulary = new ArrayList<>();

    private int highMentionThreshold = 3;
    private double confidenceThreshold = 0.6;
    private int lowMentionThreshold = 2;
    private double sourceWeight = 0.5;
    private double mentionWeight = 0.1;
    private int maxSkills = 15;

    @Data
    public static class SkillDefinition {
        /**
         * Canonical display name, e.g. "Machine Learning".
         */
        private String name;
        private List<String> aliases = new ArrayList<>();
    }
}
