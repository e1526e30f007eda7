package dev.careerpath.model;

import lombok.Builder;

import java.util.Set;

/**
 * One retrieved transition narrative.
 *
 * @param source          platform the story came from (Reddit, Quora, ...)
 * @param content         plain-text story body
 * @param url             link to the original post, if the provider gave one
 * @param postDate        publication date as reported by the provider
 * @param skillsExtracted canonical skill names found by the keyword pass
 */
@Builder(toBuilder = true)
public record ScrapedData(
        String source,
        String content,
        String url,
        String postDate,
        Set<String> skillsExtracted) {

    public ScrapedData {
        skillsExtracted = skillsExtracted == null ? Set.of() : Set.copyOf(skillsExtracted);
    }
}
