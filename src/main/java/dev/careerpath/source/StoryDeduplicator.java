package dev.careerpath.source;

import dev.careerpath.model.ScrapedData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Removes narratives returned by more than one query. First occurrence wins.
 */
@Slf4j
@Component
public class StoryDeduplicator {

    public List<ScrapedData> deduplicate(List<ScrapedData> stories) {
        if (stories.isEmpty()) {
            return List.of();
        }

        Map<String, ScrapedData> unique = new LinkedHashMap<>();
        for (ScrapedData story : stories) {
            unique.putIfAbsent(keyOf(story), story);
        }

        log.info("Deduplication: {} total stories, {} duplicates, {} unique",
                stories.size(), stories.size() - unique.size(), unique.size());
        return new ArrayList<>(unique.values());
    }

    /**
     * (source, url) with the source compared case-insensitively; stories without url use their content.
     */
    private String keyOf(ScrapedData story) {
        String source = story.source() == null ? "" : story.source().trim().toLowerCase(Locale.ROOT);
        String identity = story.url() != null ? "url:" + story.url() : "content:" + story.content();
        return source + "|" + identity;
    }
}
