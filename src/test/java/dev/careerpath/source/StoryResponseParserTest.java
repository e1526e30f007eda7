package dev.careerpath.source;

import dev.careerpath.config.SourcesConfig;
import dev.careerpath.model.ScrapedData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StoryResponseParserTest {

    private static final String LONG_STORY =
            "I spent six years teaching high school math before moving into data analysis. "
                    + "SQL and Python were the first things I learned.";

    private SourcesConfig sourcesConfig;
    private StoryResponseParser parser;

    @BeforeEach
    void setUp() {
        sourcesConfig = new SourcesConfig();
        parser = new StoryResponseParser(sourcesConfig);
    }

    @Test
    @DisplayName("Should split labelled blocks into narratives")
    void shouldParseLabelledBlocks() {
        String response = """
                Here are some stories I found:

                Source: Reddit
                URL: https://reddit.com/r/datascience/abc
                Date: 2024-02-11
                Content: %s

                **Source:** Quora
                **URL:** <https://quora.com/How-did-you-switch>
                **Date:** March 2023
                **Content:** %s
                It took me about a year.
                """.formatted(LONG_STORY, LONG_STORY);

        List<ScrapedData> stories = parser.parse(response, "Reddit");

        assertThat(stories).hasSize(2);
        assertThat(stories.get(0).source()).isEqualTo("Reddit");
        assertThat(stories.get(0).url()).isEqualTo("https://reddit.com/r/datascience/abc");
        assertThat(stories.get(0).postDate()).isEqualTo("2024-02-11");
        assertThat(stories.get(1).source()).isEqualTo("Quora");
        assertThat(stories.get(1).url()).isEqualTo("https://quora.com/How-did-you-switch");
        assertThat(stories.get(1).content()).contains("It took me about a year.");
    }

    @Test
    @DisplayName("Should treat a response without labels as one narrative from the query source")
    void shouldTreatUnlabelledResponseAsOneNarrative() {
        List<ScrapedData> stories = parser.parse(LONG_STORY, "Medium");

        assertThat(stories).hasSize(1);
        assertThat(stories.get(0).source()).isEqualTo("Medium");
        assertThat(stories.get(0).url()).isNull();
        assertThat(stories.get(0).content()).isEqualTo(LONG_STORY);
    }

    @Test
    @DisplayName("Should drop urls that are not http links")
    void shouldDropNonHttpUrls() {
        String response = "Source: Blind\nURL: not available\nContent: " + LONG_STORY;

        List<ScrapedData> stories = parser.parse(response, "Blind");

        assertThat(stories).hasSize(1);
        assertThat(stories.get(0).url()).isNull();
    }

    @Test
    @DisplayName("Should strip HTML and drop narratives that are too short")
    void shouldStripHtmlAndDropShortContent() {
        String response = """
                Source: Reddit
                Content: <p>%s</p>
                Source: Reddit
                Content: Too short.
                """.formatted(LONG_STORY);

        List<ScrapedData> stories = parser.parse(response, "Reddit");

        assertThat(stories).hasSize(1);
        assertThat(stories.get(0).content()).doesNotContain("<p>").startsWith("I spent six years");
    }

    @Test
    @DisplayName("Should truncate content to the configured maximum")
    void shouldTruncateLongContent() {
        sourcesConfig.setMaxContentLength(60);

        List<ScrapedData> stories = parser.parse(LONG_STORY, "Reddit");

        assertThat(stories.get(0).content()).hasSize(60);
    }

    @Test
    @DisplayName("Should return nothing for blank responses")
    void shouldReturnEmptyForBlank() {
        assertThat(parser.parse("  ", "Reddit")).isEmpty();
        assertThat(parser.parse(null, "Reddit")).isEmpty();
    }
}
