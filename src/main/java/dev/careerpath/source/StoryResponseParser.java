package dev.careerpath.source;

import dev.careerpath.config.SourcesConfig;
import dev.careerpath.model.ScrapedData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a retrieval response into narratives.
 *
 * Expected layout, one block per story:
 * <pre>
 * Source: Reddit
 * URL: https://...
 * Date: 2024-03-01
 * Content: full story text, possibly spanning lines
 * </pre>
 * Labels may carry list bullets or markdown bold. A response without any labels is one narrative.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoryResponseParser {

    private static final Pattern LABEL = Pattern.compile(
            "^\\s*(?:[-*•]|\\d+\\.)?\\s*\\**\\s*(source|url|date|content)\\s*\\**\\s*:\\s*\\**\\s*(.*)$",
            Pattern.CASE_INSENSITIVE);

    private final SourcesConfig sourcesConfig;

    public List<ScrapedData> parse(String response, String defaultSource) {
        if (response == null || response.isBlank()) {
            return List.of();
        }

        List<Block> blocks = splitBlocks(response);
        if (blocks.isEmpty()) {
            Block whole = new Block();
            whole.content.append(response);
            blocks.add(whole);
        }

        List<ScrapedData> stories = new ArrayList<>();
        for (Block block : blocks) {
            String content = clean(block.content.toString());
            if (content.length() < sourcesConfig.getMinContentLength()) {
                log.debug("Dropping short narrative from {} ({} chars)", defaultSource, content.length());
                continue;
            }
            stories.add(ScrapedData.builder()
                    .source(isBlank(block.source) ? defaultSource : stripMarkup(block.source))
                    .url(normalizeUrl(block.url))
                    .postDate(isBlank(block.date) ? null : stripMarkup(block.date))
                    .content(content)
                    .build());
        }
        return stories;
    }

    private List<Block> splitBlocks(String response) {
        List<Block> blocks = new ArrayList<>();
        Block current = null;
        boolean inContent = false;

        for (String line : response.split("\\R")) {
            Matcher matcher = LABEL.matcher(line);
            if (matcher.matches()) {
                String label = matcher.group(1).toLowerCase(Locale.ROOT);
                String value = matcher.group(2).trim();
                if ("source".equals(label) || current == null) {
                    current = new Block();
                    blocks.add(current);
                }
                inContent = false;
                switch (label) {
                    case "source":
                        current.source = value;
                        break;
                    case "url":
                        current.url = value;
                        break;
                    case "date":
                        current.date = value;
                        break;
                    default:
                        current.content.append(value).append('\n');
                        inContent = true;
                }
            } else if (current != null && (inContent || !line.isBlank())) {
                current.content.append(line).append('\n');
            }
        }
        return blocks;
    }

    private String clean(String content) {
        String text = Jsoup.parse(content).text().trim();
        int max = sourcesConfig.getMaxContentLength();
        return text.length() > max ? text.substring(0, max) : text;
    }

    private String normalizeUrl(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String url = raw.trim().replaceAll("^[<(\\[]+", "").replaceAll("[>)\\].,;]+$", "");
        return url.toLowerCase(Locale.ROOT).startsWith("http") ? url : null;
    }

    private String stripMarkup(String value) {
        return value.replace("*", "").trim();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class Block {
        private String source;
        private String url;
        private String date;
        private final StringBuilder content = new StringBuilder();
    }
}
