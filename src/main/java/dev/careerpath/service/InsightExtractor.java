package dev.careerpath.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.careerpath.ai.ExternalServiceException;
import dev.careerpath.ai.GenerationOptions;
import dev.careerpath.ai.TextGenerationClient;
import dev.careerpath.config.PipelineConfig;
import dev.careerpath.metrics.PipelineMetrics;
import dev.careerpath.model.Insight;
import dev.careerpath.model.InsightType;
import dev.careerpath.model.ScrapedData;
import dev.careerpath.pipeline.RunCancelledException;
import dev.careerpath.pipeline.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns narratives into typed insights. Malformed model output is retried once with a stricter
 * instruction; anything still unusable is dropped without failing the stage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InsightExtractor {

    static final String OVERVIEW_SOURCE = "Transition Overview";
    private static final String STAGE = "insights";
    private static final int OVERVIEW_STORY_CHARS = 1500;

    private final TextGenerationClient textClient;
    private final PipelineConfig pipelineConfig;
    private final PipelineMetrics metrics;

    /**
     * Extract insights from every narrative plus the optional overview, keeping whatever
     * completes before the deadline.
     */
    public Mono<List<Insight>> extract(RunContext context, List<ScrapedData> stories, Duration deadline) {
        PipelineConfig.Insights settings = pipelineConfig.getInsights();
        log.info("Extracting insights from {} stories (concurrency {})", stories.size(), settings.getConcurrency());

        Flux<Insight> perStory = Flux.fromIterable(stories)
                .flatMap(story -> extractFromStory(context, story), Math.max(1, settings.getConcurrency()))
                .flatMapIterable(insights -> insights);

        Flux<Insight> overview = settings.isOverviewEnabled() && !stories.isEmpty()
                ? overview(context, stories).flatMapIterable(insights -> insights)
                : Flux.empty();

        return Flux.merge(perStory, overview)
                .take(deadline)
                .collectList()
                .map(List::copyOf)
                .doOnNext(insights -> {
                    metrics.recordInsightsExtracted(insights.size());
                    log.info("Extracted {} insights", insights.size());
                });
    }

    Mono<List<Insight>> extractFromStory(RunContext context, ScrapedData story) {
        return attempt(context, story, false)
                .onErrorResume(this::isMalformed, e -> {
                    log.debug("Malformed insight output for {}, retrying with strict prompt: {}",
                            story.source(), e.getMessage());
                    return attempt(context, story, true);
                })
                .onErrorResume(e -> !(e instanceof RunCancelledException), e -> {
                    log.warn("Dropping story from {} after extraction failure: {}", story.source(), e.getMessage());
                    metrics.recordItemDropped(STAGE);
                    return Mono.just(List.of());
                });
    }

    private Mono<List<Insight>> attempt(RunContext context, ScrapedData story, boolean strict) {
        String prompt = buildStoryPrompt(context, story, strict);
        GenerationOptions options = GenerationOptions.json(pipelineConfig.getInsights().getMaxTokens(), null)
                .toBuilder()
                .temperature(strict ? 0.0 : null)
                .build();
        return context.guard(() -> textClient.generateJson(prompt, options))
                .map(node -> parseInsights(node, story));
    }

    /**
     * Accepts {"insights":[...]} or a bare array. Invalid elements are skipped; a payload whose
     * elements are all invalid is malformed.
     */
    List<Insight> parseInsights(JsonNode node, ScrapedData story) {
        JsonNode items = node.isArray() ? node : node.get("insights");
        if (items == null || !items.isArray()) {
            throw malformed("Expected an insights array");
        }

        int max = pipelineConfig.getInsights().getMaxPerStory();
        List<Insight> insights = new ArrayList<>();
        int invalid = 0;
        for (JsonNode item : items) {
            Insight insight = toInsight(item, story);
            if (insight == null) {
                invalid++;
            } else if (insights.size() < max) {
                insights.add(insight);
            }
        }

        if (insights.isEmpty() && invalid > 0) {
            throw malformed("All " + invalid + " insight elements were invalid");
        }
        if (invalid > 0) {
            log.debug("Skipped {} invalid insight elements from {}", invalid, story.source());
        }
        return insights;
    }

    private Insight toInsight(JsonNode item, ScrapedData story) {
        if (item == null || !item.isObject()) {
            return null;
        }
        InsightType type = InsightType.fromValue(item.path("type").asText(null)).orElse(null);
        String content = item.path("content").asText("").trim();
        if (type == null || content.isEmpty()) {
            return null;
        }
        String date = item.path("date").asText("").trim();
        return Insight.builder()
                .type(type)
                .content(content)
                .source(story.source())
                .url(story.url())
                .date(date.isEmpty() ? story.postDate() : date)
                .experienceYears(readExperienceYears(item.get("experienceYears")))
                .build();
    }

    private Integer readExperienceYears(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt() >= 0 ? node.asInt() : null;
        }
        String text = node.asText("").replaceAll("[^0-9]", "");
        return text.isEmpty() || text.length() > 2 ? null : Integer.valueOf(text);
    }

    /**
     * One aggregate call over all narratives. Failure only costs the overview insights.
     */
    Mono<List<Insight>> overview(RunContext context, List<ScrapedData> stories) {
        GenerationOptions options = GenerationOptions.json(pipelineConfig.getInsights().getMaxTokens(), null);
        return context.guard(() -> textClient.generateJson(buildOverviewPrompt(context, stories), options))
                .map(this::parseOverview)
                .onErrorResume(e -> !(e instanceof RunCancelledException), e -> {
                    log.warn("Transition overview failed: {}", e.getMessage());
                    metrics.recordItemDropped(STAGE);
                    return Mono.just(List.of());
                });
    }

    List<Insight> parseOverview(JsonNode node) {
        if (!node.isObject()) {
            throw malformed("Expected an overview object");
        }
        List<Insight> insights = new ArrayList<>();

        JsonNode successRate = node.get("successRate");
        if (successRate != null && successRate.isNumber()) {
            double rate = Math.min(Math.max(successRate.asDouble(), 0), 100);
            insights.add(overviewInsight(InsightType.OBSERVATION,
                    String.format("About %.0f%% of the reported transitions succeeded", rate)));
        }

        JsonNode months = node.get("avgTransitionMonths");
        if (months != null && months.isNumber()) {
            double value = Math.max(months.asDouble(), 1);
            insights.add(overviewInsight(InsightType.OBSERVATION,
                    String.format("Transitions took about %.0f months on average", value)));
        }

        for (JsonNode path : node.path("commonPaths")) {
            String description = path.path("path").asText("").trim();
            if (!description.isEmpty()) {
                int count = Math.max(path.path("count").asInt(1), 1);
                insights.add(overviewInsight(InsightType.STORY,
                        String.format("Common path (%d mentions): %s", count, description)));
            }
        }

        for (JsonNode challenge : node.path("commonChallenges")) {
            String description = challenge.asText("").trim();
            if (!description.isEmpty()) {
                insights.add(overviewInsight(InsightType.CHALLENGE, description));
            }
        }
        return insights;
    }

    private Insight overviewInsight(InsightType type, String content) {
        return Insight.builder()
                .type(type)
                .content(content)
                .source(OVERVIEW_SOURCE)
                .build();
    }

    private boolean isMalformed(Throwable e) {
        return e instanceof ExternalServiceException
                && ((ExternalServiceException) e).getKind() == ExternalServiceException.Kind.MALFORMED_RESPONSE;
    }

    private ExternalServiceException malformed(String message) {
        return new ExternalServiceException(ExternalServiceException.Kind.MALFORMED_RESPONSE, message);
    }

    private String buildStoryPrompt(RunContext context, ScrapedData story, boolean strict) {
        String prompt = String.format("""
                Extract up to %d insights from this story about moving from %s to %s.

                Story (source: %s):
                %s

                Classify each insight as "observation" (a pattern or fact), "challenge" (an obstacle faced)
                or "story" (a concrete step the person took). Include experienceYears when the author states
                their years of experience, and date when the story mentions one.

                Respond with JSON in this structure:
                {"insights": [{"type": "observation|challenge|story", "content": "...", "experienceYears": number, "date": "..."}]}
                """,
                pipelineConfig.getInsights().getMaxPerStory(),
                context.getCurrentRole(), context.getTargetRole(), story.source(), story.content());
        if (strict) {
            prompt += """

                    Your previous answer could not be parsed. Return ONLY the JSON object above.
                    Do not use markdown, code fences or any text outside the JSON.
                    Every element must have a "type" and a non-empty "content".
                    """;
        }
        return prompt;
    }

    private String buildOverviewPrompt(RunContext context, List<ScrapedData> stories) {
        StringBuilder combined = new StringBuilder();
        for (ScrapedData story : stories) {
            String content = story.content().length() > OVERVIEW_STORY_CHARS
                    ? story.content().substring(0, OVERVIEW_STORY_CHARS)
                    : story.content();
            combined.append(String.format("SOURCE: %s%nURL: %s%nCONTENT: %s%n---%n",
                    story.source(), story.url() != null ? story.url() : "Not available", content));
        }

        return String.format("""
                I have %d real stories from people who transitioned from %s to %s.

                Here are the stories:

                %s

                Based only on these stories (do not invent statistics), provide:
                1. successRate - percentage of transitions that were successful
                2. avgTransitionMonths - average time the transition took, in months
                3. commonPaths - the most common strategies people used, with how often each was mentioned
                4. commonChallenges - obstacles people ran into

                Respond with JSON:
                {"successRate": number, "avgTransitionMonths": number,
                 "commonPaths": [{"path": "description", "count": number}],
                 "commonChallenges": ["challenge", "..."]}
                """,
                stories.size(), context.getCurrentRole(), context.getTargetRole(), combined);
    }
}
