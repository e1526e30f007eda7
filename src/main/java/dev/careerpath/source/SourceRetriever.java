package dev.careerpath.source;

import dev.careerpath.ai.GenerationOptions;
import dev.careerpath.ai.TextGenerationClient;
import dev.careerpath.config.AiConfig;
import dev.careerpath.config.SourcesConfig;
import dev.careerpath.metrics.PipelineMetrics;
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
 * Gathers real-world transition narratives for a role pair by fanning out one query per configured source.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceRetriever {

    private static final String STAGE = "stories";
    private static final String DEFAULT_PHRASING = "{current} to {target}";

    private final TextGenerationClient textClient;
    private final SourcesConfig sourcesConfig;
    private final AiConfig aiConfig;
    private final StoryResponseParser parser;
    private final StoryDeduplicator deduplicator;
    private final SkillKeywordScanner skillScanner;
    private final PipelineMetrics metrics;

    /**
     * Retrieve narratives, keeping whatever arrives before the deadline.
     *
     * @return Mono with at least one narrative, or an error with {@link NoSourcesFoundException}
     */
    public Mono<List<ScrapedData>> retrieve(RunContext context, Duration deadline) {
        List<StoryQuery> queries = buildQueries(context.getCurrentRole(), context.getTargetRole());
        log.info("Retrieving transition stories for '{}' -> '{}' ({} queries)",
                context.getCurrentRole(), context.getTargetRole(), queries.size());

        return Flux.fromIterable(queries)
                .flatMap(query -> fetch(context, query), Math.max(1, aiConfig.getConcurrencyLimit()))
                .take(deadline)
                .collectList()
                .map(this::finish)
                .flatMap(stories -> {
                    if (stories.isEmpty()) {
                        return Mono.error(new NoSourcesFoundException(context.getCurrentRole(), context.getTargetRole()));
                    }
                    metrics.recordStoriesFound(stories.size());
                    return Mono.just(stories);
                });
    }

    /**
     * One query per target, phrasings rotated across targets.
     */
    List<StoryQuery> buildQueries(String currentRole, String targetRole) {
        List<String> phrasings = sourcesConfig.getPhrasings().isEmpty()
                ? List.of(DEFAULT_PHRASING)
                : sourcesConfig.getPhrasings();

        List<StoryQuery> queries = new ArrayList<>();
        List<SourcesConfig.Target> targets = sourcesConfig.getTargets();
        for (int i = 0; i < targets.size(); i++) {
            SourcesConfig.Target target = targets.get(i);
            String term = phrasings.get(i % phrasings.size())
                    .replace("{current}", currentRole)
                    .replace("{target}", targetRole);
            queries.add(new StoryQuery(target.getName(), target.getSite(), term));
        }
        return queries;
    }

    private Flux<ScrapedData> fetch(RunContext context, StoryQuery query) {
        GenerationOptions options = GenerationOptions.builder()
                .maxTokens(sourcesConfig.getMaxTokens())
                .timeout(sourcesConfig.getQueryTimeout())
                .build();
        String prompt = buildPrompt(context.getCurrentRole(), context.getTargetRole(), query);

        return context.guard(() -> textClient.generate(prompt, options))
                .map(response -> parser.parse(response, query.sourceName()))
                .doOnNext(stories -> log.debug("{} returned {} stories for '{}'",
                        query.sourceName(), stories.size(), query.searchTerm()))
                .onErrorResume(e -> !(e instanceof RunCancelledException), e -> {
                    log.warn("Story query for {} failed: {}", query.sourceName(), e.getMessage());
                    metrics.recordItemDropped(STAGE);
                    return Mono.just(List.of());
                })
                .flatMapMany(Flux::fromIterable);
    }

    private List<ScrapedData> finish(List<ScrapedData> collected) {
        return deduplicator.deduplicate(collected).stream()
                .map(story -> story.toBuilder()
                        .skillsExtracted(skillScanner.scan(story.content()))
                        .build())
                .toList();
    }

    private String buildPrompt(String currentRole, String targetRole, StoryQuery query) {
        return String.format("""
                I need detailed stories from people who have transitioned from %s to %s careers.
                Search %s (%s) for posts matching "%s".

                For each story you find:
                1. Include the full text of the person's story
                2. Provide the exact source and complete URL
                3. Include the publication date of the post
                4. Make sure the story is from someone who has actually made this career transition

                Format each result as:
                Source: [platform name]
                URL: [complete URL]
                Date: [publication date]
                Content: [full text of the transition story]

                Return 3-5 real examples with full citations.
                """,
                currentRole, targetRole, query.sourceName(), query.site(), query.searchTerm());
    }
}
