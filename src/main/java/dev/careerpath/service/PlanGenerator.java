package dev.careerpath.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.careerpath.ai.GenerationOptions;
import dev.careerpath.ai.TextGenerationClient;
import dev.careerpath.config.PipelineConfig;
import dev.careerpath.metrics.PipelineMetrics;
import dev.careerpath.model.Milestone;
import dev.careerpath.model.Plan;
import dev.careerpath.model.Priority;
import dev.careerpath.model.Resource;
import dev.careerpath.model.SkillGap;
import dev.careerpath.pipeline.RunCancelledException;
import dev.careerpath.pipeline.RunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a milestone plan for the top skill gaps. Never fails: any unusable outcome yields the
 * {@link FallbackPlan}. Cancellation is the only error that passes through.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanGenerator {

    static final int MIN_WEEKS = 2;
    static final int MAX_WEEKS = 6;
    static final int MAX_MILESTONES = 5;
    static final int MAX_RESOURCES = 3;

    private final TextGenerationClient textClient;
    private final PipelineConfig pipelineConfig;
    private final PipelineMetrics metrics;

    public Mono<Plan> generate(RunContext context, List<SkillGap> skillGaps, Duration deadline) {
        PipelineConfig.PlanSettings settings = pipelineConfig.getPlan();
        List<SkillGap> focus = skillGaps.stream()
                .limit(Math.max(0, settings.getTopSkills()))
                .toList();
        String transitionId = context.getTransition().getId();
        String prompt = buildPrompt(context, focus, settings.getMilestoneCount());
        GenerationOptions options = GenerationOptions.json(settings.getMaxTokens(), deadline);

        log.info("Generating plan for {} skill gaps", focus.size());

        return context.guard(() -> textClient.generateJson(prompt, options))
                .map(this::parseMilestones)
                .timeout(deadline)
                .<Plan>handle((milestones, sink) -> {
                    if (milestones.isEmpty()) {
                        sink.error(new IllegalStateException("No valid milestones in response"));
                    } else {
                        sink.next(Plan.builder()
                                .transitionId(transitionId)
                                .createdAt(Instant.now())
                                .milestones(milestones)
                                .fallback(false)
                                .build());
                    }
                })
                .doOnNext(plan -> log.info("Generated plan with {} milestones", plan.milestones().size()))
                .onErrorResume(e -> !(e instanceof RunCancelledException), e -> {
                    log.warn("Plan generation failed, using fallback plan: {}", e.getMessage());
                    metrics.recordFallbackPlan();
                    return Mono.just(FallbackPlan.create(transitionId, context.getTargetRole()));
                });
    }

    /**
     * Accepts a bare array or one wrapped in "milestones" or "plan". Invalid milestones are dropped,
     * survivors are numbered by position.
     */
    List<Milestone> parseMilestones(JsonNode node) {
        JsonNode items = node;
        if (node.isObject()) {
            items = node.has("milestones") ? node.get("milestones") : node.get("plan");
        }
        if (items == null || !items.isArray()) {
            return List.of();
        }

        List<Milestone> milestones = new ArrayList<>();
        for (JsonNode item : items) {
            if (milestones.size() == MAX_MILESTONES) {
                break;
            }
            Milestone milestone = toMilestone(item, milestones.size());
            if (milestone != null) {
                milestones.add(milestone);
            } else {
                log.debug("Dropping invalid milestone: {}", item);
            }
        }
        return milestones;
    }

    private Milestone toMilestone(JsonNode item, int order) {
        if (item == null || !item.isObject()) {
            return null;
        }
        String title = item.path("title").asText("").trim();
        String description = item.path("description").asText("").trim();
        Priority priority = Priority.fromLabel(item.path("priority").asText(null)).orElse(null);
        Integer weeks = readWeeks(item.get("durationWeeks"));
        if (title.isEmpty() || description.isEmpty() || priority == null || weeks == null) {
            return null;
        }
        return Milestone.builder()
                .title(title)
                .description(description)
                .priority(priority)
                .durationWeeks(weeks)
                .order(order)
                .progress(0)
                .resources(readResources(item.get("resources")))
                .build();
    }

    private Integer readWeeks(JsonNode node) {
        if (node == null || !(node.isIntegralNumber() || node.isTextual())) {
            return null;
        }
        int weeks;
        if (node.isIntegralNumber()) {
            weeks = node.asInt();
        } else {
            String text = node.asText().trim();
            if (!text.matches("\\d{1,2}")) {
                return null;
            }
            weeks = Integer.parseInt(text);
        }
        return weeks >= MIN_WEEKS && weeks <= MAX_WEEKS ? weeks : null;
    }

    private List<Resource> readResources(JsonNode node) {
        List<Resource> resources = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return resources;
        }
        for (JsonNode item : node) {
            if (resources.size() == MAX_RESOURCES) {
                break;
            }
            String title = item.path("title").asText("").trim();
            String url = item.path("url").asText("").trim();
            String type = item.path("type").asText("").trim();
            if (!title.isEmpty() && url.startsWith("http")) {
                resources.add(new Resource(title, url, type.isEmpty() ? "Link" : type));
            }
        }
        return resources;
    }

    private String buildPrompt(RunContext context, List<SkillGap> focus, int milestoneCount) {
        String focusLine = focus.isEmpty()
                ? "No specific skill gaps were identified. Give role-generic guidance for breaking into "
                        + context.getTargetRole() + "."
                : "Focus on these skills: " + focus.stream()
                        .map(gap -> gap.skillName() + " (" + gap.gapLevel().label() + " gap)")
                        .collect(Collectors.joining(", "));

        return String.format("""
                Create a %d-milestone career transition plan for someone transitioning from %s to %s.

                %s

                For each milestone:
                1. Create a clear title and description of what to learn
                2. Assign a priority level (High, Medium, Low)
                3. Estimate duration in weeks, between %d and %d
                4. Suggest up to %d learning resources (YouTube video, book or online course, GitHub repository)
                   with complete URLs

                Order milestones so that prerequisites and high-priority work come first.

                Respond with JSON in this structure:
                {"milestones": [{
                  "title": "Milestone title",
                  "description": "Detailed description",
                  "priority": "High|Medium|Low",
                  "durationWeeks": number,
                  "resources": [{"title": "Resource title", "url": "https://...", "type": "YouTube|Book|Course|GitHub"}]
                }]}
                """,
                milestoneCount, context.getCurrentRole(), context.getTargetRole(), focusLine,
                MIN_WEEKS, MAX_WEEKS, MAX_RESOURCES);
    }
}
