package dev.careerpath.source;

/**
 * One retrieval query aimed at a single source.
 *
 * @param sourceName display name of the target, used for narratives without a Source label
 * @param site       site or community to search
 * @param searchTerm phrasing with the roles filled in
 */
public record StoryQuery(String sourceName, String site, String searchTerm) {
}
