package dev.careerpath.source;

import dev.careerpath.config.SkillsConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Finds vocabulary skills in free text and maps names and synonyms onto canonical skill names.
 */
@Slf4j
@Component
public class SkillKeywordScanner {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Normalized term (name or alias) to canonical display name, in vocabulary order.
     */
    private final Map<String, String> termToCanonical = new LinkedHashMap<>();

    public SkillKeywordScanner(SkillsConfig skillsConfig) {
        for (SkillsConfig.SkillDefinition skill : skillsConfig.getVocabulary()) {
            if (skill.getName() == null || skill.getName().isBlank()) {
                continue;
            }
            String canonical = skill.getName().trim();
            termToCanonical.putIfAbsent(normalize(canonical), canonical);
            for (String alias : skill.getAliases()) {
                if (alias != null && !alias.isBlank()) {
                    termToCanonical.putIfAbsent(normalize(alias), canonical);
                }
            }
        }
        log.debug("Skill vocabulary loaded: {} terms", termToCanonical.size());
    }

    /**
     * Canonical names of every vocabulary skill mentioned in the text.
     */
    public Set<String> scan(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String normalized = normalize(text);
        Set<String> found = new LinkedHashSet<>();
        for (Map.Entry<String, String> entry : termToCanonical.entrySet()) {
            if (!found.contains(entry.getValue()) && containsTerm(normalized, entry.getKey())) {
                found.add(entry.getValue());
            }
        }
        return found;
    }

    /**
     * Map a skill name onto its canonical form, if it belongs to the vocabulary.
     */
    public Optional<String> canonicalize(String skillName) {
        if (skillName == null || skillName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(termToCanonical.get(normalize(skillName)));
    }

    /**
     * Lower-case with whitespace collapsed.
     */
    public static String normalize(String value) {
        return WHITESPACE.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * Word-boundary match that also works for terms ending in symbols (c++, ci/cd).
     */
    private boolean containsTerm(String text, String term) {
        String regex = "(?<![\\w])" + Pattern.quote(term) + "(?![\\w])";
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(regex, Pattern::compile);
        return pattern.matcher(text).find();
    }
}
