package com.jobmarket.etl.ingest.skills;

import com.jobmarket.etl.ingest.model.SkillCategory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable set of canonical skills with their match patterns. Matching is case-insensitive and
 * treats {@code +} and {@code #} as word characters, so "C++" and "C#" only match as whole tokens.
 */
public final class SkillTaxonomy {
    private static final String WORD_CHARS = "[\\w+#]";

    private final List<SkillDefinition> definitions;

    public SkillTaxonomy(List<SkillDefinition> definitions) {
        this.definitions = List.copyOf(definitions);
    }

    public static SkillDefinition definition(String name, SkillCategory category, boolean matchName, List<String> aliases) {
        Set<String> terms = new LinkedHashSet<>();
        if (matchName) {
            terms.add(name.trim());
        }
        for (String alias : aliases) {
            if (alias != null && !alias.isBlank()) {
                terms.add(alias.trim());
            }
        }
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("skill " + name + " has nothing to match on");
        }
        StringBuilder alternation = new StringBuilder();
        for (String term : terms) {
            if (alternation.length() > 0) {
                alternation.append('|');
            }
            alternation.append(termPattern(term));
        }
        Pattern pattern = Pattern.compile(
            "(?<!" + WORD_CHARS + ")(?:" + alternation + ")(?!" + WORD_CHARS + ")",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        );
        return new SkillDefinition(name.trim(), category == null ? SkillCategory.UNCATEGORIZED : category, pattern);
    }

    /** Canonical skills mentioned in {@code text}, in taxonomy order. */
    public List<SkillDefinition> match(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<SkillDefinition> matches = new ArrayList<>();
        for (SkillDefinition definition : definitions) {
            if (definition.pattern().matcher(text).find()) {
                matches.add(definition);
            }
        }
        return matches;
    }

    public int size() {
        return definitions.size();
    }

    // multi-word terms tolerate any run of whitespace between words
    private static String termPattern(String term) {
        String[] words = term.split("\\s+");
        StringBuilder pattern = new StringBuilder();
        for (String word : words) {
            if (pattern.length() > 0) {
                pattern.append("\\s+");
            }
            pattern.append(Pattern.quote(word));
        }
        return pattern.toString();
    }

    public record SkillDefinition(String name, SkillCategory category, Pattern pattern) {
    }
}
