package de.bsommerfeld.triage.engine;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiled form of one category: normalized keywords, case-insensitive
 * patterns and the metadata downstream stages read.
 *
 * @param name          category label
 * @param keywords      keywords, already passed through {@link TextNormalizer}
 * @param patterns      compiled patterns, matched with {@code find()}
 * @param color         display color
 * @param priorityBoost additive priority contribution in [0, 1]
 */
public record CategoryRule(String name, List<String> keywords, List<Pattern> patterns, String color,
        double priorityBoost) {

    static final int KEYWORD_WEIGHT = 1;
    static final int PATTERN_WEIGHT = 2;

    public CategoryRule {
        keywords = List.copyOf(keywords);
        patterns = List.copyOf(patterns);
    }

    /**
     * One point per keyword contained in the text, two per pattern found.
     * Each keyword and pattern counts at most once.
     */
    public int score(String normalizedText) {
        int score = 0;
        for (String keyword : keywords) {
            if (normalizedText.contains(keyword))
                score += KEYWORD_WEIGHT;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(normalizedText).find())
                score += PATTERN_WEIGHT;
        }
        return score;
    }
}
