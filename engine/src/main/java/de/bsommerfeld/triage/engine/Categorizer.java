package de.bsommerfeld.triage.engine;

import de.bsommerfeld.triage.core.config.TriageConfigurationException;

/**
 * Scores text against every category and picks the winner.
 *
 * <p>
 * Categories are visited in configuration order and a later category only
 * replaces the current best on a strictly higher score, so ties always go
 * to the category configured first. A text that hits nothing lands in the
 * fallback category with a small fixed confidence rather than zero.
 */
public final class Categorizer {

    private final CategoryRuleSet rules;
    private final double normalization;
    private final double fallbackConfidence;

    public Categorizer(CategoryRuleSet rules, double normalization, double fallbackConfidence) {
        if (normalization <= 0.0)
            throw new TriageConfigurationException("Confidence normalization must be positive: " + normalization);
        if (fallbackConfidence < 0.0 || fallbackConfidence > 1.0)
            throw new TriageConfigurationException("Fallback confidence must lie in [0, 1]: " + fallbackConfidence);
        this.rules = rules;
        this.normalization = normalization;
        this.fallbackConfidence = fallbackConfidence;
    }

    public Categorization categorize(String text) {
        String normalized = TextNormalizer.normalize(text);

        CategoryRule best = null;
        int bestScore = 0;
        for (CategoryRule rule : rules.rules()) {
            int score = rule.score(normalized);
            if (score > bestScore) {
                best = rule;
                bestScore = score;
            }
        }

        if (best == null)
            return new Categorization(rules.fallback().name(), fallbackConfidence, 0);
        return new Categorization(best.name(), Math.min(bestScore / normalization, 1.0), bestScore);
    }
}
