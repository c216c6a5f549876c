package de.bsommerfeld.triage.engine;

import de.bsommerfeld.triage.core.config.PriorityConfig;
import de.bsommerfeld.triage.core.domain.Message;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Additive urgency model. Each signal is capped on its own, the sum is
 * clamped to [0, 1]. Missing timestamps or reactions contribute nothing.
 *
 * <p>
 * Signals: category boost, a one-time urgency bonus if any urgent term
 * occurs, question and exclamation marks, a two-tier length bonus (only
 * the higher tier applies), a recency tier and the reaction count.
 */
public final class PriorityScorer {

    private static final Duration ONE_HOUR = Duration.ofHours(1);
    private static final Duration SIX_HOURS = Duration.ofHours(6);
    private static final Duration ONE_DAY = Duration.ofHours(24);

    private final PriorityConfig config;
    private final CategoryRuleSet rules;
    private final List<String> urgentTerms;
    private final Clock clock;

    public PriorityScorer(PriorityConfig config, CategoryRuleSet rules, Clock clock) {
        this.config = config;
        this.rules = rules;
        this.urgentTerms = config.getUrgentTerms().stream()
                .map(TextNormalizer::normalize)
                .filter(term -> !term.isEmpty())
                .collect(Collectors.toList());
        this.clock = clock;
    }

    public double score(Message message, String category) {
        String text = TextNormalizer.normalize(message.getText());

        double score = rules.boostOf(category);
        score += urgencySignal(text);
        score += Math.min(count(text, '?') * config.getQuestionStep(), config.getQuestionCap());
        score += Math.min(count(text, '!') * config.getExclamationStep(), config.getExclamationCap());
        score += lengthSignal(text);
        score += recencySignal(message.getTimestamp());
        score += reactionSignal(message.getReactions());

        return clamp(score);
    }

    private double urgencySignal(String text) {
        for (String term : urgentTerms) {
            if (text.contains(term))
                return config.getUrgencyBonus();
        }
        return 0.0;
    }

    private double lengthSignal(String text) {
        if (text.length() > config.getLongLengthThreshold())
            return config.getLongLengthBonus();
        if (text.length() > config.getLengthThreshold())
            return config.getLengthBonus();
        return 0.0;
    }

    /**
     * Timestamps in the future count as fresh.
     */
    private double recencySignal(Instant timestamp) {
        if (timestamp == null)
            return 0.0;
        Duration age = Duration.between(timestamp, clock.instant());
        if (age.compareTo(ONE_HOUR) < 0)
            return config.getRecencyHourBonus();
        if (age.compareTo(SIX_HOURS) < 0)
            return config.getRecencySixHoursBonus();
        if (age.compareTo(ONE_DAY) < 0)
            return config.getRecencyDayBonus();
        return 0.0;
    }

    private double reactionSignal(List<String> reactions) {
        if (reactions == null || reactions.size() <= config.getMinReactions())
            return 0.0;
        return Math.min(reactions.size() * config.getReactionStep(), config.getReactionCap());
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c)
                n++;
        }
        return n;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(score, 1.0));
    }
}
