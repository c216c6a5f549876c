package de.bsommerfeld.triage.engine.analytics;

import java.util.Map;

/**
 * Aggregate view over a set of triaged messages.
 *
 * @param totalMessages  number of messages summarized
 * @param categories     message count per category, in configuration order,
 *                       zero counts included
 * @param priorityTiers  counts for {@code high} (> 0.7), {@code medium}
 *                       (> 0.3) and {@code low} (<= 0.3)
 * @param criticalCount  messages with priority above 0.8
 * @param recentMessages messages younger than 24 hours
 * @param topUsers       most active authors, most frequent first
 * @param topChannels    busiest channels, most frequent first
 * @param topWords       most frequent content words, most frequent first
 * @param meanPriority   average priority score, 0 for an empty set
 */
public record BatchSummary(
        int totalMessages,
        Map<String, Integer> categories,
        Map<String, Integer> priorityTiers,
        int criticalCount,
        int recentMessages,
        Map<String, Integer> topUsers,
        Map<String, Integer> topChannels,
        Map<String, Integer> topWords,
        double meanPriority) {

    public static final String HIGH = "high";
    public static final String MEDIUM = "medium";
    public static final String LOW = "low";

    public int categoryCount(String category) {
        return categories.getOrDefault(category, 0);
    }
}
