package de.bsommerfeld.triage.engine.analytics;

import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import de.bsommerfeld.triage.core.config.AnalyticsConfig;
import de.bsommerfeld.triage.core.domain.Message;
import de.bsommerfeld.triage.engine.TextNormalizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Computes {@link BatchSummary} instances. Ties in the top-N lists keep
 * first-seen order.
 */
public final class AnalyticsService {

    static final double HIGH_PRIORITY = 0.7;
    static final double MEDIUM_PRIORITY = 0.3;
    static final double CRITICAL_PRIORITY = 0.8;
    private static final Duration RECENT = Duration.ofHours(24);
    private static final int MIN_WORD_LENGTH = 3;
    private static final Pattern EDGE_MARKS = Pattern.compile("^[?!.]+|[?!.]+$");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "that", "this", "with", "you", "are", "not", "but", "have", "was", "can",
            "will", "just", "your", "all", "from", "out", "now", "has", "our", "its", "there", "their", "they",
            "been", "some", "any", "into", "about", "after", "again", "here", "what", "how", "who", "why",
            "when", "where", "would", "could", "should", "does", "did", "get", "getting", "like", "more",
            "also", "than", "then", "them", "these", "those", "which", "while", "please", "someone");

    private final AnalyticsConfig config;
    private final List<String> categoryOrder;
    private final Clock clock;

    public AnalyticsService(AnalyticsConfig config, List<String> categoryOrder, Clock clock) {
        this.config = config;
        this.categoryOrder = List.copyOf(categoryOrder);
        this.clock = clock;
    }

    public BatchSummary summarize(List<Message> messages) {
        Map<String, Integer> categories = new LinkedHashMap<>();
        for (String category : categoryOrder) {
            categories.put(category, 0);
        }

        Map<String, Integer> tiers = new LinkedHashMap<>();
        tiers.put(BatchSummary.HIGH, 0);
        tiers.put(BatchSummary.MEDIUM, 0);
        tiers.put(BatchSummary.LOW, 0);

        Multiset<String> users = LinkedHashMultiset.create();
        Multiset<String> channels = LinkedHashMultiset.create();
        Multiset<String> words = LinkedHashMultiset.create();
        Instant recentCutoff = clock.instant().minus(RECENT);
        int critical = 0;
        int recent = 0;
        double prioritySum = 0.0;

        for (Message message : messages) {
            if (message.getCategory() != null)
                categories.merge(message.getCategory(), 1, Integer::sum);

            double priority = message.getPriorityScore();
            prioritySum += priority;
            tiers.merge(tierOf(priority), 1, Integer::sum);
            if (priority > CRITICAL_PRIORITY)
                critical++;

            if (message.getTimestamp() != null && message.getTimestamp().isAfter(recentCutoff))
                recent++;

            users.add(message.getUser());
            channels.add(message.getChannel());
            for (String word : TextNormalizer.normalize(message.getText()).split(" ")) {
                String clean = EDGE_MARKS.matcher(word).replaceAll("");
                if (clean.length() >= MIN_WORD_LENGTH && !STOP_WORDS.contains(clean))
                    words.add(clean);
            }
        }

        double mean = messages.isEmpty() ? 0.0 : prioritySum / messages.size();
        return new BatchSummary(messages.size(),
                Collections.unmodifiableMap(categories),
                Collections.unmodifiableMap(tiers),
                critical,
                recent,
                top(users, config.getTopContributors()),
                top(channels, config.getTopContributors()),
                top(words, config.getTopWords()),
                mean);
    }

    static String tierOf(double priority) {
        if (priority > HIGH_PRIORITY)
            return BatchSummary.HIGH;
        if (priority > MEDIUM_PRIORITY)
            return BatchSummary.MEDIUM;
        return BatchSummary.LOW;
    }

    private static Map<String, Integer> top(Multiset<String> counts, int limit) {
        Map<String, Integer> top = new LinkedHashMap<>();
        for (Multiset.Entry<String> entry : Multisets.copyHighestCountFirst(counts).entrySet()) {
            if (top.size() >= limit)
                break;
            top.put(entry.getElement(), entry.getCount());
        }
        return Collections.unmodifiableMap(top);
    }
}
