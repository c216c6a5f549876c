package de.bsommerfeld.triage.engine.similarity;

import de.bsommerfeld.triage.core.domain.Message;
import de.bsommerfeld.triage.core.domain.SimilarityMatch;
import de.bsommerfeld.triage.engine.MessageStore;
import de.bsommerfeld.triage.engine.TextNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Linear nearest-neighbor search over the {@link MessageStore}.
 *
 * <p>
 * Every query compares against every stored message, so a batch of n
 * messages costs O(n²) comparisons in total. That is acceptable for the
 * small-to-moderate corpora this engine targets; larger corpora need an
 * index. Profiles (word sets, embeddings) are computed once per message:
 * the profile built for a query is kept until {@link #index(Message)} adopts
 * it for the stored copy.
 *
 * <p>
 * Results are ordered by score, highest first. Equal scores keep store order,
 * so earlier messages rank first and results are deterministic.
 */
public final class SimilarityEngine {

    private final MessageStore store;
    private final SimilarityStrategy strategy;
    private final KeyPhraseExtractor keyPhrases;
    private final Map<Message, TextProfile> profiles = new ConcurrentHashMap<>();
    private volatile QueryProfile lastQuery;

    public SimilarityEngine(MessageStore store, SimilarityStrategy strategy, KeyPhraseExtractor keyPhrases) {
        this.store = store;
        this.strategy = strategy;
        this.keyPhrases = keyPhrases;
    }

    /**
     * @return up to {@code topK} matches above the strategy's threshold;
     *         empty when the store holds nothing else to compare against
     */
    public List<SimilarityMatch> findSimilar(Message query, int topK) {
        if (topK <= 0 || store.isEmpty())
            return List.of();

        TextProfile queryProfile = queryProfile(query);
        if (queryProfile.words().isEmpty())
            return List.of();

        List<Candidate> candidates = new ArrayList<>();
        for (Message stored : store.all()) {
            if (stored.getId().equals(query.getId()))
                continue;
            TextProfile storedProfile = profileOf(stored);
            if (storedProfile.words().isEmpty())
                continue;
            double score = strategy.similarity(queryProfile, storedProfile);
            if (score >= strategy.threshold())
                candidates.add(new Candidate(stored, storedProfile, score));
        }

        // List.sort is stable: ties stay in store order
        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());

        List<SimilarityMatch> matches = new ArrayList<>();
        for (Candidate candidate : candidates.subList(0, Math.min(topK, candidates.size()))) {
            Message stored = candidate.message();
            matches.add(new SimilarityMatch(stored.getId(), candidate.score(), stored.getCategory(),
                    keyPhrases.shared(queryProfile.text(), candidate.profile().text()), stored.getText()));
        }
        return matches;
    }

    /**
     * Caches the profile of a message that has just been appended to the
     * store, reusing the one built while it was being queried.
     */
    public void index(Message message) {
        profiles.computeIfAbsent(message, m -> {
            QueryProfile last = lastQuery;
            return last != null && last.message() == m ? last.profile() : compute(m);
        });
    }

    TextProfile profileOf(Message message) {
        return profiles.computeIfAbsent(message, this::compute);
    }

    private TextProfile queryProfile(Message message) {
        TextProfile cached = profiles.get(message);
        if (cached != null)
            return cached;
        QueryProfile last = lastQuery;
        if (last != null && last.message() == message)
            return last.profile();
        TextProfile profile = compute(message);
        lastQuery = new QueryProfile(message, profile);
        return profile;
    }

    private TextProfile compute(Message message) {
        return strategy.profile(TextNormalizer.normalize(message.getText()));
    }

    private record Candidate(Message message, TextProfile profile, double score) {
    }

    private record QueryProfile(Message message, TextProfile profile) {
    }
}
