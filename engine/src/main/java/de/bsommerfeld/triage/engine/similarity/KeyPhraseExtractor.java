package de.bsommerfeld.triage.engine.similarity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds two-word sequences that occur in both texts, for display next to a
 * match. Both words must be at least {@code minWordLength} characters long
 * once surrounding {@code ? ! .} are stripped. Phrases are returned in the
 * order they appear in the matched text.
 */
public final class KeyPhraseExtractor {

    private final int minWordLength;
    private final int maxPhrases;

    public KeyPhraseExtractor(int minWordLength, int maxPhrases) {
        this.minWordLength = minWordLength;
        this.maxPhrases = maxPhrases;
    }

    public List<String> shared(String queryText, String matchedText) {
        if (maxPhrases <= 0)
            return List.of();
        Set<String> queryPhrases = new HashSet<>(bigrams(queryText));
        Set<String> shared = new LinkedHashSet<>();
        for (String phrase : bigrams(matchedText)) {
            if (queryPhrases.contains(phrase)) {
                shared.add(phrase);
                if (shared.size() == maxPhrases)
                    break;
            }
        }
        return new ArrayList<>(shared);
    }

    private List<String> bigrams(String normalizedText) {
        List<String> words = new ArrayList<>();
        for (String token : normalizedText.split(" ")) {
            words.add(stripPunctuation(token));
        }
        List<String> phrases = new ArrayList<>();
        for (int i = 0; i + 1 < words.size(); i++) {
            String first = words.get(i);
            String second = words.get(i + 1);
            if (first.length() >= minWordLength && second.length() >= minWordLength)
                phrases.add(first + " " + second);
        }
        return phrases;
    }

    private static String stripPunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isMark(token.charAt(start)))
            start++;
        while (end > start && isMark(token.charAt(end - 1)))
            end--;
        return token.substring(start, end);
    }

    private static boolean isMark(char c) {
        return c == '?' || c == '!' || c == '.';
    }
}
