package de.bsommerfeld.triage.engine.similarity;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

final class Profiles {

    private Profiles() {
    }

    static Set<String> words(String normalizedText) {
        if (normalizedText.isEmpty())
            return Set.of();
        return Arrays.stream(normalizedText.split(" "))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toSet());
    }

    /**
     * Intersection over union of two word sets; 0 if either is empty.
     */
    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty())
            return 0.0;
        int intersection = 0;
        for (String word : a) {
            if (b.contains(word))
                intersection++;
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }
}
