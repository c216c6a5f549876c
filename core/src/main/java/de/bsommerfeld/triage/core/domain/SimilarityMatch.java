package de.bsommerfeld.triage.core.domain;

import java.util.List;

/**
 * A previously stored message judged related to a query message.
 * Key phrases are for display only and never influence the score.
 *
 * @param messageId  identifier of the stored message
 * @param score      blended similarity in [0, 1]
 * @param category   category of the stored message
 * @param keyPhrases up to a few two-word sequences shared by both texts
 * @param text       raw text of the stored message, for previews
 */
public record SimilarityMatch(String messageId, double score, String category, List<String> keyPhrases,
        String text) {

    public SimilarityMatch {
        keyPhrases = List.copyOf(keyPhrases);
    }
}
