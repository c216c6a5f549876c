package de.bsommerfeld.triage.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Limits for batch summaries and exported previews.
 */
public class AnalyticsConfig {

    @JsonProperty("top-contributors")
    private int topContributors = 5;

    @JsonProperty("top-words")
    private int topWords = 10;

    @JsonProperty("preview-length")
    private int previewLength = 100;

    public int getTopContributors() {
        return topContributors;
    }

    public int getTopWords() {
        return topWords;
    }

    public int getPreviewLength() {
        return previewLength;
    }
}
