package de.bsommerfeld.triage.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the triage configuration, mapped from {@code triage.toml}.
 * Field initializers hold the reference profile; a file only needs to
 * contain the keys it wants to change.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriageConfig {

    @JsonProperty("fallback-category")
    private String fallbackCategory = "general";

    @JsonProperty("confidence-normalization")
    private double confidenceNormalization = 5.0;

    @JsonProperty("fallback-confidence")
    private double fallbackConfidence = 0.1;

    @JsonProperty("categories")
    private List<CategoryConfig> categories = defaultCategories();

    @JsonProperty("priority")
    private PriorityConfig priority = new PriorityConfig();

    @JsonProperty("similarity")
    private SimilarityConfig similarity = new SimilarityConfig();

    @JsonProperty("analytics")
    private AnalyticsConfig analytics = new AnalyticsConfig();

    public String getFallbackCategory() {
        return fallbackCategory;
    }

    public double getConfidenceNormalization() {
        return confidenceNormalization;
    }

    public double getFallbackConfidence() {
        return fallbackConfidence;
    }

    public List<CategoryConfig> getCategories() {
        return categories;
    }

    public void setCategories(List<CategoryConfig> categories) {
        this.categories = categories;
    }

    public PriorityConfig getPriority() {
        return priority;
    }

    public SimilarityConfig getSimilarity() {
        return similarity;
    }

    public AnalyticsConfig getAnalytics() {
        return analytics;
    }

    /**
     * The seven-category support taxonomy. Order matters: on equal scores
     * the earlier entry wins.
     */
    static List<CategoryConfig> defaultCategories() {
        List<CategoryConfig> list = new ArrayList<>();
        list.add(new CategoryConfig("bug_report",
                List.of("bug", "error", "issue", "problem", "broken", "not working", "crash", "fail",
                        "exception", "500", "404"),
                List.of("error.*code", "exception", "stack trace", "500.*error", "404.*error", "not.*work"),
                "#FF6B6B", 0.3));
        list.add(new CategoryConfig("feature_request",
                List.of("feature", "enhancement", "improve", "add", "new", "request", "would like", "could we",
                        "suggestion"),
                List.of("can.*we.*add", "would.*be.*nice", "feature.*request", "enhancement"),
                "#4ECDC4", 0.2));
        list.add(new CategoryConfig("question",
                List.of("how", "what", "where", "when", "why", "help", "question", "explain", "understand"),
                List.of("\\?$", "how.*to", "what.*is", "can.*someone", "help.*me"),
                "#45B7D1", 0.1));
        list.add(new CategoryConfig("urgent",
                List.of("urgent", "asap", "emergency", "critical", "down", "outage", "production", "immediately"),
                List.of("urgent.*help", "production.*down", "critical.*issue", "emergency"),
                "#FF4757", 0.8));
        list.add(new CategoryConfig("deployment",
                List.of("deploy", "release", "push", "merge", "build", "ci/cd", "pipeline", "staging"),
                List.of("deploy.*to", "release.*notes", "build.*failed", "pipeline"),
                "#FFA726", 0.3));
        list.add(new CategoryConfig("access_request",
                List.of("access", "permission", "login", "password", "account", "credential", "auth"),
                List.of("need.*access", "can.*t.*login", "permission.*denied", "access.*to"),
                "#AB47BC", 0.4));
        list.add(new CategoryConfig("general",
                List.of("update", "info", "fyi", "notice", "announcement", "heads up"),
                List.of("fyi", "heads.*up", "just.*to.*let.*you.*know", "update"),
                "#66BB6A", 0.0));
        return list;
    }
}
