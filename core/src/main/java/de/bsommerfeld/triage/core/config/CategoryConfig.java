package de.bsommerfeld.triage.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the category taxonomy. Keywords count once per substring hit,
 * patterns count twice per match. Values are persisted in triage.toml under
 * {@code [[categories]]}; the order of entries is the tie-break order.
 */
public class CategoryConfig {

    @JsonProperty("name")
    private String name;

    @JsonProperty("keywords")
    private List<String> keywords = new ArrayList<>();

    @JsonProperty("patterns")
    private List<String> patterns = new ArrayList<>();

    @JsonProperty("color")
    private String color = "#9E9E9E";

    @JsonProperty("priority-boost")
    private double priorityBoost = 0.0;

    public CategoryConfig() {
    }

    public CategoryConfig(String name, List<String> keywords, List<String> patterns, String color,
            double priorityBoost) {
        this.name = name;
        this.keywords = new ArrayList<>(keywords);
        this.patterns = new ArrayList<>(patterns);
        this.color = color;
        this.priorityBoost = priorityBoost;
    }

    public String getName() {
        return name;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public String getColor() {
        return color;
    }

    public double getPriorityBoost() {
        return priorityBoost;
    }
}
