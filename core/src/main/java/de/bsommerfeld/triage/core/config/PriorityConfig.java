package de.bsommerfeld.triage.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Weight table for the additive priority model. Every signal is capped on its
 * own before the total is clamped to 1.0.
 */
public class PriorityConfig {

    @JsonProperty("urgent-terms")
    private List<String> urgentTerms = List.of("urgent", "asap", "emergency", "critical", "production",
            "down", "outage", "immediately");

    @JsonProperty("urgency-bonus")
    private double urgencyBonus = 0.2;

    @JsonProperty("question-step")
    private double questionStep = 0.1;

    @JsonProperty("question-cap")
    private double questionCap = 0.3;

    @JsonProperty("exclamation-step")
    private double exclamationStep = 0.05;

    @JsonProperty("exclamation-cap")
    private double exclamationCap = 0.2;

    @JsonProperty("length-threshold")
    private int lengthThreshold = 100;

    @JsonProperty("length-bonus")
    private double lengthBonus = 0.1;

    @JsonProperty("long-length-threshold")
    private int longLengthThreshold = 200;

    @JsonProperty("long-length-bonus")
    private double longLengthBonus = 0.2;

    @JsonProperty("recency-hour-bonus")
    private double recencyHourBonus = 0.15;

    @JsonProperty("recency-six-hours-bonus")
    private double recencySixHoursBonus = 0.10;

    @JsonProperty("recency-day-bonus")
    private double recencyDayBonus = 0.05;

    @JsonProperty("reaction-step")
    private double reactionStep = 0.05;

    @JsonProperty("reaction-cap")
    private double reactionCap = 0.2;

    /** Reactions only count once there are more than this many. */
    @JsonProperty("min-reactions")
    private int minReactions = 1;

    public List<String> getUrgentTerms() {
        return urgentTerms;
    }

    public double getUrgencyBonus() {
        return urgencyBonus;
    }

    public double getQuestionStep() {
        return questionStep;
    }

    public double getQuestionCap() {
        return questionCap;
    }

    public double getExclamationStep() {
        return exclamationStep;
    }

    public double getExclamationCap() {
        return exclamationCap;
    }

    public int getLengthThreshold() {
        return lengthThreshold;
    }

    public double getLengthBonus() {
        return lengthBonus;
    }

    public int getLongLengthThreshold() {
        return longLengthThreshold;
    }

    public double getLongLengthBonus() {
        return longLengthBonus;
    }

    public double getRecencyHourBonus() {
        return recencyHourBonus;
    }

    public double getRecencySixHoursBonus() {
        return recencySixHoursBonus;
    }

    public double getRecencyDayBonus() {
        return recencyDayBonus;
    }

    public double getReactionStep() {
        return reactionStep;
    }

    public double getReactionCap() {
        return reactionCap;
    }

    public int getMinReactions() {
        return minReactions;
    }

    public void setUrgencyBonus(double urgencyBonus) {
        this.urgencyBonus = urgencyBonus;
    }
}
