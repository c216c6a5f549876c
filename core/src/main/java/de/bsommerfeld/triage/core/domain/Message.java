package de.bsommerfeld.triage.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A message moving through the triage pipeline. Identity and source fields
 * are fixed at construction; each pipeline stage fills in its own result.
 * Once a message has been stored it is no longer modified.
 */
public class Message {

    private final String id;
    private final String text;
    private final String user;
    private final String channel;
    private final Instant timestamp;
    private final String threadTs;
    private final List<String> reactions;

    private String category;
    private double confidence;
    private double priorityScore;
    private List<SimilarityMatch> similarMessages = List.of();

    public Message(String id, String text, String user, String channel, Instant timestamp, String threadTs,
            List<String> reactions) {
        this.id = Objects.requireNonNull(id, "id");
        this.text = text != null ? text : "";
        this.user = user;
        this.channel = channel;
        this.timestamp = timestamp;
        this.threadTs = threadTs;
        this.reactions = reactions != null ? List.copyOf(reactions) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public String getUser() {
        return user;
    }

    public String getChannel() {
        return channel;
    }

    /** Creation time; {@code null} only for messages built outside the pipeline. */
    public Instant getTimestamp() {
        return timestamp;
    }

    public String getThreadTs() {
        return threadTs;
    }

    public List<String> getReactions() {
        return reactions;
    }

    public String getCategory() {
        return category;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setCategorization(String category, double confidence) {
        this.category = category;
        this.confidence = confidence;
    }

    public double getPriorityScore() {
        return priorityScore;
    }

    public void setPriorityScore(double priorityScore) {
        this.priorityScore = priorityScore;
    }

    public List<SimilarityMatch> getSimilarMessages() {
        return similarMessages;
    }

    public void setSimilarMessages(List<SimilarityMatch> similarMessages) {
        this.similarMessages = List.copyOf(similarMessages);
    }

    @Override
    public String toString() {
        return "Message[" + id + ", category=" + category + ", priority="
                + String.format(Locale.ROOT, "%.2f", priorityScore) + "]";
    }
}
