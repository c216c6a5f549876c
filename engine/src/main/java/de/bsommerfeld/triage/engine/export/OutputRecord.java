package de.bsommerfeld.triage.engine.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.bsommerfeld.triage.core.domain.Message;
import de.bsommerfeld.triage.core.domain.SimilarityMatch;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flat, serializable view of a triaged message for rendering and export
 * consumers. Property names follow the chat-export convention (snake_case)
 * so records can be fed back as input.
 */
@JsonPropertyOrder({ "id", "text", "user", "channel", "ts", "thread_ts", "reactions", "category", "confidence",
        "priority_score", "color", "similar_tickets" })
public record OutputRecord(
        @JsonProperty("id") String id,
        @JsonProperty("text") String text,
        @JsonProperty("user") String user,
        @JsonProperty("channel") String channel,
        @JsonProperty("ts") String ts,
        @JsonProperty("thread_ts") String threadTs,
        @JsonProperty("reactions") List<String> reactions,
        @JsonProperty("category") String category,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("priority_score") double priorityScore,
        @JsonProperty("color") String color,
        @JsonProperty("similar_tickets") List<SimilarTicket> similarTickets) {

    /**
     * One entry of {@code similar_tickets}.
     */
    @JsonPropertyOrder({ "ticket_id", "similarity_score", "category", "key_phrases", "text_preview" })
    public record SimilarTicket(
            @JsonProperty("ticket_id") String ticketId,
            @JsonProperty("similarity_score") double similarityScore,
            @JsonProperty("category") String category,
            @JsonProperty("key_phrases") List<String> keyPhrases,
            @JsonProperty("text_preview") String textPreview) {
    }

    public static OutputRecord from(Message message, String color, int previewLength) {
        List<SimilarTicket> tickets = new ArrayList<>();
        for (SimilarityMatch match : message.getSimilarMessages()) {
            tickets.add(new SimilarTicket(match.messageId(), round(match.score()), match.category(),
                    match.keyPhrases(), preview(match.text(), previewLength)));
        }
        String ts = message.getTimestamp() == null ? null
                : message.getTimestamp().getEpochSecond() + "."
                        + String.format(Locale.ROOT, "%06d", message.getTimestamp().getNano() / 1000);
        return new OutputRecord(message.getId(), message.getText(), message.getUser(), message.getChannel(), ts,
                message.getThreadTs(), message.getReactions(), message.getCategory(), message.getConfidence(),
                message.getPriorityScore(), color, tickets);
    }

    static String preview(String text, int length) {
        if (text == null)
            return "";
        return text.length() > length ? text.substring(0, length) + "..." : text;
    }

    private static double round(double score) {
        return BigDecimal.valueOf(score).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}
