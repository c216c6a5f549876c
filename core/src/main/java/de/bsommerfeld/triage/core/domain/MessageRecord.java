package de.bsommerfeld.triage.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Raw message as handed over by an ingestion source. Every field except
 * {@code text} is optional and may be {@code null}; the engine fills the
 * gaps instead of rejecting the record.
 *
 * @param id        caller-supplied identifier, derived from content if absent
 * @param text      message body, {@code null} is treated as empty
 * @param user      author handle
 * @param channel   channel name
 * @param ts        epoch seconds as number or string, or an ISO-8601 instant
 * @param threadTs  parent thread reference
 * @param reactions reaction names, one entry per reaction
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageRecord(
        @JsonProperty("id") String id,
        @JsonProperty("text") String text,
        @JsonProperty("user") String user,
        @JsonProperty("channel") String channel,
        @JsonProperty("ts") Object ts,
        @JsonProperty("thread_ts") String threadTs,
        @JsonProperty("reactions") List<String> reactions) {

    /**
     * Convenience constructor for records carrying only text and a timestamp.
     */
    public MessageRecord(String text, Object ts) {
        this(null, text, null, null, ts, null, null);
    }
}
