package de.bsommerfeld.triage.engine.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.bsommerfeld.triage.core.domain.MessageRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * JSON bridge to ingestion and export collaborators: reads arrays of raw
 * records, writes arrays of {@link OutputRecord}s.
 */
public final class TriageJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private TriageJson() {
    }

    public static List<MessageRecord> readRecords(String json) throws IOException {
        List<MessageRecord> records = MAPPER.readValue(json, new TypeReference<List<MessageRecord>>() {
        });
        return records != null ? records : List.of();
    }

    public static String write(List<OutputRecord> records) {
        try {
            return MAPPER.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize output records", e);
        }
    }
}
