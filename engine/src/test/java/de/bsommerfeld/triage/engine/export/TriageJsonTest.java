package de.bsommerfeld.triage.engine.export;

import de.bsommerfeld.triage.core.domain.Message;
import de.bsommerfeld.triage.core.domain.MessageRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriageJsonTest {

    @Test
    void readRecords_shouldParseChatExport() throws IOException {
        String json = """
                [
                  {"id": "msg_001", "text": "Server down", "user": "john", "channel": "alerts",
                   "ts": "1700000000.000100", "thread_ts": "1699999999.000001", "reactions": ["fire"],
                   "team": "ignored"},
                  {"text": "no metadata", "ts": 1700000001}
                ]
                """;

        List<MessageRecord> records = TriageJson.readRecords(json);

        assertEquals(2, records.size());
        assertEquals("msg_001", records.get(0).id());
        assertEquals("1699999999.000001", records.get(0).threadTs());
        assertEquals(List.of("fire"), records.get(0).reactions());
        assertNull(records.get(1).user());
        assertEquals(1700000001, ((Number) records.get(1).ts()).intValue());
    }

    @Test
    void readRecords_shouldTreatNullAsEmpty() throws IOException {
        assertTrue(TriageJson.readRecords("null").isEmpty());
    }

    @Test
    void readRecords_shouldRejectMalformedJson() {
        assertThrows(IOException.class, () -> TriageJson.readRecords("[{\"text\": "));
    }

    @Test
    void write_shouldUseSnakeCaseNames() {
        var message = new Message("m1", "hello", "bob", "ops", Instant.EPOCH, null, null);
        message.setCategorization("general", 0.1);

        String json = TriageJson.write(List.of(OutputRecord.from(message, "#66BB6A", 100)));

        assertTrue(json.contains("\"priority_score\""));
        assertTrue(json.contains("\"similar_tickets\""));
        assertTrue(json.contains("\"thread_ts\""));
        assertTrue(json.contains("\"ts\" : \"0.000000\""));
    }
}
