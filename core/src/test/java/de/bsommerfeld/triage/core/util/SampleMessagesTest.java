package de.bsommerfeld.triage.core.util;

import de.bsommerfeld.triage.core.domain.MessageRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SampleMessagesTest {

    private static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    @Test
    void sampleBatch_shouldContainTenRecordsWithIds() {
        List<MessageRecord> batch = SampleMessages.sampleBatch(NOW);

        assertEquals(10, batch.size());
        assertEquals("msg_001", batch.get(0).id());
        assertEquals("msg_010", batch.get(9).id());
    }

    @Test
    void sampleBatch_shouldStampRelativeToNow() {
        MessageRecord first = SampleMessages.sampleBatch(NOW).get(0);

        double ts = Double.parseDouble((String) first.ts());
        assertEquals(NOW.minusSeconds(3600).getEpochSecond(), (long) ts);
    }

    @Test
    void generateRecord_shouldHaveRequiredFields() {
        MessageRecord record = SampleMessages.generateRecord(NOW);

        assertTrue(record.id().startsWith("gen_"));
        assertFalse(record.text().isBlank());
        assertNotNull(record.user());
        assertNotNull(record.channel());
        assertNotNull(record.reactions());
        assertTrue(record.reactions().size() <= 3);
    }

    @Test
    void generateRecord_shouldProduceUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(SampleMessages.generateRecord(NOW).id());
        }
        assertEquals(50, ids.size());
    }

    @Test
    void generateRecords_shouldBeOldestFirstWithinLastDay() {
        List<MessageRecord> records = SampleMessages.generateRecords(8, NOW);

        assertEquals(8, records.size());
        double previous = 0;
        for (MessageRecord record : records) {
            double ts = Double.parseDouble((String) record.ts());
            assertTrue(ts >= previous, "Records should be sorted oldest first");
            assertTrue(ts >= NOW.minusSeconds(24 * 3600).getEpochSecond());
            assertTrue(ts <= NOW.getEpochSecond());
            previous = ts;
        }
    }
}
