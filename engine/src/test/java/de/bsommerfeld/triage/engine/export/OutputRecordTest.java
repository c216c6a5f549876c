package de.bsommerfeld.triage.engine.export;

import de.bsommerfeld.triage.core.domain.Message;
import de.bsommerfeld.triage.core.domain.SimilarityMatch;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputRecordTest {

    @Test
    void from_shouldFlattenMessage() {
        var message = new Message("m1", "login broken", "bob", "ops",
                Instant.ofEpochSecond(1_700_000_000L, 123_456_000L), "1699999999.000001", List.of("eyes"));
        message.setCategorization("bug_report", 0.6);
        message.setPriorityScore(0.55);
        message.setSimilarMessages(List.of(new SimilarityMatch("m0", 2.0 / 3.0, "bug_report",
                List.of("login broken"), "login broken again")));

        OutputRecord record = OutputRecord.from(message, "#FF6B6B", 100);

        assertEquals("1700000000.123456", record.ts());
        assertEquals("bug_report", record.category());
        assertEquals("#FF6B6B", record.color());
        assertEquals(1, record.similarTickets().size());
        OutputRecord.SimilarTicket ticket = record.similarTickets().get(0);
        assertEquals("m0", ticket.ticketId());
        assertEquals(0.667, ticket.similarityScore(), 1e-12);
        assertEquals("login broken again", ticket.textPreview());
    }

    @Test
    void preview_shouldTruncateLongText() {
        assertEquals("abc", OutputRecord.preview("abc", 3));
        assertEquals("abc...", OutputRecord.preview("abcdef", 3));
        assertEquals("", OutputRecord.preview(null, 3));
    }
}
