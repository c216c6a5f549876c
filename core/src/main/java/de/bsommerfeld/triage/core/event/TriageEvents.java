package de.bsommerfeld.triage.core.event;

import de.bsommerfeld.triage.core.domain.Message;
import de.bsommerfeld.triage.core.domain.MessageRecord;

/**
 * Events published by the triage engine.
 */
public class TriageEvents {

    /**
     * Fired after a message has been categorized, scored, matched and stored.
     */
    public record MessageTriagedEvent(Message message) {
    }

    /**
     * Fired when a batch drops a record because processing it failed.
     * The batch itself carries on with the next record.
     */
    public record RecordSkippedEvent(MessageRecord record, String reason) {
    }
}
