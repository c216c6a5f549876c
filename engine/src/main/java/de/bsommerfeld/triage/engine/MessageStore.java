package de.bsommerfeld.triage.engine;

import de.bsommerfeld.triage.core.domain.Message;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, insertion-ordered record of every processed message.
 * Nothing is ever removed or reordered, so the store grows without bound
 * and a similarity query over it costs one comparison per stored message.
 *
 * <p>
 * Reads are snapshot-safe. The read-then-append sequence of the pipeline
 * is made atomic by {@link TriageEngine}, not by the store.
 */
public final class MessageStore {

    private final List<Message> messages = new CopyOnWriteArrayList<>();

    public void append(Message message) {
        messages.add(Objects.requireNonNull(message, "message"));
    }

    /** All stored messages, oldest first. */
    public List<Message> all() {
        return Collections.unmodifiableList(messages);
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
