package de.bsommerfeld.triage.engine;

import com.google.common.hash.Hashing;
import de.bsommerfeld.triage.core.domain.Message;
import de.bsommerfeld.triage.core.domain.MessageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;

/**
 * Turns raw ingestion records into pipeline messages. Malformed input is
 * defaulted, never rejected: missing user and channel get sentinels, an
 * absent or unreadable timestamp becomes "now" and an absent id is derived
 * from the content.
 */
final class MessageFactory {

    private static final Logger LOG = LoggerFactory.getLogger(MessageFactory.class);

    static final String UNKNOWN_USER = "unknown";
    static final String DEFAULT_CHANNEL = "general";
    private static final BigDecimal NANOS_PER_SECOND = BigDecimal.valueOf(1_000_000_000L);

    private final Clock clock;

    MessageFactory(Clock clock) {
        this.clock = clock;
    }

    Message create(MessageRecord record) {
        String text = record.text() != null ? record.text() : "";
        String user = orDefault(record.user(), UNKNOWN_USER);
        String channel = orDefault(record.channel(), DEFAULT_CHANNEL);
        String id = record.id() != null && !record.id().isBlank()
                ? record.id()
                : deriveId(channel, user, text);

        return new Message(id, text, user, channel, parseTimestamp(record.ts()), record.threadTs(),
                record.reactions());
    }

    /**
     * {@code msg_} plus the first 16 hex digits of SHA-256 over channel, user
     * and text. The same text posted by the same author in the same channel
     * yields the same id.
     */
    static String deriveId(String channel, String user, String text) {
        String key = channel + '\u0000' + user + '\u0000' + text;
        return "msg_" + Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString().substring(0, 16);
    }

    /**
     * Accepts epoch seconds (number or numeric string, fraction allowed),
     * ISO-8601 instants and {@link Instant}s. Anything else resolves to the
     * current time.
     */
    Instant parseTimestamp(Object ts) {
        if (ts == null)
            return clock.instant();
        if (ts instanceof Instant instant)
            return instant;
        try {
            if (ts instanceof Number number)
                return fromEpochSeconds(toDecimal(number));
            String raw = ts.toString().trim();
            try {
                return fromEpochSeconds(new BigDecimal(raw));
            } catch (NumberFormatException notNumeric) {
                return Instant.parse(raw);
            }
        } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
            LOG.debug("Unparsable timestamp '{}', defaulting to now", ts);
            return clock.instant();
        }
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal)
            return decimal;
        if (number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof Byte)
            return BigDecimal.valueOf(number.longValue());
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value))
            throw new NumberFormatException("Not a finite timestamp: " + value);
        return BigDecimal.valueOf(value);
    }

    private static Instant fromEpochSeconds(BigDecimal seconds) {
        BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
        long nanos = seconds.subtract(whole).multiply(NANOS_PER_SECOND).setScale(0, RoundingMode.FLOOR)
                .longValueExact();
        return Instant.ofEpochSecond(whole.longValueExact(), nanos);
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
