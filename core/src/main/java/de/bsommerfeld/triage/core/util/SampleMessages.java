package de.bsommerfeld.triage.core.util;

import de.bsommerfeld.triage.core.domain.MessageRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Produces realistic team-chat records for offline development, demos and
 * tests.
 *
 * <p>
 * Two flavors are available:
 * <ul>
 * <li>{@link #sampleBatch(Instant)}: a fixed, hand-written set of ten support
 * messages covering every default category, timestamped relative to the
 * given instant</li>
 * <li>{@link #generateRecords(int, Instant)}: randomly composed messages with
 * timestamps spread across the preceding 24 hours, oldest first</li>
 * </ul>
 * Timestamps are emitted as epoch-second strings, the way chat exports carry
 * them.
 */
public class SampleMessages {

    private static final Random RND = new Random();

    // --- Data Pools ---

    private static final String[] CHANNELS = { "alerts", "dev-help", "bug-reports", "feature-requests", "devops",
            "access-requests", "announcements" };

    private static final String[] USERS = { "john_doe", "jane_smith", "mike_wilson", "sarah_johnson", "alex_brown",
            "admin", "tom_anderson", "lisa_martinez", "david_lee" };

    private static final String[] SUBJECTS = { "The login page", "Our staging pipeline", "The billing service",
            "Production API", "The mobile app", "Search indexing", "The nightly build" };

    private static final String[] PREDICATES = { "is down again", "throws a 500 error", "needs a dark mode toggle",
            "failed to deploy to staging", "is really slow today", "rejects my password",
            "got a new release notes page" };

    private static final String[] TAILS = { "Can someone help?", "URGENT!", "FYI.", "Any ideas?",
            "Stack trace in thread.", "Would be nice to have.", "" };

    private static final String[] REACTIONS = { "eyes", "fire", "thumbsup", "bug", "question", "rocket", "sos" };

    /**
     * Returns ten hand-written support messages, one to fourteen hours older
     * than {@code now}, in processing order.
     */
    public static List<MessageRecord> sampleBatch(Instant now) {
        List<MessageRecord> list = new ArrayList<>();
        list.add(record("msg_001", "URGENT: Production server is down! Users can't login. Need immediate help!",
                "john_doe", "alerts", now, 1, List.of("fire", "eyes", "sos")));
        list.add(record("msg_002", "Can someone help me understand how the OAuth authentication flow works? "
                + "I'm getting confused with the redirect URLs.",
                "jane_smith", "dev-help", now, 2, List.of("question")));
        list.add(record("msg_003", "Found a critical bug in the user registration form. When users enter special "
                + "characters, the form crashes with a 500 error. Stack trace attached.",
                "mike_wilson", "bug-reports", now, 3, List.of("bug", "thumbsup")));
        list.add(record("msg_004", "Feature request: Can we add a dark mode toggle to the user settings page? "
                + "Many users have been asking for this enhancement.",
                "sarah_johnson", "feature-requests", now, 4, List.of("bulb", "thumbsup", "moon")));
        list.add(record("msg_005", "The CI/CD pipeline failed again on the staging deployment. Looks like there's "
                + "an issue with the Docker build process. Can someone investigate?",
                "alex_brown", "devops", now, 5, List.of("wrench")));
        list.add(record("msg_006", "I need access to the production database for debugging. Can someone grant me "
                + "read-only permissions? My username is alex.brown.",
                "alex_brown", "access-requests", now, 6, List.of("lock")));
        list.add(record("msg_007", "FYI: Scheduled maintenance window this Sunday 2-4 AM EST. The main application "
                + "will be temporarily unavailable. Please plan accordingly.",
                "admin", "announcements", now, 12, List.of("loudspeaker", "thumbsup")));
        list.add(record("msg_008", "Another authentication issue here. Users are getting randomly logged out after "
                + "10 minutes. This might be related to the session timeout configuration we changed last week.",
                "tom_anderson", "bug-reports", now, 8, List.of("lock", "bug")));
        list.add(record("msg_009", "How do we handle GDPR data export requests? Do we have a standard process for "
                + "this? Customer is asking for all their data.",
                "lisa_martinez", "compliance", now, 10, List.of("scales", "question")));
        list.add(record("msg_010", "New API endpoint is ready for testing! Can someone from QA please review the "
                + "documentation and run the test cases? Link in thread.",
                "david_lee", "api-development", now, 14, List.of("checkmark", "clipboard")));
        return list;
    }

    /**
     * Generates a single record stamped at {@code at}, with a random author,
     * channel, composed text and zero to three reactions.
     */
    public static MessageRecord generateRecord(Instant at) {
        String id = "gen_" + UUID.randomUUID().toString().substring(0, 8);
        String text = (randomElement(SUBJECTS) + " " + randomElement(PREDICATES) + ". " + randomElement(TAILS))
                .trim();
        List<String> reactions = new ArrayList<>();
        int reactionCount = RND.nextInt(4);
        for (int i = 0; i < reactionCount; i++) {
            reactions.add(randomElement(REACTIONS));
        }
        return new MessageRecord(id, text, randomElement(USERS), randomElement(CHANNELS), epochSeconds(at),
                null, reactions);
    }

    /**
     * Generates {@code count} records spread linearly across the 24 hours
     * before {@code now}. The first record is the oldest, matching the order
     * in which an export would be replayed.
     */
    public static List<MessageRecord> generateRecords(int count, Instant now) {
        List<MessageRecord> list = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            long secondsBack = (long) (((count - i) / (double) count) * 3600 * 24);
            list.add(generateRecord(now.minusSeconds(secondsBack)));
        }
        return list;
    }

    private static MessageRecord record(String id, String text, String user, String channel, Instant now,
            int hoursAgo, List<String> reactions) {
        return new MessageRecord(id, text, user, channel, epochSeconds(now.minus(Duration.ofHours(hoursAgo))),
                null, reactions);
    }

    private static String epochSeconds(Instant instant) {
        return instant.getEpochSecond() + "." + String.format("%06d", instant.getNano() / 1000);
    }

    private static <T> T randomElement(T[] array) {
        return array[RND.nextInt(array.length)];
    }
}
