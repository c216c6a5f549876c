package de.bsommerfeld.triage.engine;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strips chat noise from message text before any rule or signal sees it.
 * Links, user and channel references and emoji shortcodes are removed,
 * every character other than letters, digits, whitespace and {@code ? ! .}
 * becomes a space, whitespace runs collapse and the result is lowercased.
 *
 * <p>
 * The output never contains {@code :}, {@code /} or {@code <}, so a second
 * pass only re-collapses whitespace that is already collapsed:
 * {@code normalize(normalize(t)).equals(normalize(t))} holds for every input.
 */
public final class TextNormalizer {

    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern USER_MENTION = Pattern.compile("<@[A-Za-z0-9._-]+(?:\\|[^>]*)?>");
    private static final Pattern CHANNEL_MENTION = Pattern.compile("<#[A-Za-z0-9]+(?:\\|[^>]*)?>");
    private static final Pattern EMOJI = Pattern.compile(":[a-zA-Z0-9_+-]+:");
    private static final Pattern NOISE = Pattern.compile("[^\\w\\s?!.]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty())
            return "";
        String clean = URL.matcher(text).replaceAll("");
        clean = USER_MENTION.matcher(clean).replaceAll("");
        clean = CHANNEL_MENTION.matcher(clean).replaceAll("");
        clean = EMOJI.matcher(clean).replaceAll("");
        clean = NOISE.matcher(clean).replaceAll(" ");
        clean = WHITESPACE.matcher(clean).replaceAll(" ").trim();
        return clean.toLowerCase(Locale.ROOT);
    }
}
