package io.hearth.core.provider;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips bookkeeping remarks ("I've saved", "based on the extracted data") that models add to replies
 * when asked to extract data at the same time.
 */
public final class ReplyCleaner {
    private static final List<Pattern> META_PHRASES = List.of(
        Pattern.compile("based on (what you (said|told me|mentioned)|the extracted data)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("I've (saved|noted|recorded|stored|captured)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("let me (save|note|record|store|capture)", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern REPEATED_SPACE = Pattern.compile("\\s{2,}");
    private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[,;.]\\s*");

    private ReplyCleaner() {
    }

    public static String clean(String reply) {
        if (reply == null) {
            return "";
        }
        String cleaned = reply;
        for (Pattern phrase : META_PHRASES) {
            cleaned = phrase.matcher(cleaned).replaceAll("");
        }
        cleaned = REPEATED_SPACE.matcher(cleaned).replaceAll(" ").trim();
        return LEADING_PUNCTUATION.matcher(cleaned).replaceFirst("");
    }
}
