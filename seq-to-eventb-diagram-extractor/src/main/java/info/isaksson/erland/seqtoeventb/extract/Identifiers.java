package info.isaksson.erland.seqtoeventb.extract;

import java.util.regex.Pattern;

/** Turns free label text into Event-B identifiers. */
final class Identifiers {

    private static final Pattern NON_WORD = Pattern.compile("[^A-Za-z0-9_]+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Identifiers() {}

    static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER.matcher(text).matches();
    }

    /**
     * Replaces runs of non-identifier characters with {@code _}, trims leading/trailing
     * underscores and prefixes a leading digit. Returns {@code fallback} when nothing is left.
     */
    static String sanitize(String text, String fallback) {
        if (text == null) return fallback;
        String s = NON_WORD.matcher(text.trim()).replaceAll("_");
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '_') start++;
        while (end > start && s.charAt(end - 1) == '_') end--;
        s = s.substring(start, end);
        if (s.isEmpty()) return fallback;
        if (Character.isDigit(s.charAt(0))) s = "m" + s;
        return s;
    }
}
