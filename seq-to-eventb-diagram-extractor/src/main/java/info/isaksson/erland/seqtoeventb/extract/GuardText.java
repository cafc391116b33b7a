package info.isaksson.erland.seqtoeventb.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bracketed predicates ({@code [valid == 1]}) found in labels.
 */
final class GuardText {

    private static final Pattern BRACKETED = Pattern.compile("\\[([^\\[\\]]*)]");
    private static final Pattern IN_KEYWORD = Pattern.compile("\\s+in\\s+");
    private static final Pattern WS = Pattern.compile("\\s+");

    private GuardText() {}

    /** Contents of the first non-empty bracket pair, trimmed. */
    static Optional<String> first(String label) {
        List<String> all = all(label);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    static List<String> all(String label) {
        List<String> out = new ArrayList<>();
        if (label == null || label.indexOf('[') < 0) return out;
        Matcher m = BRACKETED.matcher(label);
        while (m.find()) {
            String inner = m.group(1).trim();
            if (!inner.isEmpty()) out.add(inner);
        }
        return out;
    }

    /**
     * Rewrites diagram-style operators into Event-B ASCII notation:
     * {@code ==} and {@code :=} become {@code =}, {@code !=} becomes {@code /=},
     * {@code x in 0..5} becomes {@code x : 0..5}.
     */
    static String toEventB(String predicate) {
        if (predicate == null) return null;
        String s = predicate.trim()
                .replace("==", "=")
                .replace(":=", "=")
                .replace("!=", "/=")
                .replace("≠", "/=")
                .replace("∈", ":");
        s = IN_KEYWORD.matcher(s).replaceAll(" : ");
        return WS.matcher(s).replaceAll(" ");
    }
}
