package info.isaksson.erland.seqtoeventb.extract;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Something the extractor recovered from instead of failing on.
 *
 * <p>{@link #code} is stable across versions and meant for tooling; {@link #message} is for
 * people. Warnings order by code, then by their details, so a run always reports them in the same
 * order.</p>
 */
public final class ExtractionWarning implements Comparable<ExtractionWarning> {

    /** Compressed payload could not be decoded; the outer tree was used. */
    public static final String DECODE_FALLBACK = "DECODE_FALLBACK";
    /** No usable diagram name; a file name or the default name was used. */
    public static final String MISSING_NAME = "MISSING_NAME";
    /** Message dropped because its sender matches no lifeline. */
    public static final String UNRESOLVED_SENDER = "UNRESOLVED_SENDER";
    /** Message kept with an {@code Unknown} receiver. */
    public static final String UNRESOLVED_RECEIVER = "UNRESOLVED_RECEIVER";
    /** Guard variable name clashes with a protocol state variable and was skipped. */
    public static final String RESERVED_GUARD_NAME = "RESERVED_GUARD_NAME";
    /** Participant name is kept as drawn but is not a valid Event-B identifier. */
    public static final String NON_IDENTIFIER_PARTICIPANT = "NON_IDENTIFIER_PARTICIPANT";
    public static final String NO_FLOWS = "NO_FLOWS";

    public final String code;
    public final String message;

    /** Details keyed by name ({@code edgeId}, {@code nodeId}, {@code name}, ...), sorted by key. */
    public final Map<String, String> context;

    ExtractionWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.context = context == null || context.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(context));
    }

    /** Detail value or {@code null}. */
    public String get(String key) {
        return context.get(key);
    }

    @Override
    public int compareTo(ExtractionWarning o) {
        int c = code.compareTo(o.code);
        if (c != 0) return c;
        c = message.compareTo(o.message);
        if (c != 0) return c;
        return context.toString().compareTo(o.context.toString());
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionWarning)) return false;
        ExtractionWarning that = (ExtractionWarning) o;
        return code.equals(that.code) && message.equals(that.message) && context.equals(that.context);
    }

    @Override public int hashCode() {
        return Objects.hash(code, message, context);
    }

    @Override public String toString() {
        return code + ": " + message + (context.isEmpty() ? "" : " " + context);
    }
}
