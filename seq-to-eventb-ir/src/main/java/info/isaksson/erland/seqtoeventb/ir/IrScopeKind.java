package info.isaksson.erland.seqtoeventb.ir;

import java.util.Locale;

/**
 * Combined fragment kinds recognized on sequence diagram frames.
 */
public enum IrScopeKind {
    OPTIONAL("opt"),
    ALTERNATIVE("alt"),
    LOOP("loop"),
    PARALLEL("par"),
    BREAK("break");

    /** Short token used in event suffixes, e.g. {@code _opt1}. */
    public final String token;

    IrScopeKind(String token) {
        this.token = token;
    }

    /**
     * Parse a frame keyword (case-insensitive). Accepts both the short UML operator
     * ({@code opt}, {@code alt}, {@code par}) and the long form ({@code optional}, ...).
     *
     * @return the kind, or {@code null} when the keyword is not recognized
     */
    public static IrScopeKind fromKeyword(String keyword) {
        if (keyword == null) return null;
        switch (keyword.trim().toLowerCase(Locale.ROOT)) {
            case "opt":
            case "optional":
                return OPTIONAL;
            case "alt":
            case "alternative":
                return ALTERNATIVE;
            case "loop":
                return LOOP;
            case "par":
            case "parallel":
                return PARALLEL;
            case "break":
                return BREAK;
            default:
                return null;
        }
    }
}
