package info.isaksson.erland.seqtoeventb.advisor;

/**
 * Either proposed property text or a note explaining why there is none.
 */
public final class AdvisoryResult {
    public final boolean ok;
    /** Proposed properties; {@code null} unless {@link #ok}. */
    public final String text;
    /** Failure note; {@code null} when {@link #ok}. */
    public final String note;

    private AdvisoryResult(boolean ok, String text, String note) {
        this.ok = ok;
        this.text = text;
        this.note = note;
    }

    public static AdvisoryResult ok(String text) {
        return new AdvisoryResult(true, text, null);
    }

    public static AdvisoryResult failed(String note) {
        return new AdvisoryResult(false, null, note);
    }

    /** Text to show the user either way. */
    public String display() {
        return ok ? text : "Advisory unavailable: " + note;
    }

    @Override public String toString() {
        return ok ? "ok" : "failed(" + note + ")";
    }
}
