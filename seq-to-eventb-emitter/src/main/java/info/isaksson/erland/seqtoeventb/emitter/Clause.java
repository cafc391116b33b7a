package info.isaksson.erland.seqtoeventb.emitter;

import java.util.Objects;

/** A labelled predicate or assignment, e.g. {@code grd1: m /: sentMessages}. */
public final class Clause {
    public final String label;
    public final String formula;

    public Clause(String label, String formula) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.formula = Objects.requireNonNull(formula, "formula must not be null");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Clause)) return false;
        Clause that = (Clause) o;
        return label.equals(that.label) && formula.equals(that.formula);
    }

    @Override public int hashCode() {
        return Objects.hash(label, formula);
    }

    @Override public String toString() {
        return label + ": " + formula;
    }
}
