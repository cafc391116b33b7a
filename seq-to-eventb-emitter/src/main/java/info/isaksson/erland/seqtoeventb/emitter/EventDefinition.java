package info.isaksson.erland.seqtoeventb.emitter;

import java.util.List;
import java.util.Objects;

/**
 * One machine event. {@code INITIALISATION} is represented the same way, with no guards.
 */
public final class EventDefinition {

    public enum Kind { INITIALISATION, SEND, RECEIVE }

    public final String name;
    public final Kind kind;
    /** Ordinal of the message flow this event belongs to; 0 for {@code INITIALISATION}. */
    public final int flowOrdinal;
    public final List<Clause> guards;
    public final List<Clause> actions;

    public EventDefinition(String name, Kind kind, int flowOrdinal, List<Clause> guards, List<Clause> actions) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.flowOrdinal = flowOrdinal;
        this.guards = guards == null ? List.of() : List.copyOf(guards);
        this.actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public boolean hasGuard(String formula) {
        for (Clause c : guards) {
            if (c.formula.equals(formula)) return true;
        }
        return false;
    }

    @Override public String toString() {
        return name;
    }
}
