package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.ir.IrScope;
import info.isaksson.erland.seqtoeventb.ir.IrScopeKind;
import info.isaksson.erland.seqtoeventb.model.Box;

/**
 * Mutable scope under construction. The guard is write-once: {@link #trySetGuard(String)} is
 * the only way to assign it.
 */
final class ScopeBuilder {
    final String id;
    final IrScopeKind kind;
    final int ordinal;
    final Box bounds;
    private String guard;

    ScopeBuilder(String id, IrScopeKind kind, int ordinal, Box bounds) {
        this.id = id;
        this.kind = kind;
        this.ordinal = ordinal;
        this.bounds = bounds;
    }

    /**
     * Assigns the guard unless one is already set.
     *
     * @return whether the assignment took effect
     */
    boolean trySetGuard(String predicate) {
        if (guard != null || predicate == null || predicate.isBlank()) return false;
        guard = predicate;
        return true;
    }

    boolean hasGuard() {
        return guard != null;
    }

    String guard() {
        return guard;
    }

    /** Horizontal span inclusive; vertical span may start {@code tolerance} above the top edge. */
    boolean containsLabelAt(double x, double y, double tolerance) {
        return bounds.x <= x && x <= bounds.right()
                && bounds.y - tolerance <= y && y <= bounds.bottom();
    }

    IrScope build() {
        return new IrScope(id, kind, ordinal, bounds.x, bounds.y, bounds.width, bounds.height, guard);
    }
}
