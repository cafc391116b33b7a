package info.isaksson.erland.seqtoeventb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A combined fragment (frame) with its absolute bounds and optional guard predicate.
 *
 * <p>The ordinal counts per kind in discovery order, so the first {@code opt} frame and the
 * first {@code loop} frame both have ordinal 1.</p>
 */
@JsonPropertyOrder({"id","kind","ordinal","x","y","width","height","guard"})
public final class IrScope {
    public final String id;
    public final IrScopeKind kind;
    public final int ordinal;
    public final double x;
    public final double y;
    public final double width;
    public final double height;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String guard;

    @JsonCreator
    public IrScope(
            @JsonProperty("id") String id,
            @JsonProperty("kind") IrScopeKind kind,
            @JsonProperty("ordinal") int ordinal,
            @JsonProperty("x") double x,
            @JsonProperty("y") double y,
            @JsonProperty("width") double width,
            @JsonProperty("height") double height,
            @JsonProperty("guard") String guard
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.kind = kind == null ? IrScopeKind.OPTIONAL : kind;
        this.ordinal = ordinal;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.guard = guard == null || guard.isBlank() ? null : guard;
    }

    /** Event name suffix, e.g. {@code _opt1}. */
    public String suffix() {
        return "_" + kind.token + ordinal;
    }

    /** Whether the absolute vertical position lies within this frame (edges inclusive). */
    public boolean spansVertically(double absY) {
        return y <= absY && absY <= y + height;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrScope)) return false;
        IrScope that = (IrScope) o;
        return ordinal == that.ordinal &&
                Double.compare(x, that.x) == 0 &&
                Double.compare(y, that.y) == 0 &&
                Double.compare(width, that.width) == 0 &&
                Double.compare(height, that.height) == 0 &&
                id.equals(that.id) &&
                kind == that.kind &&
                Objects.equals(guard, that.guard);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, ordinal, x, y, width, height, guard);
    }

    @Override public String toString() {
        return suffix() + (guard == null ? "" : "[" + guard + "]");
    }
}
