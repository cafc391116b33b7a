package info.isaksson.erland.seqtoeventb.model;

import java.util.List;
import java.util.Objects;

/**
 * One cell of a draw.io graph model.
 *
 * <p>All optional attributes are normalized at parse time: missing labels and styles become
 * {@code ""}, missing geometry becomes {@link Box#ZERO}. Geometry is relative to the parent
 * cell; use the geometry resolver for absolute coordinates.</p>
 */
public final class DiagramNode {
    public final String id;
    /** Element name the cell was read from ({@code mxCell}, {@code UserObject}, ...). */
    public final String tag;
    /** Label as stored in the document, possibly containing HTML markup. */
    public final String rawLabel;
    /** Label with markup stripped, entities decoded and whitespace collapsed. */
    public final String label;
    public final String style;
    public final Box geometry;
    public final String parentId;
    public final boolean edge;
    public final boolean vertex;
    public final String sourceId;
    public final String targetId;
    /** Edge endpoints as stored (relative to the parent cell); {@code null} when absent. */
    public final Point sourcePoint;
    public final Point targetPoint;
    public final List<Point> waypoints;

    public DiagramNode(String id,
                       String tag,
                       String rawLabel,
                       String style,
                       Box geometry,
                       String parentId,
                       boolean edge,
                       boolean vertex,
                       String sourceId,
                       String targetId,
                       Point sourcePoint,
                       Point targetPoint,
                       List<Point> waypoints) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.tag = tag == null ? "mxCell" : tag;
        this.rawLabel = rawLabel == null ? "" : rawLabel;
        this.label = MarkupText.strip(this.rawLabel);
        this.style = style == null ? "" : style;
        this.geometry = geometry == null ? Box.ZERO : geometry;
        this.parentId = blankToNull(parentId);
        this.edge = edge;
        this.vertex = vertex;
        this.sourceId = blankToNull(sourceId);
        this.targetId = blankToNull(targetId);
        this.sourcePoint = sourcePoint;
        this.targetPoint = targetPoint;
        this.waypoints = waypoints == null ? List.of() : List.copyOf(waypoints);
    }

    public boolean hasLabel() {
        return !label.isEmpty();
    }

    public boolean styleContains(String token) {
        return style.contains(token);
    }

    /**
     * Value of a {@code key=value} entry in the style string, or {@code null}.
     */
    public String styleValue(String key) {
        for (String part : style.split(";")) {
            int eq = part.indexOf('=');
            if (eq > 0 && part.substring(0, eq).trim().equals(key)) {
                return part.substring(eq + 1).trim();
            }
        }
        return null;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    @Override public String toString() {
        return tag + "#" + id + (label.isEmpty() ? "" : "[" + label + "]");
    }
}
