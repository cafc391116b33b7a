package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.model.Box;
import info.isaksson.erland.seqtoeventb.model.DiagramDocument;
import info.isaksson.erland.seqtoeventb.model.DiagramNode;
import info.isaksson.erland.seqtoeventb.model.Point;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts parent-relative cell geometry to absolute diagram coordinates.
 *
 * <p>The absolute origin of every visited cell is memoized, so each parent chain is walked at
 * most once per document. Walks stop at a root sentinel (a configured root id, a cell without
 * parent or an unknown id), on a parent cycle, and after at most {@code document.size()} steps.</p>
 */
public final class GeometryResolver {

    private final DiagramDocument document;
    private final Set<String> rootIds;
    private final Map<String, Point> origins = new HashMap<>();

    public GeometryResolver(DiagramDocument document, Set<String> rootIds) {
        this.document = Objects.requireNonNull(document, "document");
        this.rootIds = rootIds == null ? Set.of() : Set.copyOf(rootIds);
    }

    /** Absolute bounding box; width and height are never accumulated. */
    public Box absolute(DiagramNode node) {
        if (node == null) return Box.ZERO;
        return node.geometry.withOrigin(originOf(node));
    }

    /**
     * Absolute position of a point stored on {@code owner} (edge source/target points and
     * waypoints are relative to the edge's parent cell).
     */
    public Point absolutePoint(DiagramNode owner, Point relative) {
        if (relative == null) return null;
        Point base = containerOrigin(owner);
        return base.translate(relative.x, relative.y);
    }

    /** Absolute origin of the cell that contains {@code node}. */
    public Point containerOrigin(DiagramNode node) {
        if (node == null || isSentinel(node.parentId)) return Point.ORIGIN;
        DiagramNode parent = document.node(node.parentId);
        return parent == null ? Point.ORIGIN : originOf(parent);
    }

    private Point originOf(DiagramNode node) {
        Point cached = origins.get(node.id);
        if (cached != null) return cached;

        List<DiagramNode> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Point base = Point.ORIGIN;
        DiagramNode current = node;
        int limit = document.size();
        while (current != null && chain.size() <= limit) {
            Point known = origins.get(current.id);
            if (known != null) {
                base = known;
                break;
            }
            if (!seen.add(current.id)) break;
            chain.add(current);
            if (isSentinel(current.parentId)) break;
            current = document.node(current.parentId);
        }

        // unwind from the outermost ancestor down to the node
        for (int i = chain.size() - 1; i >= 0; i--) {
            DiagramNode n = chain.get(i);
            base = base.translate(n.geometry.x, n.geometry.y);
            origins.put(n.id, base);
        }
        return origins.getOrDefault(node.id, Point.ORIGIN);
    }

    private boolean isSentinel(String id) {
        if (id == null || rootIds.contains(id)) return true;
        DiagramNode n = document.node(id);
        return n == null || n.parentId == null;
    }
}
