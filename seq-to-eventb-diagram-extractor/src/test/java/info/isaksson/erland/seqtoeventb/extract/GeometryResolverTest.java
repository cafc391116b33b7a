package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.model.Box;
import info.isaksson.erland.seqtoeventb.model.DiagramDocument;
import info.isaksson.erland.seqtoeventb.model.DiagramNode;
import info.isaksson.erland.seqtoeventb.model.Point;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GeometryResolverTest {

    private static DiagramNode vertex(String id, String parent, double x, double y, double w, double h) {
        return new DiagramNode(id, "mxCell", "", "", new Box(x, y, w, h), parent,
                false, true, null, null, null, null, null);
    }

    private static DiagramDocument doc(DiagramNode... nodes) {
        return new DiagramDocument("t.drawio", List.of(), null, List.of(nodes), false, null);
    }

    @Test
    void accumulatesOffsetsButNotSizes() {
        DiagramDocument d = doc(
                vertex("0", null, 0, 0, 0, 0),
                vertex("1", "0", 0, 0, 0, 0),
                vertex("outer", "1", 100, 50, 400, 300),
                vertex("inner", "outer", 20, 30, 200, 100),
                vertex("leaf", "inner", 5, 5, 10, 10));
        GeometryResolver g = new GeometryResolver(d, Set.of("0", "1"));

        assertEquals(new Box(125, 85, 10, 10), g.absolute(d.node("leaf")));
        assertEquals(new Box(120, 80, 200, 100), g.absolute(d.node("inner")));
        assertEquals(new Point(120, 80), g.containerOrigin(d.node("leaf")));
    }

    @Test
    void missingGeometryIsZeroBox() {
        DiagramNode bare = new DiagramNode("x", null, null, null, null, "1",
                false, true, null, null, null, null, null);
        GeometryResolver g = new GeometryResolver(doc(bare), Set.of("0", "1"));
        assertEquals(Box.ZERO, g.absolute(bare));
    }

    @Test
    void parentCycleTerminates() {
        DiagramDocument d = doc(
                vertex("a", "b", 10, 10, 5, 5),
                vertex("b", "a", 20, 20, 5, 5));
        GeometryResolver g = new GeometryResolver(d, Set.of());

        Box a = g.absolute(d.node("a"));
        assertEquals(5.0, a.width);
        assertEquals(30.0, a.x);
    }

    @Test
    void edgePointsAreRelativeToEdgeParent() {
        DiagramDocument d = doc(
                vertex("grp", "1", 100, 200, 300, 300),
                new DiagramNode("e", null, "go", "", Box.ZERO, "grp", true, false,
                        null, null, new Point(10, 20), null, null));
        GeometryResolver g = new GeometryResolver(d, Set.of("0", "1"));

        assertEquals(new Point(110, 220), g.absolutePoint(d.node("e"), d.node("e").sourcePoint));
    }
}
