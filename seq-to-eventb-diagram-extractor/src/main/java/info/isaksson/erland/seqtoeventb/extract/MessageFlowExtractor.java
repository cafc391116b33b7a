package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.ir.IrMessageFlow;
import info.isaksson.erland.seqtoeventb.ir.IrScope;
import info.isaksson.erland.seqtoeventb.model.Box;
import info.isaksson.erland.seqtoeventb.model.DiagramDocument;
import info.isaksson.erland.seqtoeventb.model.DiagramNode;
import info.isaksson.erland.seqtoeventb.model.Point;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers message arrows: who sends what to whom, and in which order.
 *
 * <p>Endpoints resolve through the lifeline registry, first by the edge's explicit
 * {@code source}/{@code target} cell, then by the lifeline horizontally nearest to the
 * endpoint. Flows are numbered after a stable sort on their vertical position and attributed to
 * the innermost (smallest height) scope spanning that position.</p>
 */
public final class MessageFlowExtractor {

    private static final Pattern CALL = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?:\\(([^)]*)\\))?");

    private final GeometryResolver geometry;
    private final LifelineRegistry lifelines;
    private final double distanceThreshold;

    public MessageFlowExtractor(GeometryResolver geometry, LifelineRegistry lifelines, double distanceThreshold) {
        this.geometry = geometry;
        this.lifelines = lifelines;
        this.distanceThreshold = distanceThreshold;
    }

    public List<IrMessageFlow> extract(DiagramDocument document, List<IrScope> scopes, ExtractionWarnings warnings) {
        List<IrMessageFlow> flows = new ArrayList<>();
        for (DiagramNode edge : document.nodes) {
            if (!edge.edge) continue;
            String label = edgeLabel(document, edge);
            if (label.isEmpty()) continue;

            Optional<String> sender = resolveEndpoint(document, edge, edge.sourceId, edge.sourcePoint);
            if (sender.isEmpty()) {
                warnings.unresolvedSender(edge.id, label);
                continue;
            }
            Optional<String> receiver = resolveEndpoint(document, edge, edge.targetId, edge.targetPoint);
            if (receiver.isEmpty()) {
                warnings.unresolvedReceiver(edge.id, label);
            }

            CallLabel call = CallLabel.parse(label);
            flows.add(new IrMessageFlow(0, call.name, call.data, sender.get(),
                    receiver.orElse(IrMessageFlow.UNKNOWN_PARTICIPANT), verticalPosition(document, edge), null, edge.id));
        }

        List<IrMessageFlow> ordered = orderByVerticalPosition(flows);
        List<IrMessageFlow> out = new ArrayList<>(ordered.size());
        for (IrMessageFlow f : ordered) {
            IrScope scope = innermostScope(scopes, f.y);
            out.add(scope == null ? f : f.withScope(scope.id));
        }
        return out;
    }

    /**
     * Stable sort by vertical position, then renumber from 1. Applying it to its own output
     * yields the same list.
     */
    public static List<IrMessageFlow> orderByVerticalPosition(List<IrMessageFlow> flows) {
        List<IrMessageFlow> sorted = new ArrayList<>(flows);
        sorted.sort(Comparator.comparingDouble(f -> f.y));
        List<IrMessageFlow> out = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            out.add(sorted.get(i).withOrdinal(i + 1));
        }
        return out;
    }

    /**
     * Smallest-height scope whose vertical span contains {@code y}; the first discovered wins a
     * tie. Nesting is inferred from height only, not from an explicit containment graph.
     */
    public static IrScope innermostScope(List<IrScope> scopes, double y) {
        IrScope best = null;
        for (IrScope s : scopes) {
            if (!s.spansVertically(y)) continue;
            if (best == null || s.height < best.height) best = s;
        }
        return best;
    }

    private String edgeLabel(DiagramDocument document, DiagramNode edge) {
        if (edge.hasLabel()) return edge.label;
        for (DiagramNode n : document.nodes) {
            if (edge.id.equals(n.parentId) && n.vertex && n.styleContains("edgeLabel") && n.hasLabel()) {
                return n.label;
            }
        }
        return "";
    }

    private Optional<String> resolveEndpoint(DiagramDocument document, DiagramNode edge, String cellId, Point point) {
        if (cellId != null) {
            Optional<String> byId = lifelines.nameForNode(cellId);
            if (byId.isPresent()) return byId;
        }
        Double x = null;
        if (point != null) {
            x = geometry.absolutePoint(edge, point).x;
        } else if (cellId != null && document.node(cellId) != null) {
            x = geometry.absolute(document.node(cellId)).centerX();
        }
        return x == null ? Optional.empty() : lifelines.nearest(x, distanceThreshold);
    }

    private double verticalPosition(DiagramDocument document, DiagramNode edge) {
        if (edge.sourcePoint != null) return geometry.absolutePoint(edge, edge.sourcePoint).y;
        if (edge.targetPoint != null) return geometry.absolutePoint(edge, edge.targetPoint).y;
        if (!edge.waypoints.isEmpty()) return geometry.absolutePoint(edge, edge.waypoints.get(0)).y;

        DiagramNode source = document.node(edge.sourceId);
        if (source != null) {
            double exitY = 0.5;
            String v = edge.styleValue("exitY");
            if (v != null) {
                try {
                    exitY = Double.parseDouble(v);
                } catch (NumberFormatException e) {
                    exitY = 0.5;
                }
            }
            Box box = geometry.absolute(source);
            return box.y + box.height * exitY;
        }
        return 0;
    }

    /** {@code login(user, pwd)} splits into call {@code login} and data {@code user}. */
    static final class CallLabel {
        final String name;
        final String data;

        private CallLabel(String name, String data) {
            this.name = name;
            this.data = data;
        }

        static CallLabel parse(String label) {
            String text = label.trim();
            Matcher m = CALL.matcher(text);
            if (!m.lookingAt()) {
                return new CallLabel(Identifiers.sanitize(text, "message"), null);
            }
            String data = null;
            String args = m.group(2);
            if (args != null) {
                // only the first argument is carried as data
                String first = args.split(",", -1)[0].trim();
                if (!first.isEmpty()) data = dataIdentifier(first);
            }
            return new CallLabel(m.group(1), data);
        }

        private static String dataIdentifier(String arg) {
            Matcher m = CALL.matcher(arg);
            if (m.lookingAt()) return m.group(1);
            return Identifiers.sanitize(arg, null);
        }
    }
}
