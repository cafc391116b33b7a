package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.ir.IrLifeline;
import info.isaksson.erland.seqtoeventb.model.DiagramDocument;
import info.isaksson.erland.seqtoeventb.model.DiagramNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Participants of the interaction, keyed by resolved display name.
 *
 * <p>A label {@code user:User} or {@code :User} resolves to {@code User}. Several cells with
 * the same resolved name are merged; the first one registered defines the center.</p>
 */
public final class LifelineRegistry {

    private final DiagramDocument document;
    private final Map<String, Entry> byName = new LinkedHashMap<>();
    private final Map<String, String> nameByNodeId = new HashMap<>();

    private LifelineRegistry(DiagramDocument document) {
        this.document = document;
    }

    public static LifelineRegistry build(DiagramDocument document, GeometryResolver geometry) {
        LifelineRegistry registry = new LifelineRegistry(document);
        for (DiagramNode n : document.nodes) {
            if (!isParticipantShape(n) || !n.hasLabel()) continue;
            String name = resolveName(n.label);
            if (name.isEmpty()) continue;
            registry.register(name, n.id, geometry.absolute(n).centerX());
        }
        return registry;
    }

    public static boolean isParticipantShape(DiagramNode n) {
        return n.styleContains("umlLifeline")
                || n.styleContains("participant")
                || n.styleContains("shape=umlActor");
    }

    /** Keep the text after the last role/type separator. */
    static String resolveName(String label) {
        if (label == null) return "";
        int sep = label.lastIndexOf(':');
        String name = sep >= 0 ? label.substring(sep + 1) : label;
        return name.trim();
    }

    private void register(String name, String nodeId, double centerX) {
        byName.computeIfAbsent(name, k -> new Entry(k, centerX)).nodeIds.add(nodeId);
        nameByNodeId.put(nodeId, name);
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * Lifeline owning {@code nodeId}: the cell itself or the closest ancestor that is a lifeline
     * (message arrows often attach to activation bars nested inside the lifeline).
     */
    public Optional<String> nameForNode(String nodeId) {
        Set<String> seen = new HashSet<>();
        String current = nodeId;
        while (current != null && seen.add(current) && seen.size() <= document.size() + 1) {
            String name = nameByNodeId.get(current);
            if (name != null) return Optional.of(name);
            DiagramNode n = document.node(current);
            current = n == null ? null : n.parentId;
        }
        return Optional.empty();
    }

    /**
     * Lifeline whose center is horizontally closest to {@code x}, provided the distance does not
     * exceed {@code threshold}. Ties go to the lifeline registered first.
     */
    public Optional<String> nearest(double x, double threshold) {
        Entry best = null;
        double bestDist = Double.POSITIVE_INFINITY;
        for (Entry e : byName.values()) {
            double d = Math.abs(e.centerX - x);
            if (d < bestDist) {
                bestDist = d;
                best = e;
            }
        }
        if (best == null || bestDist > threshold) return Optional.empty();
        return Optional.of(best.name);
    }

    public List<IrLifeline> lifelines() {
        List<IrLifeline> out = new ArrayList<>(byName.size());
        for (Entry e : byName.values()) {
            out.add(new IrLifeline(e.name, e.centerX, e.nodeIds));
        }
        return Collections.unmodifiableList(out);
    }

    private static final class Entry {
        final String name;
        final double centerX;
        final List<String> nodeIds = new ArrayList<>();

        Entry(String name, double centerX) {
            this.name = name;
            this.centerX = centerX;
        }
    }
}
