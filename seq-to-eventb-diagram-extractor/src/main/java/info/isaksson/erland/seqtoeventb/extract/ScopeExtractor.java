package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.ir.IrScope;
import info.isaksson.erland.seqtoeventb.ir.IrScopeKind;
import info.isaksson.erland.seqtoeventb.model.Box;
import info.isaksson.erland.seqtoeventb.model.DiagramDocument;
import info.isaksson.erland.seqtoeventb.model.DiagramNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds combined fragments (opt/alt/loop/par/break frames) and attaches their guards.
 *
 * <p>A vertex is a frame when its style is a frame shape ({@code umlFrame},
 * {@code sysml.package}) or its label starts with a fragment keyword. Guards come from, in this
 * order of precedence: the frame's own label, a bracketed label nested inside the frame, a
 * bracketed label floating over the frame. The first guard assigned to a frame sticks.</p>
 */
public final class ScopeExtractor {

    private static final Pattern KEYWORD = Pattern.compile(
            "^(opt|optional|alt|alternative|loop|par|parallel|break)\\b", Pattern.CASE_INSENSITIVE);

    private final GeometryResolver geometry;
    private final double guardLabelTolerance;

    public ScopeExtractor(GeometryResolver geometry, double guardLabelTolerance) {
        this.geometry = geometry;
        this.guardLabelTolerance = guardLabelTolerance;
    }

    public List<IrScope> extract(DiagramDocument document) {
        Map<String, ScopeBuilder> scopes = discover(document);
        attachLabelGuards(document, scopes);

        List<IrScope> out = new ArrayList<>(scopes.size());
        for (ScopeBuilder b : scopes.values()) out.add(b.build());
        return out;
    }

    private Map<String, ScopeBuilder> discover(DiagramDocument document) {
        Map<String, ScopeBuilder> scopes = new LinkedHashMap<>();
        Map<IrScopeKind, Integer> counters = new EnumMap<>(IrScopeKind.class);

        for (DiagramNode n : document.nodes) {
            if (!n.vertex || LifelineRegistry.isParticipantShape(n) || isEdgeLabel(document, n)) continue;

            IrScopeKind kind = keywordKind(n.label).orElse(null);
            if (kind == null) {
                if (!isFrameStyle(n)) continue;
                kind = IrScopeKind.OPTIONAL;
            }

            int ordinal = counters.merge(kind, 1, Integer::sum);
            ScopeBuilder scope = new ScopeBuilder(n.id, kind, ordinal, geometry.absolute(n));
            GuardText.first(n.label).map(GuardText::toEventB).ifPresent(scope::trySetGuard);
            scopes.put(n.id, scope);
        }
        return scopes;
    }

    /** Text of a message arrow, stored as a vertex under the edge. */
    static boolean isEdgeLabel(DiagramDocument document, DiagramNode n) {
        if (n.styleContains("edgeLabel")) return true;
        DiagramNode parent = n.parentId == null ? null : document.node(n.parentId);
        return parent != null && parent.edge;
    }

    private void attachLabelGuards(DiagramDocument document, Map<String, ScopeBuilder> scopes) {
        if (scopes.isEmpty()) return;
        for (DiagramNode n : document.nodes) {
            if (!n.vertex || scopes.containsKey(n.id) || isEdgeLabel(document, n)) continue;
            Optional<String> guard = GuardText.first(n.label).map(GuardText::toEventB);
            if (guard.isEmpty()) continue;

            ScopeBuilder parent = n.parentId == null ? null : scopes.get(n.parentId);
            if (parent != null) {
                // direct children belong to their frame, never to a neighbour
                parent.trySetGuard(guard.get());
                continue;
            }

            Box at = geometry.absolute(n);
            for (ScopeBuilder scope : scopes.values()) {
                if (scope.containsLabelAt(at.x, at.y, guardLabelTolerance) && scope.trySetGuard(guard.get())) {
                    break;
                }
            }
        }
    }

    static Optional<IrScopeKind> keywordKind(String label) {
        if (label == null || label.isEmpty()) return Optional.empty();
        Matcher m = KEYWORD.matcher(label.trim());
        if (!m.find()) return Optional.empty();
        return Optional.ofNullable(IrScopeKind.fromKeyword(m.group(1)));
    }

    static boolean isFrameStyle(DiagramNode n) {
        return n.styleContains("umlFrame") || n.styleContains("sysml.package");
    }
}
