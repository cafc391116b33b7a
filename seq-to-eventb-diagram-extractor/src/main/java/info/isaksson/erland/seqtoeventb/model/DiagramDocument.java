package info.isaksson.erland.seqtoeventb.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully materialized diagram: every cell in document order plus the naming metadata of the
 * outer file (which is kept even when the cells come from a decoded payload).
 */
public final class DiagramDocument {
    /** File name of the source document (without directories), may be {@code null}. */
    public final String fileName;
    /** {@code name} attributes of all {@code <diagram>} elements, in document order. */
    public final List<String> diagramNames;
    /** {@code name} attribute of the root element, or {@code null}. */
    public final String rootName;
    public final List<DiagramNode> nodes;
    /** True when the cells were read from a decoded compressed payload. */
    public final boolean decodedPayload;
    /** Why a present payload could not be decoded; {@code null} when nothing went wrong. */
    public final String decodeProblem;

    private final Map<String, DiagramNode> byId;

    public DiagramDocument(String fileName,
                           List<String> diagramNames,
                           String rootName,
                           List<DiagramNode> nodes,
                           boolean decodedPayload,
                           String decodeProblem) {
        this.fileName = fileName;
        this.diagramNames = diagramNames == null ? List.of() : List.copyOf(diagramNames);
        this.rootName = rootName == null || rootName.isBlank() ? null : rootName;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.decodedPayload = decodedPayload;
        this.decodeProblem = decodeProblem;

        Map<String, DiagramNode> idx = new LinkedHashMap<>();
        for (DiagramNode n : this.nodes) {
            // first definition wins on duplicate ids
            idx.putIfAbsent(n.id, n);
        }
        this.byId = Collections.unmodifiableMap(idx);
    }

    public DiagramNode node(String id) {
        return id == null ? null : byId.get(id);
    }

    public int size() {
        return nodes.size();
    }
}
