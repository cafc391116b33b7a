package info.isaksson.erland.seqtoeventb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Optional;

/**
 * Root of the interaction IR: everything recovered from one diagram.
 *
 * <p>{@link #flows} are kept in ordinal order; this is the order events are emitted in.</p>
 */
@JsonPropertyOrder({"schemaVersion","baseName","lifelines","scopes","flows","guardVariables"})
public final class IrInteraction {

    public static final String CURRENT_SCHEMA_VERSION = "1";

    public final String schemaVersion;
    public final String baseName;
    public final List<IrLifeline> lifelines;
    public final List<IrScope> scopes;
    public final List<IrMessageFlow> flows;
    public final List<IrGuardVariable> guardVariables;

    @JsonCreator
    public IrInteraction(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("baseName") String baseName,
            @JsonProperty("lifelines") List<IrLifeline> lifelines,
            @JsonProperty("scopes") List<IrScope> scopes,
            @JsonProperty("flows") List<IrMessageFlow> flows,
            @JsonProperty("guardVariables") List<IrGuardVariable> guardVariables
    ) {
        this.schemaVersion = schemaVersion == null || schemaVersion.isBlank() ? CURRENT_SCHEMA_VERSION : schemaVersion;
        this.baseName = baseName == null || baseName.isBlank() ? "System" : baseName;
        this.lifelines = lifelines == null ? List.of() : List.copyOf(lifelines);
        this.scopes = scopes == null ? List.of() : List.copyOf(scopes);
        this.flows = flows == null ? List.of() : List.copyOf(flows);
        this.guardVariables = guardVariables == null ? List.of() : List.copyOf(guardVariables);
    }

    public Optional<IrScope> findScope(String scopeId) {
        if (scopeId == null) return Optional.empty();
        for (IrScope s : scopes) {
            if (s.id.equals(scopeId)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
