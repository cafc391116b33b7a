package info.isaksson.erland.seqtoeventb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A participant track. The resolved name is the identity; {@link #nodeIds} lists every diagram
 * cell that was merged into it.
 */
@JsonPropertyOrder({"name","centerX","nodeIds"})
public final class IrLifeline {
    public final String name;
    public final double centerX;
    public final List<String> nodeIds;

    @JsonCreator
    public IrLifeline(
            @JsonProperty("name") String name,
            @JsonProperty("centerX") double centerX,
            @JsonProperty("nodeIds") List<String> nodeIds
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.centerX = centerX;
        this.nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrLifeline)) return false;
        IrLifeline that = (IrLifeline) o;
        return Double.compare(centerX, that.centerX) == 0 &&
                name.equals(that.name) &&
                nodeIds.equals(that.nodeIds);
    }

    @Override public int hashCode() {
        return Objects.hash(name, centerX, nodeIds);
    }

    @Override public String toString() {
        return name + "@" + centerX;
    }
}
