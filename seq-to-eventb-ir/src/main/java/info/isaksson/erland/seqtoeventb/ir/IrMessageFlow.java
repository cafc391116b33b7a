package info.isaksson.erland.seqtoeventb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One message arrow, ordered by its vertical position.
 */
@JsonPropertyOrder({"ordinal","callName","data","sender","receiver","y","scopeId","edgeId"})
public final class IrMessageFlow {

    /** Placeholder for a receiver that could not be matched to any lifeline. */
    public static final String UNKNOWN_PARTICIPANT = "Unknown";

    public final int ordinal;
    public final String callName;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String data;

    public final String sender;
    public final String receiver;
    public final double y;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String scopeId;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String edgeId;

    @JsonCreator
    public IrMessageFlow(
            @JsonProperty("ordinal") int ordinal,
            @JsonProperty("callName") String callName,
            @JsonProperty("data") String data,
            @JsonProperty("sender") String sender,
            @JsonProperty("receiver") String receiver,
            @JsonProperty("y") double y,
            @JsonProperty("scopeId") String scopeId,
            @JsonProperty("edgeId") String edgeId
    ) {
        this.ordinal = ordinal;
        this.callName = Objects.requireNonNull(callName, "callName must not be null");
        this.data = data == null || data.isBlank() ? null : data;
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.receiver = receiver == null || receiver.isBlank() ? UNKNOWN_PARTICIPANT : receiver;
        this.y = y;
        this.scopeId = scopeId;
        this.edgeId = edgeId;
    }

    /** Message instance identifier, e.g. {@code login_1}. */
    public String instanceId() {
        return callName + "_" + ordinal;
    }

    public IrMessageFlow withOrdinal(int newOrdinal) {
        return new IrMessageFlow(newOrdinal, callName, data, sender, receiver, y, scopeId, edgeId);
    }

    public IrMessageFlow withScope(String newScopeId) {
        return new IrMessageFlow(ordinal, callName, data, sender, receiver, y, newScopeId, edgeId);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrMessageFlow)) return false;
        IrMessageFlow that = (IrMessageFlow) o;
        return ordinal == that.ordinal &&
                Double.compare(y, that.y) == 0 &&
                callName.equals(that.callName) &&
                Objects.equals(data, that.data) &&
                sender.equals(that.sender) &&
                receiver.equals(that.receiver) &&
                Objects.equals(scopeId, that.scopeId) &&
                Objects.equals(edgeId, that.edgeId);
    }

    @Override public int hashCode() {
        return Objects.hash(ordinal, callName, data, sender, receiver, y, scopeId, edgeId);
    }

    @Override public String toString() {
        return instanceId() + ": " + sender + " -> " + receiver + (data == null ? "" : " (" + data + ")");
    }
}
