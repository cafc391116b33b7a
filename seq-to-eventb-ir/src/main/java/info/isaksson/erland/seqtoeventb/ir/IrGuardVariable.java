package info.isaksson.erland.seqtoeventb.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"name","mode","initialValue"})
public final class IrGuardVariable {

    /** Protocol state variables of the generated machine; guard variables may not reuse them. */
    public static final List<String> RESERVED_NAMES = List.of(
            "sentMessages", "sender", "receiver", "receivedMessages",
            "senderdataMessages", "currentMessage", "receiverdataMessages");

    public final String name;
    public final IrGuardMode mode;
    /** Literal value ({@code 1}) or literal range ({@code 0..100}). */
    public final String initialValue;

    @JsonCreator
    public IrGuardVariable(
            @JsonProperty("name") String name,
            @JsonProperty("mode") IrGuardMode mode,
            @JsonProperty("initialValue") String initialValue
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.mode = mode == null ? IrGuardMode.DEFAULT : mode;
        this.initialValue = initialValue == null || initialValue.isBlank() ? "0" : initialValue;
    }

    @JsonIgnore
    public boolean isNonDeterministic() {
        return mode == IrGuardMode.NON_DETERMINISTIC;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrGuardVariable)) return false;
        IrGuardVariable that = (IrGuardVariable) o;
        return name.equals(that.name) && mode == that.mode && initialValue.equals(that.initialValue);
    }

    @Override public int hashCode() {
        return Objects.hash(name, mode, initialValue);
    }

    @Override public String toString() {
        return name + (isNonDeterministic() ? " :: " : " := ") + initialValue;
    }
}
