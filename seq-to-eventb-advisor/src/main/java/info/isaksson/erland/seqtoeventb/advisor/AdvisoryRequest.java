package info.isaksson.erland.seqtoeventb.advisor;

import info.isaksson.erland.seqtoeventb.ir.IrInteraction;
import info.isaksson.erland.seqtoeventb.ir.IrMessageFlow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/** What an advisor gets to see: names only, never the diagram itself. */
public final class AdvisoryRequest {
    public final String baseName;
    public final List<String> participants;
    /** Message instance identifiers in flow order. */
    public final List<String> messages;

    public AdvisoryRequest(String baseName, List<String> participants, List<String> messages) {
        this.baseName = Objects.requireNonNull(baseName, "baseName must not be null");
        this.participants = participants == null ? List.of() : List.copyOf(participants);
        this.messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static AdvisoryRequest from(IrInteraction interaction) {
        TreeSet<String> participants = new TreeSet<>();
        List<String> messages = new ArrayList<>();
        for (IrMessageFlow f : interaction.flows) {
            participants.add(f.sender);
            participants.add(f.receiver);
            messages.add(f.instanceId());
        }
        return new AdvisoryRequest(interaction.baseName, new ArrayList<>(participants), messages);
    }
}
