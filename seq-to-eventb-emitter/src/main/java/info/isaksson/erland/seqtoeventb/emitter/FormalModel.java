package info.isaksson.erland.seqtoeventb.emitter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An Event-B context plus the machine that sees it, as structured data.
 *
 * <p>Formulas use Event-B ASCII notation. List order is output order.</p>
 */
public final class FormalModel {
    public final String baseName;
    public final String contextName;
    public final String machineName;
    public final int version;

    public final List<String> sets;
    /** Participant names, sorted. */
    public final List<String> participants;
    /** Message instance identifiers in flow order. */
    public final List<String> messages;
    /** Distinct data parameters in order of first use. */
    public final List<String> dataMessages;
    public final List<Clause> axioms;

    public final List<String> variables;
    public final List<Clause> invariants;
    /** {@code INITIALISATION} first, then a send/receive pair per flow. */
    public final List<EventDefinition> events;

    public FormalModel(String baseName,
                       String contextName,
                       String machineName,
                       int version,
                       List<String> sets,
                       List<String> participants,
                       List<String> messages,
                       List<String> dataMessages,
                       List<Clause> axioms,
                       List<String> variables,
                       List<Clause> invariants,
                       List<EventDefinition> events) {
        this.baseName = baseName;
        this.contextName = contextName;
        this.machineName = machineName;
        this.version = version;
        this.sets = List.copyOf(sets);
        this.participants = List.copyOf(participants);
        this.messages = List.copyOf(messages);
        this.dataMessages = List.copyOf(dataMessages);
        this.axioms = List.copyOf(axioms);
        this.variables = List.copyOf(variables);
        this.invariants = List.copyOf(invariants);
        this.events = List.copyOf(events);
    }

    /** All constants: participants, then messages, then data. */
    public List<String> constants() {
        List<String> out = new ArrayList<>(participants.size() + messages.size() + dataMessages.size());
        out.addAll(participants);
        out.addAll(messages);
        out.addAll(dataMessages);
        return Collections.unmodifiableList(out);
    }

    public EventDefinition initialisation() {
        return events.get(0);
    }

    /** Send and receive events, in emission order. */
    public List<EventDefinition> flowEvents() {
        return events.subList(1, events.size());
    }
}
