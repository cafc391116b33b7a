package info.isaksson.erland.seqtoeventb.emitter;

import info.isaksson.erland.seqtoeventb.ir.IrGuardVariable;
import info.isaksson.erland.seqtoeventb.ir.IrInteraction;
import info.isaksson.erland.seqtoeventb.ir.IrMessageFlow;
import info.isaksson.erland.seqtoeventb.ir.IrScope;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the Event-B context and machine for an interaction.
 *
 * <p>Every flow becomes a {@code send}/{@code receive} event pair. The protocol variables make
 * the pair strictly alternate (a message is never re-sent and never received before it is
 * sent) and chain consecutive flows (flow {@code i} can only be sent once flow {@code i-1} has
 * been received). A scope guard adds one more guard to the send event.</p>
 */
public final class FormalModelSynthesizer {

    public static final String OBJECTS = "Objects";
    public static final String MESSAGES = "Messages";
    public static final String DATA_MESSAGES = "DataMessages";

    static final String SENT = "sentMessages";
    static final String SENDER = "sender";
    static final String RECEIVER = "receiver";
    static final String RECEIVED = "receivedMessages";
    static final String SENDER_DATA = "senderdataMessages";
    static final String CURRENT = "currentMessage";
    static final String RECEIVER_DATA = "receiverdataMessages";

    public FormalModel synthesize(IrInteraction interaction, int version) {
        if (interaction == null) throw new IllegalArgumentException("interaction must not be null");
        if (version < 1) throw new IllegalArgumentException("version must be positive: " + version);

        String base = interaction.baseName;
        String contextName = base + "Context";
        String machineName = base + "InteractionMachine_" + version;

        Set<String> participants = new TreeSet<>();
        List<String> messages = new ArrayList<>();
        for (IrMessageFlow f : interaction.flows) {
            participants.add(f.sender);
            participants.add(f.receiver);
            messages.add(f.instanceId());
        }
        Map<String, String> dataConstants = dataConstants(interaction, participants, messages);
        Set<String> data = new LinkedHashSet<>(dataConstants.values());

        List<Clause> axioms = new ArrayList<>();
        addSetAxiom(axioms, OBJECTS, participants);
        addSetAxiom(axioms, MESSAGES, messages);
        addSetAxiom(axioms, DATA_MESSAGES, data);

        List<String> variables = new ArrayList<>(IrGuardVariable.RESERVED_NAMES);
        List<Clause> invariants = new ArrayList<>();
        invariants.add(new Clause("inv1", SENT + " <: " + MESSAGES));
        invariants.add(new Clause("inv2", CURRENT + " <: " + MESSAGES));
        invariants.add(new Clause("inv3", SENDER + " <: " + MESSAGES + " ** " + OBJECTS));
        invariants.add(new Clause("inv4", RECEIVER + " <: " + MESSAGES + " ** " + OBJECTS));
        invariants.add(new Clause("inv5", RECEIVED + " <: " + SENT));
        invariants.add(new Clause("inv6", SENDER_DATA + " <: " + MESSAGES + " ** " + DATA_MESSAGES));
        invariants.add(new Clause("inv7", RECEIVER_DATA + " <: " + MESSAGES + " ** " + DATA_MESSAGES));
        for (IrGuardVariable v : interaction.guardVariables) {
            variables.add(v.name);
            invariants.add(new Clause("inv" + (invariants.size() + 1), v.name + " : INT"));
        }

        List<EventDefinition> events = new ArrayList<>();
        events.add(initialisation(interaction.guardVariables));
        IrMessageFlow previous = null;
        for (IrMessageFlow f : interaction.flows) {
            Optional<IrScope> scope = interaction.findScope(f.scopeId);
            String suffix = scope.map(IrScope::suffix).orElse("");
            String guard = scope.map(s -> s.guard).orElse(null);
            String d = f.data == null ? null : dataConstants.get(f.data);
            events.add(send(f, d, previous, suffix, guard));
            events.add(receive(f, d, suffix));
            previous = f;
        }

        return new FormalModel(base, contextName, machineName, version,
                List.of(OBJECTS, MESSAGES, DATA_MESSAGES),
                new ArrayList<>(participants), messages, new ArrayList<>(data),
                axioms, variables, invariants, events);
    }

    /**
     * Constant name per data value, in first-use order. A value that is already a participant,
     * a message or a variable gets a {@code _data} suffix, since one constant cannot belong to two
     * carrier sets.
     */
    static Map<String, String> dataConstants(IrInteraction interaction, Set<String> participants, List<String> messages) {
        Set<String> taken = new HashSet<>(participants);
        taken.addAll(messages);
        taken.addAll(IrGuardVariable.RESERVED_NAMES);
        for (IrGuardVariable v : interaction.guardVariables) taken.add(v.name);
        taken.addAll(List.of(OBJECTS, MESSAGES, DATA_MESSAGES));

        Map<String, String> out = new LinkedHashMap<>();
        for (IrMessageFlow f : interaction.flows) {
            if (f.data == null || out.containsKey(f.data)) continue;
            String name = f.data;
            while (taken.contains(name)) name = name + "_data";
            taken.add(name);
            out.put(f.data, name);
        }
        return out;
    }

    private static void addSetAxiom(List<Clause> axioms, String set, Iterable<String> members) {
        List<String> list = new ArrayList<>();
        members.forEach(list::add);
        if (list.isEmpty()) return;
        axioms.add(new Clause("axm" + (axioms.size() + 1), set + " = { " + String.join(", ", list) + " }"));
    }

    private static EventDefinition initialisation(List<IrGuardVariable> guardVariables) {
        List<Clause> actions = new ArrayList<>();
        for (String v : IrGuardVariable.RESERVED_NAMES) {
            actions.add(act(actions, v + " := {}"));
        }
        for (IrGuardVariable v : guardVariables) {
            String op = v.isNonDeterministic() ? " :: " : " := ";
            actions.add(act(actions, v.name + op + v.initialValue));
        }
        return new EventDefinition("INITIALISATION", EventDefinition.Kind.INITIALISATION, 0, List.of(), actions);
    }

    private static EventDefinition send(IrMessageFlow f, String data, IrMessageFlow previous, String suffix, String scopeGuard) {
        String m = f.instanceId();

        List<Clause> guards = new ArrayList<>();
        guards.add(grd(guards, m + " /: " + SENT));
        guards.add(grd(guards, CURRENT + " = {}"));
        if (previous != null) guards.add(grd(guards, previous.instanceId() + " : " + RECEIVED));
        if (scopeGuard != null) guards.add(grd(guards, scopeGuard));

        List<Clause> actions = new ArrayList<>();
        actions.add(act(actions, SENT + " := " + SENT + " \\/ {" + m + "}"));
        actions.add(act(actions, SENDER + " := " + SENDER + " \\/ {" + m + " |-> " + f.sender + "}"));
        actions.add(act(actions, RECEIVER + " := " + RECEIVER + " \\/ {" + m + " |-> " + f.receiver + "}"));
        actions.add(act(actions, RECEIVED + " := {}"));
        if (data != null) {
            actions.add(act(actions, SENDER_DATA + " := " + SENDER_DATA + " \\/ {" + m + " |-> " + data + "}"));
        }
        actions.add(act(actions, CURRENT + " := {" + m + "}"));

        return new EventDefinition("send" + m + suffix, EventDefinition.Kind.SEND, f.ordinal, guards, actions);
    }

    private static EventDefinition receive(IrMessageFlow f, String data, String suffix) {
        String m = f.instanceId();

        List<Clause> guards = new ArrayList<>();
        guards.add(grd(guards, m + " : " + SENT));
        guards.add(grd(guards, m + " |-> " + f.sender + " : " + SENDER));
        guards.add(grd(guards, m + " |-> " + f.receiver + " : " + RECEIVER));
        guards.add(grd(guards, m + " /: " + RECEIVED));
        guards.add(grd(guards, CURRENT + " = {" + m + "}"));

        List<Clause> actions = new ArrayList<>();
        actions.add(act(actions, RECEIVED + " := " + RECEIVED + " \\/ {" + m + "}"));
        if (data != null) {
            actions.add(act(actions, RECEIVER_DATA + " := " + RECEIVER_DATA + " \\/ {" + m + " |-> " + data + "}"));
        }
        actions.add(act(actions, CURRENT + " := {}"));

        return new EventDefinition("receive" + m + suffix, EventDefinition.Kind.RECEIVE, f.ordinal, guards, actions);
    }

    private static Clause grd(List<Clause> existing, String formula) {
        return new Clause("grd" + (existing.size() + 1), formula);
    }

    private static Clause act(List<Clause> existing, String formula) {
        return new Clause("act" + (existing.size() + 1), formula);
    }
}
