package info.isaksson.erland.seqtoeventb.emitter;

import info.isaksson.erland.seqtoeventb.ir.IrGuardMode;
import info.isaksson.erland.seqtoeventb.ir.IrGuardVariable;
import info.isaksson.erland.seqtoeventb.ir.IrInteraction;
import info.isaksson.erland.seqtoeventb.ir.IrLifeline;
import info.isaksson.erland.seqtoeventb.ir.IrMessageFlow;
import info.isaksson.erland.seqtoeventb.ir.IrScope;
import info.isaksson.erland.seqtoeventb.ir.IrScopeKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FormalModelSynthesizerTest {

    private final FormalModelSynthesizer synthesizer = new FormalModelSynthesizer();

    static IrInteraction loginScenario() {
        return new IrInteraction("1", "Login",
                List.of(new IrLifeline("A", 100, List.of("a")),
                        new IrLifeline("B", 300, List.of("b")),
                        new IrLifeline("C", 500, List.of("c"))),
                List.of(new IrScope("opt", IrScopeKind.OPTIONAL, 1, 40, 60, 300, 60, "valid=1")),
                List.of(new IrMessageFlow(1, "login", "user", "A", "B", 40, null, "m1"),
                        new IrMessageFlow(2, "ack", null, "B", "A", 80, "opt", "m2")),
                List.of(new IrGuardVariable("valid", IrGuardMode.DETERMINISTIC, "1")));
    }

    @Test
    void loginScenarioProducesFourGuardedEvents() {
        FormalModel model = synthesizer.synthesize(loginScenario(), 1);

        assertEquals("LoginContext", model.contextName);
        assertEquals("LoginInteractionMachine_1", model.machineName);
        // C never sends or receives
        assertEquals(List.of("A", "B"), model.participants);
        assertEquals(List.of("login_1", "ack_2"), model.messages);
        assertEquals(List.of("user"), model.dataMessages);
        assertEquals(List.of(
                new Clause("axm1", "Objects = { A, B }"),
                new Clause("axm2", "Messages = { login_1, ack_2 }"),
                new Clause("axm3", "DataMessages = { user }")), model.axioms);

        List<EventDefinition> events = model.flowEvents();
        assertEquals(4, events.size());
        assertEquals(List.of("sendlogin_1", "receivelogin_1", "sendack_2_opt1", "receiveack_2_opt1"), names(events));

        EventDefinition sendAck = events.get(2);
        assertEquals(List.of(
                new Clause("grd1", "ack_2 /: sentMessages"),
                new Clause("grd2", "currentMessage = {}"),
                new Clause("grd3", "login_1 : receivedMessages"),
                new Clause("grd4", "valid=1")), sendAck.guards);

        EventDefinition sendLogin = events.get(0);
        assertEquals(2, sendLogin.guards.size());
        assertTrue(sendLogin.actions.contains(new Clause("act5", "senderdataMessages := senderdataMessages \\/ {login_1 |-> user}")));
        assertEquals(new Clause("act6", "currentMessage := {login_1}"), sendLogin.actions.get(5));

        EventDefinition receiveAck = events.get(3);
        assertEquals(List.of(
                new Clause("act1", "receivedMessages := receivedMessages \\/ {ack_2}"),
                new Clause("act2", "currentMessage := {}")), receiveAck.actions);
        assertTrue(receiveAck.hasGuard("ack_2 |-> B : sender"));
        assertTrue(receiveAck.hasGuard("currentMessage = {ack_2}"));
    }

    @Test
    void guardVariablesGetInvariantsAndInitialValues() {
        IrInteraction ir = new IrInteraction("1", "Atm", List.of(), List.of(), List.of(),
                List.of(new IrGuardVariable("amount", IrGuardMode.NON_DETERMINISTIC, "0..2000"),
                        new IrGuardVariable("retry", IrGuardMode.DEFAULT, "0")));

        FormalModel model = synthesizer.synthesize(ir, 3);

        assertEquals("AtmInteractionMachine_3", model.machineName);
        assertEquals(9, model.variables.size());
        assertEquals(List.of("amount", "retry"), model.variables.subList(7, 9));
        assertEquals(new Clause("inv8", "amount : INT"), model.invariants.get(7));
        assertEquals(new Clause("inv9", "retry : INT"), model.invariants.get(8));

        List<Clause> init = model.initialisation().actions;
        assertEquals(9, init.size());
        assertEquals(new Clause("act1", "sentMessages := {}"), init.get(0));
        assertEquals(new Clause("act8", "amount :: 0..2000"), init.get(7));
        assertEquals(new Clause("act9", "retry := 0"), init.get(8));

        assertTrue(model.axioms.isEmpty());
        assertTrue(model.flowEvents().isEmpty());
        assertEquals(List.of("Objects", "Messages", "DataMessages"), model.sets);
    }

    @Test
    void everyLaterSendWaitsForItsPredecessor() {
        List<IrMessageFlow> flows = new ArrayList<>();
        String[] parties = {"A", "B", "C"};
        for (int i = 1; i <= 6; i++) {
            flows.add(new IrMessageFlow(i, "m", null, parties[i % 3], parties[(i + 1) % 3], i * 10, null, null));
        }
        FormalModel model = synthesizer.synthesize(
                new IrInteraction("1", "Chain", List.of(), List.of(), flows, List.of()), 1);

        List<EventDefinition> events = model.flowEvents();
        assertEquals(2 * flows.size(), events.size());
        for (int i = 0; i < flows.size(); i++) {
            EventDefinition send = events.get(2 * i);
            assertEquals(EventDefinition.Kind.SEND, send.kind);
            assertEquals(EventDefinition.Kind.RECEIVE, events.get(2 * i + 1).kind);
            if (i > 0) {
                assertTrue(send.hasGuard(flows.get(i - 1).instanceId() + " : receivedMessages"), send.name);
            } else {
                assertFalse(send.hasGuard("m_0 : receivedMessages"));
            }
        }
    }

    @Test
    void unknownReceiverJoinsObjects() {
        IrInteraction ir = new IrInteraction("1", "X", List.of(), List.of(),
                List.of(new IrMessageFlow(1, "ping", null, "A", null, 10, null, null)), List.of());

        FormalModel model = synthesizer.synthesize(ir, 1);

        assertEquals(List.of("A", "Unknown"), model.participants);
    }

    @Test
    void dataNamedLikeAParticipantOrVariableGetsItsOwnConstant() {
        IrInteraction ir = new IrInteraction("1", "Bank", List.of(), List.of(),
                List.of(new IrMessageFlow(1, "login", "A", "A", "B", 10, null, null),
                        new IrMessageFlow(2, "pay", "amount", "A", "B", 20, null, null),
                        new IrMessageFlow(3, "ack", "A", "B", "A", 30, null, null)),
                List.of(new IrGuardVariable("amount", IrGuardMode.DEFAULT, "0")));

        FormalModel model = synthesizer.synthesize(ir, 1);

        assertEquals(List.of("A", "B"), model.participants);
        assertEquals(List.of("A_data", "amount_data"), model.dataMessages);
        assertEquals(new Clause("axm3", "DataMessages = { A_data, amount_data }"), model.axioms.get(2));

        List<EventDefinition> events = model.flowEvents();
        assertTrue(events.get(0).actions.contains(
                new Clause("act5", "senderdataMessages := senderdataMessages \\/ {login_1 |-> A_data}")));
        assertTrue(events.get(5).actions.contains(
                new Clause("act2", "receiverdataMessages := receiverdataMessages \\/ {ack_3 |-> A_data}")));
        assertTrue(model.constants().contains("A"));
        assertTrue(model.constants().contains("A_data"));
    }

    @Test
    void rejectsNonPositiveVersion() {
        assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(loginScenario(), 0));
        assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(null, 1));
    }

    private static List<String> names(List<EventDefinition> events) {
        List<String> out = new ArrayList<>();
        for (EventDefinition e : events) out.add(e.name);
        return out;
    }
}
