package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.ir.IrMessageFlow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Warning log of one extraction run. Each recoverable situation has its own method so that
 * codes, messages and detail keys stay consistent between the passes that report them.
 */
public final class ExtractionWarnings {

    private final List<ExtractionWarning> warnings = new ArrayList<>();

    void decodeFallback(String cause) {
        add(ExtractionWarning.DECODE_FALLBACK,
                "Embedded diagram could not be decoded, using the outer document",
                details("cause", cause));
    }

    void missingName(String usedName, boolean fromFileName) {
        add(ExtractionWarning.MISSING_NAME,
                fromFileName ? "No diagram name found, using file name" : "No diagram name found, using default",
                details("name", usedName));
    }

    void unresolvedSender(String edgeId, String label) {
        add(ExtractionWarning.UNRESOLVED_SENDER,
                "Message '" + label + "' dropped: sender matches no lifeline",
                details("edgeId", edgeId, "label", label));
    }

    void unresolvedReceiver(String edgeId, String label) {
        add(ExtractionWarning.UNRESOLVED_RECEIVER,
                "Message '" + label + "' kept with receiver " + IrMessageFlow.UNKNOWN_PARTICIPANT,
                details("edgeId", edgeId, "label", label));
    }

    void reservedGuardName(String name, String nodeId) {
        add(ExtractionWarning.RESERVED_GUARD_NAME,
                "Guard variable '" + name + "' clashes with a protocol variable and was skipped",
                details("name", name, "nodeId", nodeId));
    }

    void nonIdentifierParticipant(String name, String nodeId) {
        add(ExtractionWarning.NON_IDENTIFIER_PARTICIPANT,
                "Participant '" + name + "' is not a valid Event-B identifier; rename the lifeline",
                details("name", name, "nodeId", nodeId));
    }

    void noFlows() {
        add(ExtractionWarning.NO_FLOWS, "No message flows recovered; the machine has no send/receive events", null);
    }

    public boolean contains(String code) {
        for (ExtractionWarning w : warnings) {
            if (w.code.equals(code)) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    /** Sorted copy; identical input always yields an identical list. */
    public List<ExtractionWarning> toDeterministicList() {
        List<ExtractionWarning> out = new ArrayList<>(warnings);
        Collections.sort(out);
        return Collections.unmodifiableList(out);
    }

    private void add(String code, String message, Map<String, String> details) {
        warnings.add(new ExtractionWarning(code, message, details));
    }

    private static Map<String, String> details(String... keyValues) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) m.put(keyValues[i], keyValues[i + 1]);
        }
        return m;
    }
}
