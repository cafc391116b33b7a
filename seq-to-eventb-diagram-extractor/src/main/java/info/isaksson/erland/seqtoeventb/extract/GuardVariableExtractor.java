package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.ir.IrGuardMode;
import info.isaksson.erland.seqtoeventb.ir.IrGuardVariable;
import info.isaksson.erland.seqtoeventb.model.DiagramDocument;
import info.isaksson.erland.seqtoeventb.model.DiagramNode;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans every label for bracketed predicates and derives the machine's guard variables.
 *
 * <p>Forms, tried in order:</p>
 * <ul>
 *   <li>{@code [x = 1]}, {@code [x == 1]}, {@code [x := 1]}: deterministic, starts at the literal;</li>
 *   <li>{@code [x : 0..5]}, {@code [x in 0..5]}, {@code [x ∈ 0..5]}: non-deterministic over the range;</li>
 *   <li>{@code [x < 5]} and other comparisons: default, starts at {@code 0}.</li>
 * </ul>
 */
public final class GuardVariableExtractor {

    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?:==|:=|=)\\s*(-?\\d+)$");
    private static final Pattern RANGE = Pattern.compile(
            "^([A-Za-z_]\\w*)(?:\\s*(?::∈|∈|:)\\s*|\\s+in\\s+)(-?\\d+)\\s*\\.\\.\\s*(-?\\d+)$");
    private static final Pattern COMPARISON = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?:<=|>=|!=|/=|<|>)\\s*\\S.*$");

    public List<IrGuardVariable> extract(DiagramDocument document, ExtractionWarnings warnings) {
        GuardVariableTable table = new GuardVariableTable();
        for (DiagramNode n : document.nodes) {
            for (String predicate : GuardText.all(n.label)) {
                classify(predicate, table, warnings, n.id);
            }
        }
        return table.toList();
    }

    static void classify(String predicate, GuardVariableTable table, ExtractionWarnings warnings, String nodeId) {
        String text = predicate.trim();

        Matcher m = ASSIGNMENT.matcher(text);
        if (m.matches()) {
            register(table, warnings, nodeId, m.group(1), IrGuardMode.DETERMINISTIC, m.group(2));
            return;
        }
        m = RANGE.matcher(text);
        if (m.matches()) {
            register(table, warnings, nodeId, m.group(1), IrGuardMode.NON_DETERMINISTIC, m.group(2) + ".." + m.group(3));
            return;
        }
        m = COMPARISON.matcher(text);
        if (m.matches()) {
            register(table, warnings, nodeId, m.group(1), IrGuardMode.DEFAULT, "0");
        }
        // anything else is a free-form predicate without a variable of its own
    }

    private static void register(GuardVariableTable table, ExtractionWarnings warnings, String nodeId,
                                 String name, IrGuardMode mode, String initialValue) {
        if (IrGuardVariable.RESERVED_NAMES.contains(name)) {
            warnings.reservedGuardName(name, nodeId);
            return;
        }
        table.tryRegister(name, mode, initialValue);
    }
}
