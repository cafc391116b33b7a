package info.isaksson.erland.seqtoeventb.eventb;

import info.isaksson.erland.seqtoeventb.emitter.Clause;
import info.isaksson.erland.seqtoeventb.emitter.EventDefinition;
import info.isaksson.erland.seqtoeventb.emitter.FormalModel;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders a {@link FormalModel} as Event-B text: the context, a blank line, then the machine.
 *
 * <p>Empty sections are left out, except {@code SETS} and {@code VARIABLES}, which a model
 * always has. Output always ends with a newline.</p>
 */
public final class EventBTextWriter {

    private static final String INDENT = "    ";

    private EventBTextWriter() {}

    public static String write(FormalModel model) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        StringBuilder sb = new StringBuilder();
        writeContext(model, sb);
        sb.append('\n');
        writeMachine(model, sb);
        return sb.toString();
    }

    public static void write(FormalModel model, Path outFile) throws IOException {
        if (outFile == null) throw new IllegalArgumentException("outFile must not be null");
        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(outFile, write(model), StandardCharsets.UTF_8);
    }

    private static void writeContext(FormalModel model, StringBuilder sb) {
        sb.append("CONTEXT ").append(model.contextName).append('\n');
        section(sb, "SETS", model.sets, 1);
        section(sb, "CONSTANTS", model.constants(), 1);
        clauses(sb, "AXIOMS", model.axioms, 1);
        sb.append("END\n");
    }

    private static void writeMachine(FormalModel model, StringBuilder sb) {
        sb.append("MACHINE ").append(model.machineName).append('\n');
        sb.append("SEES").append('\n').append(INDENT).append(model.contextName).append('\n');
        section(sb, "VARIABLES", model.variables, 1);
        clauses(sb, "INVARIANTS", model.invariants, 1);
        sb.append("EVENTS\n");
        for (EventDefinition e : model.events) {
            writeEvent(e, sb);
        }
        sb.append("END\n");
    }

    private static void writeEvent(EventDefinition e, StringBuilder sb) {
        if (e.kind == EventDefinition.Kind.INITIALISATION) {
            sb.append(INDENT).append("INITIALISATION\n");
            clauses(sb, INDENT + "BEGIN", e.actions, 2);
        } else {
            sb.append(INDENT).append("EVENT ").append(e.name).append('\n');
            clauses(sb, INDENT + "WHEN", e.guards, 2);
            clauses(sb, INDENT + "THEN", e.actions, 2);
        }
        sb.append(INDENT).append("END\n");
    }

    private static void section(StringBuilder sb, String header, List<String> items, int depth) {
        if (items.isEmpty()) return;
        sb.append(header).append('\n');
        for (String item : items) {
            sb.append(INDENT.repeat(depth)).append(item).append('\n');
        }
    }

    private static void clauses(StringBuilder sb, String header, List<Clause> items, int depth) {
        if (items.isEmpty()) return;
        sb.append(header).append('\n');
        for (Clause c : items) {
            sb.append(INDENT.repeat(depth)).append(c.label).append(": ").append(c.formula).append('\n');
        }
    }
}
