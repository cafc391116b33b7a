package info.isaksson.erland.seqtoeventb.rodin;

import info.isaksson.erland.seqtoeventb.emitter.Clause;
import info.isaksson.erland.seqtoeventb.emitter.EventDefinition;
import info.isaksson.erland.seqtoeventb.emitter.FormalModel;
import info.isaksson.erland.seqtoeventb.eventb.EventBTextWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packages a {@link FormalModel} as a zip that can be imported into a Rodin workspace.
 *
 * <p>The context ({@code .buc}) and machine ({@code .bum}) carry the full model; the checker and
 * proof files ({@code .bcc}, {@code .bps}, {@code .bpo}) are empty shells Rodin regenerates.
 * Entries are written in a fixed order with a fixed timestamp, so the same model always yields
 * the same bytes.</p>
 */
public final class RodinBundleWriter {

    private static final String CORE = "org.eventb.core.";
    private static final long FIXED_TIME = 315532800000L; // 1980-01-01, the zip epoch

    private RodinBundleWriter() {}

    /** Entry name to content, in bundle order. */
    public static Map<String, String> entries(FormalModel model) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        Map<String, String> out = new LinkedHashMap<>();
        out.put(model.contextName + ".buc", contextFile(model));
        out.put(model.contextName + ".bcc", RodinXml.PROLOG + RodinXml.element(CORE + "scContextFile", true));
        out.put(model.machineName + ".bum", machineFile(model));
        out.put(model.machineName + ".bpo", RodinXml.PROLOG + RodinXml.element(CORE + "poFile", true, "version", "1"));
        out.put(model.machineName + ".bps", RodinXml.PROLOG + RodinXml.element(CORE + "scMachineFile", true, "version", "5"));
        out.put(model.baseName + ".bpr", RodinXml.PROLOG + RodinXml.element("org.rodinp.core.roDB", true, "version", "1"));
        out.put(model.baseName + "_readable.txt", EventBTextWriter.write(model));
        return out;
    }

    public static void write(FormalModel model, Path zipFile) throws IOException {
        if (zipFile == null) throw new IllegalArgumentException("zipFile must not be null");
        Path parent = zipFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (OutputStream out = Files.newOutputStream(zipFile)) {
            write(model, out);
        }
    }

    public static void write(FormalModel model, OutputStream out) throws IOException {
        Map<String, String> entries = entries(model);
        ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8);
        for (Map.Entry<String, String> e : entries.entrySet()) {
            ZipEntry entry = new ZipEntry(e.getKey());
            entry.setTime(FIXED_TIME);
            zip.putNextEntry(entry);
            zip.write(e.getValue().getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        // finish, not close: the caller owns the stream
        zip.finish();
    }

    static String contextFile(FormalModel model) {
        StringBuilder sb = new StringBuilder(RodinXml.PROLOG);
        sb.append(RodinXml.element(CORE + "contextFile", false,
                CORE + "configuration", "org.eventb.core.fwd", "version", "3"));
        int i = 1;
        for (String set : model.sets) {
            sb.append(RodinXml.element(CORE + "carrierSet", true, "name", "set" + i++, CORE + "identifier", set));
        }
        i = 1;
        for (String c : model.constants()) {
            sb.append(RodinXml.element(CORE + "constant", true, "name", "cst" + i++, CORE + "identifier", c));
        }
        for (Clause a : model.axioms) {
            sb.append(RodinXml.element(CORE + "axiom", true,
                    "name", a.label, CORE + "label", a.label, CORE + "predicate", a.formula));
        }
        sb.append("</").append(CORE).append("contextFile>\n");
        return sb.toString();
    }

    static String machineFile(FormalModel model) {
        StringBuilder sb = new StringBuilder(RodinXml.PROLOG);
        sb.append(RodinXml.element(CORE + "machineFile", false,
                CORE + "configuration", "org.eventb.core.fwd", "version", "5"));
        sb.append(RodinXml.element(CORE + "seesContext", true, "name", "sees1", CORE + "target", model.contextName));
        int i = 1;
        for (String v : model.variables) {
            sb.append(RodinXml.element(CORE + "variable", true, "name", "var" + i++, CORE + "identifier", v));
        }
        for (Clause inv : model.invariants) {
            sb.append(RodinXml.element(CORE + "invariant", true,
                    "name", inv.label, CORE + "label", inv.label, CORE + "predicate", inv.formula));
        }
        i = 1;
        for (EventDefinition e : model.events) {
            sb.append(RodinXml.element(CORE + "event", false,
                    "name", "evt" + i++,
                    CORE + "convergence", "0",
                    CORE + "extended", "false",
                    CORE + "label", e.name));
            clauses(sb, "guard", CORE + "predicate", e.guards);
            clauses(sb, "action", CORE + "assignment", e.actions);
            sb.append("</").append(CORE).append("event>\n");
        }
        sb.append("</").append(CORE).append("machineFile>\n");
        return sb.toString();
    }

    private static void clauses(StringBuilder sb, String element, String formulaAttr, List<Clause> clauses) {
        for (Clause c : clauses) {
            sb.append(RodinXml.element(CORE + element, true,
                    "name", c.label, CORE + "label", c.label, formulaAttr, c.formula));
        }
    }
}
