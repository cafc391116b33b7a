package info.isaksson.erland.seqtoeventb.report;

import info.isaksson.erland.seqtoeventb.advisor.AdvisoryResult;
import info.isaksson.erland.seqtoeventb.core.SeqToEventBResult;
import info.isaksson.erland.seqtoeventb.extract.ExtractionWarning;
import info.isaksson.erland.seqtoeventb.ir.IrGuardVariable;
import info.isaksson.erland.seqtoeventb.ir.IrInteraction;
import info.isaksson.erland.seqtoeventb.ir.IrMessageFlow;
import info.isaksson.erland.seqtoeventb.ir.IrScope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Human-readable markdown report of one compilation.
 *
 * <p>Lists what was recovered from the diagram, so a user can see why an event has the guards it has
 * or why a message went missing.</p>
 */
public final class ReportWriter {

    private ReportWriter() {}

    public static void writeMarkdown(Path reportPath,
                                     Path inputPath,
                                     Path eventBPath,
                                     SeqToEventBResult result,
                                     AdvisoryResult advisory) throws IOException {
        Path parent = reportPath.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(reportPath, toMarkdown(inputPath, eventBPath, result, advisory));
    }

    public static String toMarkdown(Path inputPath, Path eventBPath, SeqToEventBResult result, AdvisoryResult advisory) {
        IrInteraction in = result.interaction;
        StringBuilder report = new StringBuilder();
        report.append("# seq-to-eventb report\n\n");

        report.append("## Summary\n\n");
        report.append("- Input: `").append(inputPath).append("`\n");
        report.append("- Event-B: `").append(eventBPath).append("`\n");
        report.append("- Context: `").append(result.formalModel.contextName).append("`\n");
        report.append("- Machine: `").append(result.formalModel.machineName).append("`\n");
        report.append("- Participants: **").append(result.formalModel.participants.size()).append("**\n");
        report.append("- Scopes: **").append(in.scopes.size()).append("**\n");
        report.append("- Message flows: **").append(in.flows.size()).append("**\n");
        report.append("- Guard variables: **").append(in.guardVariables.size()).append("**\n");
        report.append("- Warnings: **").append(result.warnings.size()).append("**\n\n");

        report.append("## Participants\n\n");
        if (result.formalModel.participants.isEmpty()) {
            report.append("_(none)_\n");
        }
        for (String p : result.formalModel.participants) {
            report.append("- `").append(p).append("`\n");
        }

        report.append("\n## Scopes\n\n");
        if (in.scopes.isEmpty()) {
            report.append("_(none)_\n");
        }
        for (IrScope s : in.scopes) {
            report.append("- `").append(s.id).append("` ")
                    .append(s.kind.name().toLowerCase()).append(" #").append(s.ordinal)
                    .append(" (suffix `").append(s.suffix()).append("`)");
            if (s.guard != null) {
                report.append(": `").append(s.guard).append("`");
            } else {
                report.append(": _no guard_");
            }
            report.append("\n");
        }

        report.append("\n## Message flows\n\n");
        if (in.flows.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| # | Message | Sender | Receiver | Data | Scope |\n");
            report.append("|---|---------|--------|----------|------|-------|\n");
            for (IrMessageFlow f : in.flows) {
                report.append("| ").append(f.ordinal)
                        .append(" | `").append(f.instanceId()).append("`")
                        .append(" | ").append(f.sender)
                        .append(" | ").append(f.receiver)
                        .append(" | ").append(f.data == null ? "" : f.data)
                        .append(" | ").append(f.scopeId == null ? "" : f.scopeId)
                        .append(" |\n");
            }
        }

        report.append("\n## Guard variables\n\n");
        if (in.guardVariables.isEmpty()) {
            report.append("_(none)_\n");
        }
        for (IrGuardVariable v : in.guardVariables) {
            report.append("- `").append(v.name).append("` ")
                    .append(v.mode.name().toLowerCase())
                    .append(" `").append(v.initialValue).append("`\n");
        }

        report.append("\n## Warnings\n\n");
        if (result.warnings.isEmpty()) {
            report.append("_(none)_\n");
        }
        for (ExtractionWarning w : result.warnings) {
            report.append("- **").append(w.code).append("** ").append(w.message);
            for (Map.Entry<String, String> e : w.context.entrySet()) {
                report.append(" `").append(e.getKey()).append('=').append(e.getValue()).append('`');
            }
            report.append("\n");
        }

        if (advisory != null) {
            report.append("\n## Suggested properties\n\n");
            report.append(advisory.display()).append("\n");
        }
        return report.toString();
    }
}
