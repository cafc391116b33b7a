package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.ir.IrInteraction;
import info.isaksson.erland.seqtoeventb.model.DiagramDocument;

import java.util.List;

/** Output of one extraction run. */
public final class ExtractionResult {
    public final IrInteraction interaction;
    public final List<ExtractionWarning> warnings;
    /** The document the interaction was recovered from. */
    public final DiagramDocument document;

    public ExtractionResult(IrInteraction interaction, List<ExtractionWarning> warnings, DiagramDocument document) {
        this.interaction = interaction;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.document = document;
    }
}
