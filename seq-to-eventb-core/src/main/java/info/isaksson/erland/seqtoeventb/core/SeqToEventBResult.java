package info.isaksson.erland.seqtoeventb.core;

import info.isaksson.erland.seqtoeventb.emitter.FormalModel;
import info.isaksson.erland.seqtoeventb.extract.ExtractionWarning;
import info.isaksson.erland.seqtoeventb.ir.IrInteraction;

import java.util.List;

/** Compilation result container for programmatic usage. */
public final class SeqToEventBResult {
    /** The Event-B context and machine as text. */
    public final String eventBText;

    public final FormalModel formalModel;

    /** The interaction the model was synthesized from. */
    public final IrInteraction interaction;

    /** Deterministically ordered; empty in IR mode. */
    public final List<ExtractionWarning> warnings;

    SeqToEventBResult(String eventBText, FormalModel formalModel, IrInteraction interaction, List<ExtractionWarning> warnings) {
        this.eventBText = eventBText;
        this.formalModel = formalModel;
        this.interaction = interaction;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
