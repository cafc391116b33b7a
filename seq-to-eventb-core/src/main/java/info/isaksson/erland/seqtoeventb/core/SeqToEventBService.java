package info.isaksson.erland.seqtoeventb.core;

import info.isaksson.erland.seqtoeventb.emitter.FormalModel;
import info.isaksson.erland.seqtoeventb.emitter.FormalModelSynthesizer;
import info.isaksson.erland.seqtoeventb.eventb.EventBTextWriter;
import info.isaksson.erland.seqtoeventb.extract.BaseNameResolver;
import info.isaksson.erland.seqtoeventb.extract.ExtractionResult;
import info.isaksson.erland.seqtoeventb.extract.ExtractionWarning;
import info.isaksson.erland.seqtoeventb.extract.InteractionExtractor;
import info.isaksson.erland.seqtoeventb.ir.IrInteraction;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Core (server-friendly) API for compiling sequence diagrams to Event-B.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline. Each
 * call is one synchronous compilation; nothing is shared between calls.</p>
 */
public final class SeqToEventBService {

    /**
     * Compile a draw.io diagram.
     *
     * @throws info.isaksson.erland.seqtoeventb.io.DecodeException if the file is not well-formed markup
     * @throws IOException if the file cannot be read
     */
    public SeqToEventBResult compileDiagram(Path diagram, SeqToEventBOptions options) throws IOException {
        if (diagram == null) throw new IllegalArgumentException("diagram must not be null");
        if (options == null) options = new SeqToEventBOptions();
        checkVersion(options);

        ExtractionResult extracted = new InteractionExtractor().extract(diagram, options.toExtractionOptions());
        return synthesize(extracted.interaction, options, extracted.warnings);
    }

    /** Compile a previously extracted interaction (IR mode). */
    public SeqToEventBResult compileInteraction(IrInteraction interaction, SeqToEventBOptions options) {
        if (interaction == null) throw new IllegalArgumentException("interaction must not be null");
        if (options == null) options = new SeqToEventBOptions();
        checkVersion(options);

        String override = BaseNameResolver.toPascalCase(options.modelName);
        if (!override.isEmpty()) {
            interaction = new IrInteraction(interaction.schemaVersion, override, interaction.lifelines,
                    interaction.scopes, interaction.flows, interaction.guardVariables);
        }
        return synthesize(interaction, options, List.of());
    }

    private static SeqToEventBResult synthesize(IrInteraction interaction, SeqToEventBOptions options,
                                                List<ExtractionWarning> warnings) {
        FormalModel model = new FormalModelSynthesizer().synthesize(interaction, options.machineVersion);
        return new SeqToEventBResult(EventBTextWriter.write(model), model, interaction, warnings);
    }

    private static void checkVersion(SeqToEventBOptions options) {
        if (options.machineVersion < 1) {
            throw new IllegalArgumentException("machineVersion must be positive: " + options.machineVersion);
        }
    }
}
