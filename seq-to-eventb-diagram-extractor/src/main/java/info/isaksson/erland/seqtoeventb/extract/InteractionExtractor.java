package info.isaksson.erland.seqtoeventb.extract;

import info.isaksson.erland.seqtoeventb.io.DiagramLoader;
import info.isaksson.erland.seqtoeventb.ir.IrGuardVariable;
import info.isaksson.erland.seqtoeventb.ir.IrInteraction;
import info.isaksson.erland.seqtoeventb.ir.IrLifeline;
import info.isaksson.erland.seqtoeventb.ir.IrMessageFlow;
import info.isaksson.erland.seqtoeventb.ir.IrScope;
import info.isaksson.erland.seqtoeventb.model.DiagramDocument;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Recovers an {@link IrInteraction} from a diagram.
 *
 * <p>Every call builds its tables from scratch; instances hold no per-run state and can be
 * reused.</p>
 */
public final class InteractionExtractor {

    private final DiagramLoader loader = new DiagramLoader();

    public ExtractionResult extract(Path diagram, ExtractionOptions options) throws IOException {
        Objects.requireNonNull(diagram, "diagram");
        return extract(loader.load(diagram), options);
    }

    public ExtractionResult extract(DiagramDocument document, ExtractionOptions options) {
        Objects.requireNonNull(document, "document");
        if (options == null) options = ExtractionOptions.defaults();

        ExtractionWarnings warnings = new ExtractionWarnings();
        if (document.decodeProblem != null) {
            warnings.decodeFallback(document.decodeProblem);
        }

        GeometryResolver geometry = new GeometryResolver(document, options.rootCellIds);
        LifelineRegistry lifelines = LifelineRegistry.build(document, geometry);
        for (IrLifeline l : lifelines.lifelines()) {
            if (!Identifiers.isIdentifier(l.name)) warnings.nonIdentifierParticipant(l.name, l.nodeIds.get(0));
        }
        List<IrScope> scopes = new ScopeExtractor(geometry, options.guardLabelTolerance).extract(document);
        List<IrMessageFlow> flows = new MessageFlowExtractor(geometry, lifelines, options.lifelineDistanceThreshold)
                .extract(document, scopes, warnings);
        List<IrGuardVariable> guardVariables = new GuardVariableExtractor().extract(document, warnings);
        String baseName = new BaseNameResolver().resolve(document, options.modelName, warnings);

        if (flows.isEmpty()) {
            warnings.noFlows();
        }

        IrInteraction interaction = new IrInteraction(
                IrInteraction.CURRENT_SCHEMA_VERSION,
                baseName,
                lifelines.lifelines(),
                scopes,
                flows,
                guardVariables);
        return new ExtractionResult(interaction, warnings.toDeterministicList(), document);
    }
}
