package info.isaksson.erland.seqtoeventb.core;

import info.isaksson.erland.seqtoeventb.extract.ExtractionOptions;

import java.util.Set;

/**
 * Core (server-friendly) options for diagram to Event-B compilation.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class SeqToEventBOptions {
    /** Suffix of the machine name, {@code <Base>InteractionMachine_<n>}. Must be positive. */
    public int machineVersion = 1;

    /** Overrides the base name taken from the diagram; {@code null} to derive it. */
    public String modelName;

    public double lifelineDistanceThreshold = 150;
    public double guardLabelTolerance = 40;
    public Set<String> rootCellIds = Set.of("0", "1");

    ExtractionOptions toExtractionOptions() {
        ExtractionOptions o = new ExtractionOptions();
        o.lifelineDistanceThreshold = lifelineDistanceThreshold;
        o.guardLabelTolerance = guardLabelTolerance;
        o.rootCellIds = rootCellIds;
        o.modelName = modelName;
        return o;
    }
}
