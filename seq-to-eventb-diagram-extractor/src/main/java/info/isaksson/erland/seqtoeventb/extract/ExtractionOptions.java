package info.isaksson.erland.seqtoeventb.extract;

import java.util.Set;

/**
 * Tuning knobs for interaction recovery. Defaults suit diagrams drawn at draw.io's default zoom.
 */
public final class ExtractionOptions {
    /**
     * Maximum horizontal distance between a message endpoint and a lifeline center for the
     * endpoint to be attributed to that lifeline.
     */
    public double lifelineDistanceThreshold = 150;

    /** How far above a frame's top edge a floating {@code [guard]} label may sit. */
    public double guardLabelTolerance = 40;

    /** Cell ids that terminate the parent-offset walk (draw.io's root cell and default layer). */
    public Set<String> rootCellIds = Set.of("0", "1");

    /** Overrides the base name derived from the document; {@code null} to derive it. */
    public String modelName;

    public static ExtractionOptions defaults() {
        return new ExtractionOptions();
    }
}
