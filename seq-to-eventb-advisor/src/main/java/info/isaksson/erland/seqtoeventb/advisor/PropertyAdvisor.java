package info.isaksson.erland.seqtoeventb.advisor;

/**
 * Proposes temporal-logic properties worth checking on a generated machine.
 *
 * <p>Implementations may call remote services and may fail in any way; callers go through
 * {@link Advisories#run(PropertyAdvisor, AdvisoryRequest)}, which contains those failures.</p>
 */
public interface PropertyAdvisor {

    String proposeProperties(AdvisoryRequest request);
}
