package info.isaksson.erland.seqtoeventb.advisor;

/**
 * Boundary around advisor calls. Nothing an advisor does escapes as an exception.
 */
public final class Advisories {

    private Advisories() {}

    public static AdvisoryResult run(PropertyAdvisor advisor, AdvisoryRequest request) {
        if (advisor == null) return AdvisoryResult.failed("no advisor configured");
        if (request == null) return AdvisoryResult.failed("nothing to advise on");
        try {
            String text = advisor.proposeProperties(request);
            if (text == null || text.isBlank()) return AdvisoryResult.failed("advisor returned no text");
            return AdvisoryResult.ok(text.trim());
        } catch (RuntimeException e) {
            String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return AdvisoryResult.failed(msg);
        }
    }
}
