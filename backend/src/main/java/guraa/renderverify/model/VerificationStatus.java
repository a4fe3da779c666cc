package guraa.renderverify.model;

/**
 * Terminal states a verification can end in.
 */
public enum VerificationStatus {
    PASSED,
    REGRESSION,
    /** No stored master matched the current environment. */
    BASELINE_NEEDED,
    /** No master matched, so the capture was stored as a new one. */
    BASELINE_CREATED,
    /** The comparison did not reach a verdict, because it timed out or failed to run. */
    INCOMPLETE
}
