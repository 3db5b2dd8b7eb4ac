package autoexplore.driver;

/** Why an {@link ActionDriver} call did not succeed. */
public enum FailureKind {
    /** Snapshot missing, undecodable, or without structured content. */
    SNAPSHOT_UNAVAILABLE,
    /** Backend call for a snapshot or screenshot failed. */
    OBSERVATION_FAILED,
    /** The element could not be triggered. */
    ACTIVATION_FAILED,
    /** Back navigation failed; never fatal. */
    BACK_NAVIGATION_FAILED,
    /** The call exceeded its time budget; handled like the call's own failure. */
    TIMEOUT,
    /** The calling thread was interrupted while waiting on the backend. */
    INTERRUPTED
}
