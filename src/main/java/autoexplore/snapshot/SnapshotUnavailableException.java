package autoexplore.snapshot;

/**
 * Thrown when a backend snapshot is missing, cannot be decoded, or carries no
 * structured content. Drivers convert it into a
 * {@code FailureKind.SNAPSHOT_UNAVAILABLE} result.
 */
public class SnapshotUnavailableException extends Exception {

    public SnapshotUnavailableException(String msg) {
        super(msg);
    }

    public SnapshotUnavailableException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
