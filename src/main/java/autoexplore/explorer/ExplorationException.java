package autoexplore.explorer;

/**
 * Unchecked exception for failures outside the traversal itself, such as an
 * output directory that cannot be created or artifacts that cannot be written.
 * Backend failures during traversal never surface as this exception.
 */
public class ExplorationException extends RuntimeException {

    public ExplorationException(String msg) {
        super(msg);
    }

    public ExplorationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
