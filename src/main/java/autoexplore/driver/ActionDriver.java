package autoexplore.driver;

import autoexplore.snapshot.SnapshotNode;

import java.nio.file.Path;

/**
 * Automation backend that observes and manipulates the application under
 * exploration.
 *
 * <p>Every call is bounded by its own timeout and reports failure through
 * {@link ActionResult}; a timeout is reported as {@link FailureKind#TIMEOUT}.
 * Calls are issued sequentially from a single thread.
 */
public interface ActionDriver {

    /** Captures the current UI tree. */
    ActionResult<SnapshotNode> captureSnapshot();

    /**
     * Captures a screenshot of the current screen into {@code target}.
     *
     * @return the written file on success
     */
    ActionResult<Path> captureScreenshot(Path target);

    /** Taps / activates the element addressed by {@code locator}. */
    ActionResult<Void> activate(Locator locator);

    /** Navigates back one screen. Best-effort; callers only log failures. */
    ActionResult<Void> navigateBack();
}
