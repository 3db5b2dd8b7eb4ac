package autoexplore.driver;

import autoexplore.snapshot.SnapshotDecoder;
import autoexplore.snapshot.SnapshotNode;
import autoexplore.snapshot.SnapshotUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * {@link ActionDriver} backed by the Maestro CLI.
 *
 * <ul>
 *   <li>snapshot: {@code maestro hierarchy}, decoded by {@link SnapshotDecoder}</li>
 *   <li>activate / back: a one-step flow written to a temp file and run with
 *       {@code maestro test <flow>}; exit code 0 means success</li>
 *   <li>screenshot: delegated to the platform's {@link ScreenshotCapturer}</li>
 * </ul>
 */
public class MaestroActionDriver implements ActionDriver {

    private static final Logger log = LoggerFactory.getLogger(MaestroActionDriver.class);

    private final String             maestroPath;
    private final String             appId;
    private final Duration           hierarchyTimeout;
    private final Duration           tapTimeout;
    private final Duration           backTimeout;
    private final CommandRunner      runner;
    private final ScreenshotCapturer screenshots;
    private final SnapshotDecoder    decoder = new SnapshotDecoder();

    public MaestroActionDriver(String maestroPath, String appId,
                               Duration hierarchyTimeout, Duration tapTimeout, Duration backTimeout,
                               CommandRunner runner, ScreenshotCapturer screenshots) {
        this.maestroPath      = maestroPath;
        this.appId            = appId;
        this.hierarchyTimeout = hierarchyTimeout;
        this.tapTimeout       = tapTimeout;
        this.backTimeout      = backTimeout;
        this.runner           = runner;
        this.screenshots      = screenshots;
    }

    // ── ActionDriver ──────────────────────────────────────────────────────

    @Override
    public ActionResult<SnapshotNode> captureSnapshot() {
        CommandRunner.CommandResult r;
        try {
            r = runner.run(List.of(maestroPath, "hierarchy"), hierarchyTimeout);
        } catch (IOException e) {
            return ActionResult.failure(FailureKind.OBSERVATION_FAILED,
                    "Cannot run maestro hierarchy: " + e.getMessage());
        }
        if (r.timedOut()) {
            return ActionResult.failure(FailureKind.TIMEOUT,
                    "maestro hierarchy timed out after " + hierarchyTimeout.toSeconds() + "s");
        }
        if (r.interrupted()) {
            return ActionResult.failure(FailureKind.INTERRUPTED, "maestro hierarchy interrupted");
        }
        if (r.exitCode() != 0) {
            return ActionResult.failure(FailureKind.OBSERVATION_FAILED,
                    "maestro hierarchy exited with code " + r.exitCode() + ": " + r.stderr().strip());
        }
        try {
            return ActionResult.success(decoder.decode(r.stdout()));
        } catch (SnapshotUnavailableException e) {
            return ActionResult.failure(FailureKind.SNAPSHOT_UNAVAILABLE, e.getMessage());
        }
    }

    @Override
    public ActionResult<Path> captureScreenshot(Path target) {
        return screenshots.capture(target);
    }

    @Override
    public ActionResult<Void> activate(Locator locator) {
        return runFlow(MaestroSteps.tapOn(locator), tapTimeout, FailureKind.ACTIVATION_FAILED);
    }

    @Override
    public ActionResult<Void> navigateBack() {
        return runFlow(MaestroSteps.BACK, backTimeout, FailureKind.BACK_NAVIGATION_FAILED);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    /** Content of a one-step flow file. Package-private for tests. */
    String flowContent(String step) {
        return MaestroSteps.header(appId) + step + "\n";
    }

    private ActionResult<Void> runFlow(String step, Duration timeout, FailureKind failureKind) {
        Path flow = null;
        try {
            flow = Files.createTempFile("maestro_step_", ".yaml");
            Files.writeString(flow, flowContent(step), StandardCharsets.UTF_8);
            CommandRunner.CommandResult r = runner.run(List.of(maestroPath, "test", flow.toString()), timeout);
            if (r.timedOut()) {
                return ActionResult.failure(FailureKind.TIMEOUT,
                        "maestro test timed out after " + timeout.toSeconds() + "s");
            }
            if (r.interrupted()) {
                return ActionResult.failure(FailureKind.INTERRUPTED, "maestro test interrupted");
            }
            if (r.exitCode() != 0) {
                return ActionResult.failure(failureKind,
                        "maestro test exited with code " + r.exitCode());
            }
            return ActionResult.done();
        } catch (IOException e) {
            return ActionResult.failure(failureKind, "Cannot run maestro test: " + e.getMessage());
        } finally {
            deleteQuietly(flow);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp flow {}: {}", file, e.getMessage());
        }
    }
}
