package autoexplore.explorer;

import autoexplore.driver.ActionDriver;
import autoexplore.driver.ActionResult;
import autoexplore.driver.Locator;
import autoexplore.model.Element;
import autoexplore.model.ElementIdentity;
import autoexplore.model.Platform;
import autoexplore.model.ScreenState;
import autoexplore.snapshot.ElementIdentifier;
import autoexplore.snapshot.SnapshotNode;
import autoexplore.snapshot.SnapshotParser;
import autoexplore.snapshot.SnapshotUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Depth-bounded, depth-first exploration of a live application.
 *
 * <p>On each screen the explorer lists the clickable elements not yet in the
 * {@link Frontier}, activates each one once, records the transition, descends
 * into the resulting screen while {@code depth < maxDepth}, then navigates back
 * before trying the next sibling. Every forward step that succeeded is paired
 * with exactly one back step, so the application's navigation stack mirrors
 * the traversal stack.
 *
 * <p>Nothing is retried. A failed snapshot ends the current branch, a failed
 * activation moves on to the next element, a failed back navigation is only
 * logged. Identities are added to the frontier before activation, so a target
 * that fails once is never attempted again.
 *
 * <p>One instance performs one run. {@link #cancel()} may be called from any
 * thread; it takes effect between elements and between recursive calls, and
 * interrupting the exploring thread has the same effect.
 */
public class Explorer {

    private static final Logger log = LoggerFactory.getLogger(Explorer.class);

    private static final int SAFE_NAME_LENGTH = 30;

    private final ActionDriver   driver;
    private final SnapshotParser parser;
    private final String         appId;
    private final Platform       platform;
    private final Path           screenshotsDir;
    private final long           settleMs;
    private final long           backSettleMs;
    private final Clock          clock;

    private final Frontier          frontier     = new Frontier();
    private final FlowRecorder      recorder     = new FlowRecorder();
    private final List<ScreenState> screenStates = new ArrayList<>();
    private final AtomicBoolean     cancelRequested = new AtomicBoolean(false);
    private final AtomicBoolean     started         = new AtomicBoolean(false);

    private int screenshotSeq = 0;

    public Explorer(ActionDriver driver, ExplorerConfig config, String appId,
                    Platform platform, Path screenshotsDir) {
        this(driver, new SnapshotParser(), config, appId, platform, screenshotsDir, Clock.systemUTC());
    }

    /** Full constructor for tests. */
    Explorer(ActionDriver driver, SnapshotParser parser, ExplorerConfig config, String appId,
             Platform platform, Path screenshotsDir, Clock clock) {
        this.driver         = driver;
        this.parser         = parser;
        this.appId          = appId;
        this.platform       = platform;
        this.screenshotsDir = screenshotsDir;
        this.settleMs       = config.getSettleMs();
        this.backSettleMs   = config.getBackSettleMs();
        this.clock          = clock;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Explores from the current screen and returns whatever was accumulated,
     * including when the run was cancelled part-way. The calling thread's
     * interrupt status is consumed and reported as cancellation.
     *
     * @param maxDepth maximum depth, {@code 0} = only the start screen's transitions
     * @throws IllegalArgumentException if {@code maxDepth} is negative
     * @throws IllegalStateException    if this explorer has already run
     */
    public ExplorationResult run(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Explorer instances are single-use");
        }

        log.info("Starting automated UI exploration — app={}, platform={}, maxDepth={}",
                appId, platform.wireName(), maxDepth);
        Instant start = clock.instant();

        explore(maxDepth);

        Instant end = clock.instant();
        // Clear the interrupt so the caller can still write artifacts
        boolean interrupted = Thread.interrupted();
        boolean cancelled = cancelRequested.get() || interrupted;
        if (cancelled) {
            log.warn("Exploration interrupted — generating artifacts from partial results");
        }
        ExplorationResult result = new ExplorationResult(appId, platform, maxDepth, start, end,
                screenStates, recorder.records(), frontier.snapshot(), screenshotsDir, cancelled);

        log.info("Exploration complete: elapsed={} ms, screens={}, elements={}, flows={}",
                result.getElapsed().toMillis(), screenStates.size(), frontier.size(), recorder.size());
        return result;
    }

    /** Traverses from the current screen at depth 0. Populates the logs only. */
    public void explore(int maxDepth) {
        exploreScreen(0, maxDepth);
    }

    /** Requests cancellation; the traversal stops at the next check point. */
    public void cancel() {
        if (cancelRequested.compareAndSet(false, true)) {
            log.info("Cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelRequested.get() || Thread.currentThread().isInterrupted();
    }

    // ── Traversal ─────────────────────────────────────────────────────────

    private void exploreScreen(int depth, int maxDepth) {
        if (depth > maxDepth || isCancelled()) {
            return;
        }
        String indent = "  ".repeat(depth);
        log.info("{}Exploring at depth {}", indent, depth);

        ActionResult<SnapshotNode> snapshot = driver.captureSnapshot();
        if (!snapshot.isSuccess()) {
            log.warn("{}Could not get hierarchy [{}]: {}", indent,
                    snapshot.getFailureKind(), snapshot.getReason());
            return;
        }
        List<Element> elements;
        try {
            elements = parser.parse(snapshot.getValue());
        } catch (SnapshotUnavailableException e) {
            log.warn("{}Snapshot unavailable: {}", indent, e.getMessage());
            return;
        }

        String screenName = nextScreenshotName("screen_depth" + depth);
        captureScreenshot(screenName, indent);
        screenStates.add(new ScreenState(depth, clock.instant(), screenName, elements));

        List<Element> candidates = elements.stream()
                .filter(e -> !frontier.contains(ElementIdentifier.identify(e)))
                .collect(Collectors.toList());
        log.info("{}Found {} clickable elements ({} unvisited)", indent, elements.size(), candidates.size());

        for (int i = 0; i < candidates.size(); i++) {
            if (isCancelled()) {
                return;
            }
            Element element = candidates.get(i);
            ElementIdentity identity = ElementIdentifier.identify(element);
            // Same identity may appear twice on one screen; first occurrence wins
            if (!frontier.markVisited(identity)) {
                continue;
            }

            log.info("{}[{}/{}] Tapping: {}", indent, i + 1, candidates.size(), identity);
            ActionResult<Void> tap = driver.activate(Locator.forElement(element));
            if (!tap.isSuccess()) {
                log.warn("{}Activation failed for {} [{}]: {}", indent, identity,
                        tap.getFailureKind(), tap.getReason());
                continue;
            }
            boolean settled = pause(settleMs);

            // Recorded even when the settle wait was cut short
            String afterName = nextScreenshotName("after_tap_" + identity.toSafeName(SAFE_NAME_LENGTH));
            captureScreenshot(afterName, indent);
            recorder.record(screenName, afterName, identity, depth, element);
            if (!settled) {
                return;
            }

            if (depth < maxDepth) {
                exploreScreen(depth + 1, maxDepth);
            }
            if (isCancelled()) {
                return;
            }

            log.info("{}Going back", indent);
            ActionResult<Void> back = driver.navigateBack();
            if (!back.isSuccess()) {
                log.warn("{}Back navigation failed [{}]: {}", indent, back.getFailureKind(), back.getReason());
            }
            pause(backSettleMs);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String nextScreenshotName(String prefix) {
        screenshotSeq++;
        return String.format("%s_%03d", prefix, screenshotSeq);
    }

    private void captureScreenshot(String name, String indent) {
        ActionResult<Path> shot = driver.captureScreenshot(screenshotsDir.resolve(name + ".png"));
        if (!shot.isSuccess()) {
            log.warn("{}Screenshot '{}' not captured [{}]: {}", indent, name,
                    shot.getFailureKind(), shot.getReason());
        }
    }

    /**
     * Unconditional settle wait.
     *
     * @return {@code false} if the run was cancelled before or during the wait
     */
    private boolean pause(long millis) {
        if (millis > 0) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelRequested.set(true);
            }
        }
        return !isCancelled();
    }
}
