package autoexplore.explorer;

import autoexplore.model.ElementIdentity;
import autoexplore.model.FlowRecord;
import autoexplore.model.Platform;
import autoexplore.model.ScreenState;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one exploration run accumulated: the screen-state log, the flow
 * log, the frontier contents and run metadata. Produced by
 * {@link Explorer#run(int)} whether the run completed or was cancelled.
 */
public final class ExplorationResult {

    private final String                appId;
    private final Platform              platform;
    private final int                   maxDepth;
    private final Instant               startedAt;
    private final Instant               finishedAt;
    private final List<ScreenState>     screenStates;
    private final List<FlowRecord>      flows;
    private final List<ElementIdentity> visitedElements;
    private final Path                  screenshotsDir;
    private final boolean               cancelled;

    public ExplorationResult(String appId, Platform platform, int maxDepth,
                             Instant startedAt, Instant finishedAt,
                             List<ScreenState> screenStates, List<FlowRecord> flows,
                             List<ElementIdentity> visitedElements,
                             Path screenshotsDir, boolean cancelled) {
        this.appId           = appId;
        this.platform        = platform;
        this.maxDepth        = maxDepth;
        this.startedAt       = startedAt;
        this.finishedAt      = finishedAt;
        this.screenStates    = Collections.unmodifiableList(new ArrayList<>(screenStates));
        this.flows           = Collections.unmodifiableList(new ArrayList<>(flows));
        this.visitedElements = Collections.unmodifiableList(new ArrayList<>(visitedElements));
        this.screenshotsDir  = screenshotsDir;
        this.cancelled       = cancelled;
    }

    public String                getAppId()           { return appId; }
    public Platform              getPlatform()        { return platform; }
    public int                   getMaxDepth()        { return maxDepth; }
    public Instant               getStartedAt()       { return startedAt; }
    public Instant               getFinishedAt()      { return finishedAt; }
    public List<ScreenState>     getScreenStates()    { return screenStates; }
    public List<FlowRecord>      getFlows()           { return flows; }
    public List<ElementIdentity> getVisitedElements() { return visitedElements; }
    public Path                  getScreenshotsDir()  { return screenshotsDir; }
    public boolean               isCancelled()        { return cancelled; }

    public Duration getElapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return String.format("ExplorationResult{app='%s', screens=%d, flows=%d, visited=%d%s}",
                appId, screenStates.size(), flows.size(), visitedElements.size(),
                cancelled ? ", CANCELLED" : "");
    }
}
