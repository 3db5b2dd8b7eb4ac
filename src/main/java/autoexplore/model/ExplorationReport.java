package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Machine-readable summary of one exploration run.
 * Maps 1:1 to the root object defined in {@code exploration-report-schema.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"timestamp", "app_id", "platform", "max_depth", "cancelled", "elapsed_ms",
        "total_screens", "total_interactions", "visited_elements", "flows", "screenshots_dir"})
public class ExplorationReport {

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("app_id")
    private String appId;

    @JsonProperty("platform")
    private String platform;

    @JsonProperty("max_depth")
    private int maxDepth;

    @JsonProperty("cancelled")
    private boolean cancelled;

    @JsonProperty("elapsed_ms")
    private long elapsedMillis;

    @JsonProperty("total_screens")
    private int totalScreens;

    @JsonProperty("total_interactions")
    private int totalInteractions;

    @JsonProperty("visited_elements")
    private List<ElementIdentity> visitedElements = new ArrayList<>();

    @JsonProperty("flows")
    private List<FlowRecord> flows = new ArrayList<>();

    @JsonProperty("screenshots_dir")
    private String screenshotsDir;

    public ExplorationReport() {}

    // ── Getters ──────────────────────────────────────────────────────────

    public Instant               getTimestamp()         { return timestamp; }
    public String                getAppId()             { return appId; }
    public String                getPlatform()          { return platform; }
    public int                   getMaxDepth()          { return maxDepth; }
    public boolean               isCancelled()          { return cancelled; }
    public long                  getElapsedMillis()     { return elapsedMillis; }
    public int                   getTotalScreens()      { return totalScreens; }
    public int                   getTotalInteractions() { return totalInteractions; }
    public List<ElementIdentity> getVisitedElements()   { return visitedElements; }
    public List<FlowRecord>      getFlows()             { return flows; }
    public String                getScreenshotsDir()    { return screenshotsDir; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setTimestamp(Instant timestamp)            { this.timestamp = timestamp; }
    public void setAppId(String appId)                     { this.appId = appId; }
    public void setPlatform(String platform)               { this.platform = platform; }
    public void setMaxDepth(int maxDepth)                  { this.maxDepth = maxDepth; }
    public void setCancelled(boolean cancelled)            { this.cancelled = cancelled; }
    public void setElapsedMillis(long elapsedMillis)       { this.elapsedMillis = elapsedMillis; }
    public void setTotalScreens(int totalScreens)          { this.totalScreens = totalScreens; }
    public void setTotalInteractions(int totalInteractions) { this.totalInteractions = totalInteractions; }
    public void setScreenshotsDir(String screenshotsDir)   { this.screenshotsDir = screenshotsDir; }

    public void setVisitedElements(List<ElementIdentity> visited) {
        this.visitedElements = visited != null ? new ArrayList<>(visited) : new ArrayList<>();
    }

    public void setFlows(List<FlowRecord> flows) {
        this.flows = flows != null ? new ArrayList<>(flows) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return String.format("ExplorationReport{app='%s', screens=%d, interactions=%d, cancelled=%b}",
                appId, totalScreens, totalInteractions, cancelled);
    }
}
