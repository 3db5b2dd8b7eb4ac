package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One observation taken by the explorer: the screenshot reference plus every
 * interactable element found in that snapshot, in backend order.
 * Immutable once constructed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ScreenState {

    @JsonProperty("depth")
    private final int depth;

    @JsonProperty("capturedAt")
    private final Instant capturedAt;

    @JsonProperty("screenshot")
    private final String screenshotRef;

    @JsonProperty("elements")
    private final List<Element> elements;

    public ScreenState(int depth, Instant capturedAt, String screenshotRef, List<Element> elements) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0, got " + depth);
        }
        this.depth         = depth;
        this.capturedAt    = capturedAt;
        this.screenshotRef = screenshotRef;
        this.elements      = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public int           getDepth()         { return depth; }
    public Instant       getCapturedAt()    { return capturedAt; }
    public String        getScreenshotRef() { return screenshotRef; }
    public List<Element> getElements()      { return elements; }

    @Override
    public String toString() {
        return String.format("ScreenState{depth=%d, screenshot='%s', elements=%d}",
                depth, screenshotRef, elements.size());
    }
}
