package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A candidate interactable node observed in one UI snapshot.
 *
 * <p>Elements are rebuilt from every snapshot by {@code SnapshotParser}; an
 * instance is never carried from one screen to another by reference.
 * {@link #getNodeClass()} and {@link #getPath()} are diagnostic only and play
 * no part in the element's identity.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Element {

    /** Primary visible label. */
    @JsonProperty("text")
    private String text;

    /** Label exposed to assistive tooling (Android content-desc, iOS name). */
    @JsonProperty("accessibilityText")
    private String accessibilityText;

    @JsonProperty("resource-id")
    private String resourceId;

    /** Raw geometry descriptor, e.g. {@code [0,210][1080,360]}. */
    @JsonProperty("bounds")
    private String bounds;

    @JsonProperty("class")
    private String nodeClass;

    /** Structural position inside the snapshot, e.g. {@code /child[0]/child[2]}. */
    @JsonProperty("path")
    private String path;

    public Element() {}

    public Element(String text, String accessibilityText, String resourceId,
                   String bounds, String nodeClass, String path) {
        this.text              = text;
        this.accessibilityText = accessibilityText;
        this.resourceId        = resourceId;
        this.bounds            = bounds;
        this.nodeClass         = nodeClass;
        this.path              = path;
    }

    public String getText()              { return text; }
    public String getAccessibilityText() { return accessibilityText; }
    public String getResourceId()        { return resourceId; }
    public String getBounds()            { return bounds; }
    public String getNodeClass()         { return nodeClass; }
    public String getPath()              { return path; }

    public void setText(String text)                          { this.text = text; }
    public void setAccessibilityText(String accessibilityText) { this.accessibilityText = accessibilityText; }
    public void setResourceId(String resourceId)              { this.resourceId = resourceId; }
    public void setBounds(String bounds)                      { this.bounds = bounds; }
    public void setNodeClass(String nodeClass)                { this.nodeClass = nodeClass; }
    public void setPath(String path)                          { this.path = path; }

    @Override
    public String toString() {
        return String.format("Element{text='%s', acc='%s', id='%s', bounds='%s', class='%s'}",
                text, accessibilityText, resourceId, bounds, nodeClass);
    }
}
