package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One observed transition: activating {@link #getElement()} on the screen
 * captured as {@code fromScreen} led to the screen captured as {@code toScreen}.
 */
@JsonPropertyOrder({"from_screen", "action", "to_screen", "depth", "element"})
public final class FlowRecord {

    private final String          fromScreen;
    private final String          toScreen;
    private final ElementIdentity action;
    private final int             depth;
    private final Element         element;

    @JsonCreator
    public FlowRecord(@JsonProperty("from_screen") String fromScreen,
                      @JsonProperty("to_screen") String toScreen,
                      @JsonProperty("action") ElementIdentity action,
                      @JsonProperty("depth") int depth,
                      @JsonProperty("element") Element element) {
        this.fromScreen = fromScreen;
        this.toScreen   = toScreen;
        this.action     = action;
        this.depth      = depth;
        this.element    = element;
    }

    @JsonProperty("from_screen") public String          getFromScreen() { return fromScreen; }
    @JsonProperty("to_screen")   public String          getToScreen()   { return toScreen; }
    @JsonProperty("action")      public ElementIdentity getAction()     { return action; }
    @JsonProperty("depth")       public int             getDepth()      { return depth; }
    @JsonProperty("element")     public Element         getElement()    { return element; }

    @Override
    public String toString() {
        return String.format("FlowRecord{%s --[%s]--> %s @%d}", fromScreen, action, toScreen, depth);
    }
}
