package autoexplore.driver;

import autoexplore.model.Element;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How an element is addressed when it is activated or replayed.
 *
 * <p>{@link #forElement(Element)} picks the strategy in priority order:
 * visible text, accessibility text, resource id, then a tap on the centre of
 * the element's bounds.
 */
public final class Locator {

    public enum Strategy { TEXT, ACCESSIBILITY, ID, POINT }

    /** Point used when bounds are missing or unparsable. */
    public static final String SCREEN_CENTRE = "50%,50%";

    private static final Pattern BOUNDS =
            Pattern.compile("\\[\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*]\\s*\\[\\s*(-?\\d+)\\s*,\\s*(-?\\d+)\\s*]");

    private final Strategy strategy;
    private final String   value;

    public Locator(Strategy strategy, String value) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.value    = Objects.requireNonNull(value, "value");
    }

    public static Locator forElement(Element element) {
        if (isUsable(element.getText())) {
            return new Locator(Strategy.TEXT, element.getText());
        }
        if (isUsable(element.getAccessibilityText())) {
            return new Locator(Strategy.ACCESSIBILITY, element.getAccessibilityText());
        }
        if (isUsable(element.getResourceId())) {
            return new Locator(Strategy.ID, element.getResourceId());
        }
        return new Locator(Strategy.POINT, centreOf(element.getBounds()));
    }

    /**
     * Centre of an Android-style bounds string {@code [x1,y1][x2,y2]} as
     * {@code "x,y"}, or {@code "50%,50%"} when it cannot be parsed.
     */
    static String centreOf(String bounds) {
        if (bounds == null) return SCREEN_CENTRE;
        Matcher m = BOUNDS.matcher(bounds);
        if (!m.find()) return SCREEN_CENTRE;
        try {
            long x = (Long.parseLong(m.group(1)) + Long.parseLong(m.group(3))) / 2;
            long y = (Long.parseLong(m.group(2)) + Long.parseLong(m.group(4))) / 2;
            return x + "," + y;
        } catch (NumberFormatException e) {
            // Coordinates beyond the long range
            return SCREEN_CENTRE;
        }
    }

    public Strategy getStrategy() { return strategy; }
    public String   getValue()    { return value; }

    /** True when the point value is expressed as screen percentages. */
    public boolean isRelativePoint() {
        return strategy == Strategy.POINT && value.contains("%");
    }

    private static boolean isUsable(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Locator)) return false;
        Locator other = (Locator) o;
        return strategy == other.strategy && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, value);
    }

    @Override
    public String toString() {
        return String.format("Locator{%s='%s'}", strategy, value);
    }
}
