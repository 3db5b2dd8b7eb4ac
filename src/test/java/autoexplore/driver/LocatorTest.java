package autoexplore.driver;

import autoexplore.model.Element;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LocatorTest {

    private static Element element(String text, String acc, String id, String bounds) {
        return new Element(text, acc, id, bounds, "android.widget.Button", "");
    }

    @Test
    public void textTakesPriority() {
        Locator l = Locator.forElement(element("Settings", "gear", "com.x:id/s", "[0,0][10,10]"));

        assertThat(l.getStrategy()).isEqualTo(Locator.Strategy.TEXT);
        assertThat(l.getValue()).isEqualTo("Settings");
    }

    @Test
    public void accessibilityUsedWhenTextBlank() {
        Locator l = Locator.forElement(element(" ", "gear", "com.x:id/s", "[0,0][10,10]"));

        assertThat(l).isEqualTo(new Locator(Locator.Strategy.ACCESSIBILITY, "gear"));
    }

    @Test
    public void resourceIdUsedWhenNoLabels() {
        Locator l = Locator.forElement(element("", "", "com.x:id/s", "[0,0][10,10]"));

        assertThat(l).isEqualTo(new Locator(Locator.Strategy.ID, "com.x:id/s"));
    }

    @Test
    public void pointIsCentreOfBounds() {
        Locator l = Locator.forElement(element("", "", "", "[0,210][1080,360]"));

        assertThat(l.getStrategy()).isEqualTo(Locator.Strategy.POINT);
        assertThat(l.getValue()).isEqualTo("540,285");
        assertThat(l.isRelativePoint()).isFalse();
    }

    @Test
    public void unparsableBounds_fallBackToScreenCentre() {
        assertThat(Locator.forElement(element("", "", "", "")).getValue()).isEqualTo(Locator.SCREEN_CENTRE);
        assertThat(Locator.forElement(element(null, null, null, null)).isRelativePoint()).isTrue();
        assertThat(Locator.centreOf("garbage")).isEqualTo("50%,50%");
    }

    @Test
    public void coordinatesBeyondLongRange_fallBackToScreenCentre() {
        assertThat(Locator.centreOf("[99999999999999999999,0][0,0]")).isEqualTo(Locator.SCREEN_CENTRE);

        Locator l = Locator.forElement(element("", "", "", "[0,0][0,99999999999999999999]"));
        assertThat(l.getStrategy()).isEqualTo(Locator.Strategy.POINT);
        assertThat(l.isRelativePoint()).isTrue();
    }

    @Test
    public void labelValuesAreNotTrimmed() {
        assertThat(Locator.forElement(element(" OK ", "", "", "")).getValue()).isEqualTo(" OK ");
    }
}
