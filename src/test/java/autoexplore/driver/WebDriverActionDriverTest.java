package autoexplore.driver;

import autoexplore.model.Platform;
import autoexplore.snapshot.SnapshotNode;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Interactive;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class WebDriverActionDriverTest {

    /** Appium sessions implement all three. */
    private interface FullDriver extends WebDriver, TakesScreenshot, Interactive {}

    @Mock FullDriver driver;
    @Mock WebElement element;
    @Mock WebDriver.Navigation navigation;

    private AutoCloseable mocks;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(driver.navigate()).thenReturn(navigation);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    public void snapshot_convertsPageSource() {
        when(driver.getPageSource()).thenReturn(
                "<hierarchy><node text=\"Home\" clickable=\"true\"/></hierarchy>");

        ActionResult<SnapshotNode> r = new WebDriverActionDriver(driver, Platform.ANDROID).captureSnapshot();

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getValue().asTree().children().get(0).asTree().attribute("text")).isEqualTo("Home");
    }

    @Test
    public void snapshot_sessionError_isObservationFailure() {
        when(driver.getPageSource()).thenThrow(new WebDriverException("session gone"));

        ActionResult<SnapshotNode> r = new WebDriverActionDriver(driver, Platform.ANDROID).captureSnapshot();

        assertThat(r.getFailureKind()).isEqualTo(FailureKind.OBSERVATION_FAILED);
    }

    @Test
    public void snapshot_emptySource_isSnapshotUnavailable() {
        when(driver.getPageSource()).thenReturn("");

        assertThat(new WebDriverActionDriver(driver, Platform.ANDROID).captureSnapshot().getFailureKind())
                .isEqualTo(FailureKind.SNAPSHOT_UNAVAILABLE);
    }

    @Test
    public void activate_clicksElementFoundByXpath() {
        By expected = By.xpath("//*[@text='Settings']");
        when(driver.findElement(any(By.class))).thenReturn(element);

        ActionResult<Void> r = new WebDriverActionDriver(driver, Platform.ANDROID)
                .activate(new Locator(Locator.Strategy.TEXT, "Settings"));

        assertThat(r.isSuccess()).isTrue();
        verify(driver).findElement(expected);
        verify(element).click();
    }

    @Test
    public void activate_missingElement_isActivationFailure() {
        when(driver.findElement(any(By.class))).thenThrow(new NoSuchElementException("nope"));

        ActionResult<Void> r = new WebDriverActionDriver(driver, Platform.ANDROID)
                .activate(new Locator(Locator.Strategy.ID, "com.x:id/gone"));

        assertThat(r.getFailureKind()).isEqualTo(FailureKind.ACTIVATION_FAILED);
    }

    @Test
    public void activate_absolutePoint_performsPointerAction() {
        ActionResult<Void> r = new WebDriverActionDriver(driver, Platform.ANDROID)
                .activate(new Locator(Locator.Strategy.POINT, "540,285"));

        assertThat(r.isSuccess()).isTrue();
        verify(driver).perform(anyCollection());
    }

    @Test
    public void activate_relativePoint_usesWindowSize() {
        WebDriver.Options options = mock(WebDriver.Options.class);
        WebDriver.Window window = mock(WebDriver.Window.class);
        when(driver.manage()).thenReturn(options);
        when(options.window()).thenReturn(window);
        when(window.getSize()).thenReturn(new Dimension(1080, 1920));

        ActionResult<Void> r = new WebDriverActionDriver(driver, Platform.ANDROID)
                .activate(new Locator(Locator.Strategy.POINT, "50%,50%"));

        assertThat(r.isSuccess()).isTrue();
        verify(window).getSize();
        verify(driver).perform(anyCollection());
    }

    @Test
    public void back_usesNavigation() {
        ActionResult<Void> r = new WebDriverActionDriver(driver, Platform.ANDROID).navigateBack();

        assertThat(r.isSuccess()).isTrue();
        verify(navigation).back();
    }

    @Test
    public void back_failure_isBackNavigationFailure() {
        doThrow(new WebDriverException("no history")).when(navigation).back();

        assertThat(new WebDriverActionDriver(driver, Platform.ANDROID).navigateBack().getFailureKind())
                .isEqualTo(FailureKind.BACK_NAVIGATION_FAILED);
    }

    @Test
    public void screenshot_writesPngBytes() throws Exception {
        Path dir = Files.createTempDirectory("shots");
        Path target = dir.resolve("nested").resolve("screen_depth0_001.png");
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(driver.getScreenshotAs(OutputType.BYTES)).thenReturn(png);

        ActionResult<Path> r = new WebDriverActionDriver(driver, Platform.ANDROID).captureScreenshot(target);

        assertThat(r.isSuccess()).isTrue();
        assertThat(Files.readAllBytes(target)).isEqualTo(png);
    }

    @Test
    public void screenshot_unsupportedDriver_fails() {
        WebDriver plain = mock(WebDriver.class);

        ActionResult<Path> r = new WebDriverActionDriver(plain, Platform.ANDROID).captureScreenshot(Path.of("x.png"));

        assertThat(r.getFailureKind()).isEqualTo(FailureKind.OBSERVATION_FAILED);
    }

    // ── Locator translation ──────────────────────────────────────────────

    @Test
    public void toBy_usesPlatformAttributeNames() {
        WebDriverActionDriver android = new WebDriverActionDriver(driver, Platform.ANDROID);
        WebDriverActionDriver ios = new WebDriverActionDriver(driver, Platform.IOS);

        assertThat(android.toBy(new Locator(Locator.Strategy.ACCESSIBILITY, "Menu")).toString())
                .isEqualTo(By.xpath("//*[@content-desc='Menu']").toString());
        assertThat(ios.toBy(new Locator(Locator.Strategy.TEXT, "Continue")).toString())
                .isEqualTo(By.xpath("//*[@label='Continue']").toString());
        assertThat(ios.toBy(new Locator(Locator.Strategy.ACCESSIBILITY, "close")).toString())
                .isEqualTo(By.xpath("//*[@name='close']").toString());
        assertThat(android.toBy(new Locator(Locator.Strategy.ID, "com.x:id/a")).toString())
                .isEqualTo(By.id("com.x:id/a").toString());
    }

    @Test
    public void xpathLiteral_handlesQuotes() {
        assertThat(WebDriverActionDriver.xpathLiteral("plain")).isEqualTo("'plain'");
        assertThat(WebDriverActionDriver.xpathLiteral("it's")).isEqualTo("\"it's\"");
        assertThat(WebDriverActionDriver.xpathLiteral("a'b\"c")).isEqualTo("concat('a', \"'\", 'b\"c')");
    }
}
