package autoexplore.driver;

import autoexplore.model.Platform;
import autoexplore.snapshot.PageSourceConverter;
import autoexplore.snapshot.SnapshotNode;
import autoexplore.snapshot.SnapshotUnavailableException;
import org.openqa.selenium.By;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.interactions.Actions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link ActionDriver} over a Selenium {@link WebDriver} session, typically a
 * {@code RemoteWebDriver} connected to an Appium server (UiAutomator2 or
 * XCUITest).
 *
 * <p>Label locators are resolved with XPath attribute matches in the
 * platform's page-source dialect; resource ids use {@link By#id}; point
 * locators are tapped with W3C pointer actions. Command timeouts are those
 * configured on the session itself and surface as {@link TimeoutException}.
 */
public class WebDriverActionDriver implements ActionDriver {

    private static final Logger log = LoggerFactory.getLogger(WebDriverActionDriver.class);

    private final WebDriver           driver;
    private final Platform            platform;
    private final PageSourceConverter converter;

    public WebDriverActionDriver(WebDriver driver, Platform platform) {
        this.driver    = driver;
        this.platform  = platform;
        this.converter = new PageSourceConverter(platform);
    }

    // ── ActionDriver ──────────────────────────────────────────────────────

    @Override
    public ActionResult<SnapshotNode> captureSnapshot() {
        try {
            return ActionResult.success(converter.convert(driver.getPageSource()));
        } catch (SnapshotUnavailableException e) {
            return ActionResult.failure(FailureKind.SNAPSHOT_UNAVAILABLE, e.getMessage());
        } catch (TimeoutException e) {
            return ActionResult.failure(FailureKind.TIMEOUT, "getPageSource timed out: " + firstLine(e));
        } catch (WebDriverException e) {
            return ActionResult.failure(FailureKind.OBSERVATION_FAILED, "getPageSource failed: " + firstLine(e));
        }
    }

    @Override
    public ActionResult<Path> captureScreenshot(Path target) {
        if (!(driver instanceof TakesScreenshot ts)) {
            return ActionResult.failure(FailureKind.OBSERVATION_FAILED,
                    "Driver does not support TakesScreenshot");
        }
        try {
            byte[] png = ts.getScreenshotAs(OutputType.BYTES);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.write(target, png);
            return ActionResult.success(target);
        } catch (TimeoutException e) {
            return ActionResult.failure(FailureKind.TIMEOUT, "Screenshot timed out: " + firstLine(e));
        } catch (WebDriverException | IOException e) {
            return ActionResult.failure(FailureKind.OBSERVATION_FAILED, "Screenshot failed: " + e.getMessage());
        }
    }

    @Override
    public ActionResult<Void> activate(Locator locator) {
        try {
            if (locator.getStrategy() == Locator.Strategy.POINT) {
                tapPoint(locator);
            } else {
                driver.findElement(toBy(locator)).click();
            }
            log.debug("Activated {}", locator);
            return ActionResult.done();
        } catch (NoSuchElementException e) {
            return ActionResult.failure(FailureKind.ACTIVATION_FAILED, "Element not found: " + locator);
        } catch (TimeoutException e) {
            return ActionResult.failure(FailureKind.TIMEOUT, "Activation timed out: " + firstLine(e));
        } catch (WebDriverException | IllegalArgumentException e) {
            return ActionResult.failure(FailureKind.ACTIVATION_FAILED,
                    "Activation failed for " + locator + ": " + firstLine(e));
        }
    }

    @Override
    public ActionResult<Void> navigateBack() {
        try {
            driver.navigate().back();
            return ActionResult.done();
        } catch (TimeoutException e) {
            return ActionResult.failure(FailureKind.TIMEOUT, "Back navigation timed out: " + firstLine(e));
        } catch (WebDriverException e) {
            return ActionResult.failure(FailureKind.BACK_NAVIGATION_FAILED, "Back failed: " + firstLine(e));
        }
    }

    // ── Locator translation ───────────────────────────────────────────────

    /** Selenium {@link By} for a label or id locator. Package-private for tests. */
    By toBy(Locator locator) {
        return switch (locator.getStrategy()) {
            case TEXT -> By.xpath("//*[@" + (platform == Platform.IOS ? "label" : "text")
                    + "=" + xpathLiteral(locator.getValue()) + "]");
            case ACCESSIBILITY -> By.xpath("//*[@" + (platform == Platform.IOS ? "name" : "content-desc")
                    + "=" + xpathLiteral(locator.getValue()) + "]");
            case ID -> By.id(locator.getValue());
            case POINT -> throw new IllegalArgumentException("POINT locators have no By form");
        };
    }

    private void tapPoint(Locator locator) {
        String[] parts = locator.getValue().split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Malformed point: " + locator.getValue());
        }
        int x, y;
        if (locator.isRelativePoint()) {
            Dimension size = driver.manage().window().getSize();
            x = percentOf(parts[0], size.getWidth());
            y = percentOf(parts[1], size.getHeight());
        } else {
            x = Integer.parseInt(parts[0].trim());
            y = Integer.parseInt(parts[1].trim());
        }
        new Actions(driver).moveToLocation(x, y).click().perform();
    }

    private static int percentOf(String raw, int total) {
        double pct = Double.parseDouble(raw.trim().replace("%", ""));
        return (int) Math.round(total * pct / 100.0);
    }

    /** Quotes {@code value} as an XPath 1.0 string literal. */
    static String xpathLiteral(String value) {
        if (!value.contains("'")) return "'" + value + "'";
        if (!value.contains("\"")) return "\"" + value + "\"";
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = value.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(", \"'\", ");
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }

    private static String firstLine(Exception e) {
        String msg = e.getMessage();
        if (msg == null) return e.getClass().getSimpleName();
        int nl = msg.indexOf('\n');
        return nl >= 0 ? msg.substring(0, nl) : msg;
    }
}
