package autoexplore.cli;

import autoexplore.driver.ActionDriver;
import autoexplore.driver.CommandRunner;
import autoexplore.driver.MaestroActionDriver;
import autoexplore.driver.ScreenshotCapturer;
import autoexplore.driver.WebDriverActionDriver;
import autoexplore.explorer.ExplorationResult;
import autoexplore.explorer.Explorer;
import autoexplore.explorer.ExplorerConfig;
import autoexplore.model.ExplorationIO;
import autoexplore.model.ExplorationReport;
import autoexplore.model.Platform;
import autoexplore.script.ArtifactWriter;
import autoexplore.script.GeneratedArtifacts;
import autoexplore.script.ScriptGenerator;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.remote.DesiredCapabilities;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.MalformedURLException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Unified CLI entry-point for AutoExplore.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code autoexplore explore} — explore a running app and generate a Maestro flow + report</li>
 *   <li>{@code autoexplore summary} — print the counts of a saved exploration report</li>
 *   <li>{@code autoexplore version} — print build version</li>
 * </ul>
 *
 * <p>Main class wired into the fat-JAR manifest by maven-shade-plugin.
 */
@Command(
        name        = "autoexplore",
        description = "Automated UI explorer — discovers reachable screens and generates a replayable Maestro flow",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                ExploreCLI.ExploreCommand.class,
                ExploreCLI.SummaryCommand.class,
                ExploreCLI.VersionCommand.class
        }
)
public class ExploreCLI implements Callable<Integer> {

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(String[] args) {
        int exit = new CommandLine(new ExploreCLI()).execute(args);
        System.exit(exit);
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Explores the application currently in the foreground. Ctrl+C stops the
     * traversal; the script and report are still written from partial results.
     */
    @Command(
            name        = "explore",
            description = "Explore a running app and generate a Maestro flow plus JSON report",
            mixinStandardHelpOptions = true
    )
    static class ExploreCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(ExploreCommand.class);

        private static final DateTimeFormatter DIR_TS_FMT =
                DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.of("UTC"));

        @Option(
                names       = {"-a", "--app-id"},
                description = "App package / bundle id (default: com.whisker.android)",
                defaultValue = "com.whisker.android"
        )
        String appId;

        @Option(
                names       = {"-p", "--platform"},
                description = "Target platform: android, ios (default: android)",
                defaultValue = "android"
        )
        String platform;

        @Option(
                names       = {"-d", "--max-depth"},
                description = "Maximum exploration depth (default: explorer.max.depth, 3)"
        )
        Integer maxDepth;

        @Option(
                names       = {"-b", "--backend"},
                description = "Automation backend: maestro, webdriver (default: maestro)",
                defaultValue = "maestro"
        )
        String backend;

        @Option(
                names       = {"--remote-url"},
                description = "WebDriver / Appium server URL for the webdriver backend (default: http://127.0.0.1:4723)",
                defaultValue = "http://127.0.0.1:4723"
        )
        String remoteUrl;

        @Option(
                names       = {"-o", "--output"},
                description = "Output directory (default: explorer.output.dir, exploration)"
        )
        String outputDir;

        @Override
        public Integer call() throws Exception {
            Platform target;
            try {
                target = Platform.fromString(platform);
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                return 1;
            }
            if (maxDepth != null && maxDepth < 0) {
                System.err.println("--max-depth must be >= 0");
                return 1;
            }
            String mode = backend.toLowerCase(Locale.ROOT).trim();
            if (!mode.equals("maestro") && !mode.equals("webdriver")) {
                System.err.println("Unknown backend '" + backend + "' (expected maestro or webdriver)");
                return 1;
            }

            ExplorerConfig config = new ExplorerConfig();
            if (maxDepth != null) config.setMaxDepth(maxDepth);
            if (outputDir != null && !outputDir.isBlank()) config.setOutputDir(outputDir);

            Path out = Path.of(config.getOutputDir());
            Path screenshots = out.resolve("ui_exploration_" + DIR_TS_FMT.format(Instant.now()));
            Files.createDirectories(screenshots);

            System.out.println("Starting Automated UI Exploration");
            System.out.println("=".repeat(60));
            System.out.printf("  App ID     : %s%n", appId);
            System.out.printf("  Platform   : %s%n", target.wireName());
            System.out.printf("  Backend    : %s%n", mode);
            System.out.printf("  Max depth  : %d%n", config.getMaxDepth());
            System.out.printf("  Output dir : %s%n", out.toAbsolutePath());
            System.out.println("=".repeat(60));

            WebDriver webDriver = null;
            try {
                ActionDriver driver;
                if (mode.equals("webdriver")) {
                    webDriver = createRemoteDriver(remoteUrl, appId, target);
                    driver = new WebDriverActionDriver(webDriver, target);
                } else {
                    driver = createMaestroDriver(config, appId, target);
                }
                return explore(driver, config, target, out, screenshots);
            } finally {
                if (webDriver != null) {
                    try {
                        webDriver.quit();
                    } catch (Exception e) {
                        log.warn("Failed to close WebDriver session: {}", e.getMessage());
                    }
                }
            }
        }

        private int explore(ActionDriver driver, ExplorerConfig config, Platform target,
                            Path out, Path screenshots) {
            Explorer explorer = new Explorer(driver, config, appId, target, screenshots);
            CountDownLatch artifactsWritten = new CountDownLatch(1);
            RunInterrupter interrupter = new RunInterrupter(Thread.currentThread());

            // Ctrl+C: stop exploring, then wait until the partial artifacts are on disk
            Thread hook = new Thread(() -> {
                explorer.cancel();
                if (interrupter.interruptIfRunning()) {
                    log.debug("Interrupted exploration thread");
                }
                try {
                    if (!artifactsWritten.await(60, TimeUnit.SECONDS)) {
                        System.err.println("Timed out waiting for exploration artifacts to be written");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "explorer-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            try {
                ExplorationResult result;
                try {
                    result = explorer.run(config.getMaxDepth());
                } finally {
                    interrupter.finished();
                }
                GeneratedArtifacts artifacts = new ScriptGenerator().generate(result);
                ArtifactWriter.WrittenArtifacts written = new ArtifactWriter(out).write(artifacts, result);

                System.out.println();
                System.out.println("=".repeat(60));
                System.out.println(result.isCancelled() ? "Exploration interrupted" : "Exploration Complete!");
                System.out.println("=".repeat(60));
                System.out.printf("Time elapsed       : %.1fs%n", result.getElapsed().toMillis() / 1000.0);
                System.out.printf("Screens visited    : %d%n", result.getScreenStates().size());
                System.out.printf("Elements discovered: %d%n", result.getVisitedElements().size());
                System.out.printf("Flows recorded     : %d%n", result.getFlows().size());
                System.out.printf("Script             : %s%n", written.scriptFile().toAbsolutePath());
                System.out.printf("Report             : %s%n", written.reportFile().toAbsolutePath());
                System.out.printf("Screenshots        : %s%n", screenshots.toAbsolutePath());
                return 0;
            } finally {
                artifactsWritten.countDown();
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    log.debug("JVM shutting down; hook stays registered");
                }
            }
        }

        private static ActionDriver createMaestroDriver(ExplorerConfig config, String appId, Platform target) {
            CommandRunner runner = new CommandRunner();
            ScreenshotCapturer screenshots = ScreenshotCapturer.forPlatform(
                    target, config.getAdbPath(), config.getScreenshotTimeout(), runner);
            return new MaestroActionDriver(config.getMaestroPath(), appId,
                    config.getHierarchyTimeout(), config.getTapTimeout(), config.getBackTimeout(),
                    runner, screenshots);
        }

        /**
         * Opens an Appium session for an already-installed app. {@code noReset}
         * keeps the app state, so exploration starts from the current screen.
         */
        private static WebDriver createRemoteDriver(String url, String appId, Platform target)
                throws MalformedURLException {
            DesiredCapabilities caps = new DesiredCapabilities();
            if (target == Platform.IOS) {
                caps.setCapability("platformName", "iOS");
                caps.setCapability("appium:automationName", "XCUITest");
                caps.setCapability("appium:bundleId", appId);
            } else {
                caps.setCapability("platformName", "Android");
                caps.setCapability("appium:automationName", "UiAutomator2");
                caps.setCapability("appium:appPackage", appId);
            }
            caps.setCapability("appium:noReset", true);
            log.info("Opening WebDriver session at {} for {}", url, appId);
            return new RemoteWebDriver(URI.create(url).toURL(), caps);
        }
    }

    /**
     * Prints the counts recorded in a saved exploration report. The report is
     * validated against the report schema before it is read.
     */
    @Command(
            name        = "summary",
            description = "Print the counts of a saved exploration report",
            mixinStandardHelpOptions = true
    )
    static class SummaryCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to exploration_report_*.json")
        Path reportFile;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(reportFile)) {
                System.err.println("Report file not found: " + reportFile.toAbsolutePath());
                return 1;
            }
            ExplorationReport report = ExplorationIO.read(reportFile);
            System.out.printf("  App ID             : %s%n", report.getAppId());
            System.out.printf("  Platform           : %s%n", report.getPlatform());
            System.out.printf("  Timestamp          : %s%n", report.getTimestamp());
            System.out.printf("  Max depth          : %d%n", report.getMaxDepth());
            System.out.printf("  Total screens      : %d%n", report.getTotalScreens());
            System.out.printf("  Total interactions : %d%n", report.getTotalInteractions());
            System.out.printf("  Visited elements   : %d%n", report.getVisitedElements().size());
            System.out.printf("  Cancelled          : %b%n", report.isCancelled());
            System.out.printf("  Screenshots        : %s%n", report.getScreenshotsDir());
            return 0;
        }
    }

    @Command(name = "version", description = "Print version information")
    static class VersionCommand implements Callable<Integer> {
        @Override
        public Integer call() {
            System.out.println("AutoExplore 1.0.0-SNAPSHOT");
            return 0;
        }
    }
}
