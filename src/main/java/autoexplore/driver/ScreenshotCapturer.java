package autoexplore.driver;

import autoexplore.model.Platform;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Platform-specific screenshot mechanism used by command-line backends.
 * Android devices are captured through {@code adb}, iOS simulators through
 * {@code xcrun simctl}.
 */
public interface ScreenshotCapturer {

    ActionResult<Path> capture(Path target);

    static ScreenshotCapturer forPlatform(Platform platform, String adbPath,
                                          Duration timeout, CommandRunner runner) {
        return platform == Platform.IOS
                ? new SimctlScreenshotCapturer(timeout, runner)
                : new AdbScreenshotCapturer(adbPath, timeout, runner);
    }

    /** {@code adb exec-out screencap -p > target}. */
    final class AdbScreenshotCapturer implements ScreenshotCapturer {

        private final String        adbPath;
        private final Duration      timeout;
        private final CommandRunner runner;

        public AdbScreenshotCapturer(String adbPath, Duration timeout, CommandRunner runner) {
            this.adbPath = adbPath;
            this.timeout = timeout;
            this.runner  = runner;
        }

        @Override
        public ActionResult<Path> capture(Path target) {
            try {
                CommandRunner.CommandResult r = runner.runToFile(
                        List.of(adbPath, "exec-out", "screencap", "-p"), timeout, target);
                return toResult(r, target, "adb screencap");
            } catch (IOException e) {
                return ActionResult.failure(FailureKind.OBSERVATION_FAILED,
                        "Cannot run adb: " + e.getMessage());
            }
        }
    }

    /** {@code xcrun simctl io booted screenshot target}. */
    final class SimctlScreenshotCapturer implements ScreenshotCapturer {

        private final Duration      timeout;
        private final CommandRunner runner;

        public SimctlScreenshotCapturer(Duration timeout, CommandRunner runner) {
            this.timeout = timeout;
            this.runner  = runner;
        }

        @Override
        public ActionResult<Path> capture(Path target) {
            try {
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                CommandRunner.CommandResult r = runner.run(
                        List.of("xcrun", "simctl", "io", "booted", "screenshot", target.toString()), timeout);
                return toResult(r, target, "simctl screenshot");
            } catch (IOException e) {
                return ActionResult.failure(FailureKind.OBSERVATION_FAILED,
                        "Cannot run xcrun simctl: " + e.getMessage());
            }
        }
    }

    private static ActionResult<Path> toResult(CommandRunner.CommandResult r, Path target, String what) {
        if (r.timedOut()) {
            return ActionResult.failure(FailureKind.TIMEOUT, what + " timed out");
        }
        if (r.interrupted()) {
            return ActionResult.failure(FailureKind.INTERRUPTED, what + " interrupted");
        }
        if (r.exitCode() != 0) {
            return ActionResult.failure(FailureKind.OBSERVATION_FAILED,
                    what + " exited with code " + r.exitCode() + ": " + r.stderr().strip());
        }
        return ActionResult.success(target);
    }
}
