package autoexplore.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands (Maestro, adb, simctl) with a hard timeout.
 *
 * <p>Output is redirected to temporary files rather than pipes so large
 * hierarchy dumps cannot block the child process. A command that outlives its
 * timeout is destroyed forcibly.
 */
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    /** Outcome of one command invocation. */
    public record CommandResult(int exitCode, String stdout, String stderr,
                                boolean timedOut, boolean interrupted) {

        public boolean isSuccess() {
            return !timedOut && !interrupted && exitCode == 0;
        }
    }

    /**
     * Runs {@code command} and captures stdout and stderr as text.
     *
     * @throws IOException if the process cannot be started (e.g. executable missing)
     */
    public CommandResult run(List<String> command, Duration timeout) throws IOException {
        Path out = Files.createTempFile("autoexplore-out-", ".txt");
        try {
            return execute(command, timeout, out, true);
        } finally {
            Files.deleteIfExists(out);
        }
    }

    /**
     * Runs {@code command} with stdout written to {@code stdoutFile} (binary-safe,
     * e.g. {@code adb exec-out screencap -p}). {@link CommandResult#stdout()} is empty.
     *
     * @throws IOException if the process cannot be started
     */
    public CommandResult runToFile(List<String> command, Duration timeout, Path stdoutFile) throws IOException {
        if (stdoutFile.getParent() != null) {
            Files.createDirectories(stdoutFile.getParent());
        }
        return execute(command, timeout, stdoutFile, false);
    }

    private CommandResult execute(List<String> command, Duration timeout, Path stdoutFile,
                                  boolean captureStdout) throws IOException {
        Path err = Files.createTempFile("autoexplore-err-", ".txt");
        try {
            log.debug("Running {} (timeout {} ms)", command, timeout.toMillis());
            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(err.toFile())
                    .redirectInput(ProcessBuilder.Redirect.from(new File(nullDevice())));
            Process process = pb.start();

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                log.warn("Interrupted while waiting for {}", command.get(0));
                return new CommandResult(-1, "", "", false, true);
            }
            if (!finished) {
                process.destroyForcibly();
                log.warn("{} timed out after {} ms", command.get(0), timeout.toMillis());
                return new CommandResult(-1, "", readQuietly(err), true, false);
            }

            int exit = process.exitValue();
            String stdout = captureStdout ? readQuietly(stdoutFile) : "";
            String stderr = readQuietly(err);
            if (exit != 0) {
                log.debug("{} exited with code {}: {}", command.get(0), exit, stderr.strip());
            }
            return new CommandResult(exit, stdout, stderr, false, false);
        } finally {
            Files.deleteIfExists(err);
        }
    }

    private static String readQuietly(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read command output {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static String nullDevice() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("windows") ? "NUL" : "/dev/null";
    }
}
