package autoexplore.script;

import autoexplore.explorer.ExplorationException;
import autoexplore.explorer.ExplorationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Writes generated artifacts to disk:
 * <pre>
 * {outputDir}/generated_exploration_test_{ts}.yaml
 * {outputDir}/exploration_report_{ts}.json
 * </pre>
 * where {@code ts} is the run's finish time ({@code yyyyMMdd_HHmmss}, UTC).
 */
public class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    static final DateTimeFormatter FILE_TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.of("UTC"));

    /** Paths of the files written by {@link #write}. */
    public record WrittenArtifacts(Path scriptFile, Path reportFile) {}

    private final Path outputDir;

    public ArtifactWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * @throws ExplorationException if the directory or either file cannot be written
     */
    public WrittenArtifacts write(GeneratedArtifacts artifacts, ExplorationResult result) {
        String ts = FILE_TS_FMT.format(result.getFinishedAt());
        Path script = outputDir.resolve("generated_exploration_test_" + ts + ".yaml");
        Path report = outputDir.resolve("exploration_report_" + ts + ".json");
        try {
            Files.createDirectories(outputDir);
            Files.writeString(script, artifacts.script(), StandardCharsets.UTF_8);
            log.info("Generated: {}", script);
            Files.writeString(report, artifacts.reportJson(), StandardCharsets.UTF_8);
            log.info("Generated: {}", report);
        } catch (IOException e) {
            throw new ExplorationException("Cannot write exploration artifacts to " + outputDir, e);
        }
        return new WrittenArtifacts(script, report);
    }
}
