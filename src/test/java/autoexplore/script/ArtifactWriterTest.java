package autoexplore.script;

import autoexplore.explorer.ExplorationException;
import autoexplore.explorer.ExplorationResult;
import autoexplore.model.ExplorationIO;
import autoexplore.model.ExplorationReport;
import autoexplore.model.Platform;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ArtifactWriterTest {

    private static final Instant FINISH = Instant.parse("2026-03-01T10:16:05Z");

    private static ExplorationResult emptyResult() {
        return new ExplorationResult("com.example.app", Platform.IOS, 2,
                FINISH.minusSeconds(5), FINISH, List.of(), List.of(), List.of(), null, false);
    }

    @Test
    public void writesScriptAndReportNamedAfterFinishTime() throws Exception {
        Path dir = Files.createTempDirectory("artifacts").resolve("nested");
        ExplorationResult result = emptyResult();
        GeneratedArtifacts artifacts = new ScriptGenerator().generate(result);

        ArtifactWriter.WrittenArtifacts written = new ArtifactWriter(dir).write(artifacts, result);

        assertThat(written.scriptFile().getFileName().toString())
                .isEqualTo("generated_exploration_test_20260301_101605.yaml");
        assertThat(written.reportFile().getFileName().toString())
                .isEqualTo("exploration_report_20260301_101605.json");
        assertThat(Files.readString(written.scriptFile())).isEqualTo(artifacts.script());

        ExplorationReport reread = ExplorationIO.read(written.reportFile());
        assertThat(reread.getAppId()).isEqualTo("com.example.app");
        assertThat(reread.getPlatform()).isEqualTo("ios");
        assertThat(reread.getScreenshotsDir()).isNull();
    }

    @Test
    public void unwritableDirectory_throwsExplorationException() throws Exception {
        Path file = Files.createTempFile("not-a-dir", ".txt");
        ExplorationResult result = emptyResult();
        GeneratedArtifacts artifacts = new ScriptGenerator().generate(result);

        assertThatThrownBy(() -> new ArtifactWriter(file).write(artifacts, result))
                .isInstanceOf(ExplorationException.class)
                .hasMessageContaining(file.toString());
    }
}
