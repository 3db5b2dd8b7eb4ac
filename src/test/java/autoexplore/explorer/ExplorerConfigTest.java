package autoexplore.explorer;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

public class ExplorerConfigTest {

    private static ExplorerConfig config(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            p.setProperty(kv[i], kv[i + 1]);
        }
        return new ExplorerConfig(p);
    }

    @Test
    public void emptyProperties_yieldDefaults() {
        ExplorerConfig c = config();

        assertThat(c.getMaxDepth()).isEqualTo(3);
        assertThat(c.getSettleMs()).isEqualTo(2000L);
        assertThat(c.getBackSettleMs()).isEqualTo(1000L);
        assertThat(c.getOutputDir()).isEqualTo("exploration");
        assertThat(c.getHierarchyTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(c.getTapTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(c.getBackTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(c.getScreenshotTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(c.getAdbPath()).isEqualTo("adb");
    }

    @Test
    public void explicitValues_override() {
        ExplorerConfig c = config(
                "explorer.max.depth", "5",
                "explorer.settle.ms", " 250 ",
                "explorer.output.dir", "runs",
                "explorer.timeout.tap.sec", "7",
                "maestro.path", "/usr/local/bin/maestro");

        assertThat(c.getMaxDepth()).isEqualTo(5);
        assertThat(c.getSettleMs()).isEqualTo(250L);
        assertThat(c.getOutputDir()).isEqualTo("runs");
        assertThat(c.getTapTimeout()).isEqualTo(Duration.ofSeconds(7));
        assertThat(c.getMaestroPath()).isEqualTo("/usr/local/bin/maestro");
    }

    @Test
    public void invalidNumbers_fallBackToDefaults() {
        ExplorerConfig c = config("explorer.max.depth", "deep", "explorer.back.settle.ms", "soon");

        assertThat(c.getMaxDepth()).isEqualTo(3);
        assertThat(c.getBackSettleMs()).isEqualTo(1000L);
    }

    @Test
    public void negativeDepth_fallsBackToDefault() {
        assertThat(config("explorer.max.depth", "-2").getMaxDepth()).isEqualTo(3);
    }

    @Test
    public void zeroDepth_isAllowed() {
        assertThat(config("explorer.max.depth", "0").getMaxDepth()).isZero();
    }

    @Test
    public void tildeIsExpandedToHome() {
        String home = System.getProperty("user.home");

        assertThat(config().getMaestroPath()).isEqualTo(home + "/.maestro/bin/maestro");
        assertThat(config("adb.path", "~/sdk/adb").getAdbPath()).isEqualTo(home + "/sdk/adb");
    }

    @Test
    public void setters_overrideLoadedValues() {
        ExplorerConfig c = config("explorer.max.depth", "5");
        c.setMaxDepth(1);
        c.setOutputDir("elsewhere");

        assertThat(c.getMaxDepth()).isEqualTo(1);
        assertThat(c.getOutputDir()).isEqualTo("elsewhere");
    }

    @Test
    public void classpathConstructor_loadsBundledConfig() {
        ExplorerConfig c = new ExplorerConfig();

        assertThat(c.getMaxDepth()).isEqualTo(3);
        assertThat(c.getSettleMs()).isEqualTo(2000L);
    }
}
