package autoexplore.explorer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Reads explorer settings from {@code config.properties} (classpath) and
 * exposes typed accessor methods with sensible defaults.
 *
 * <p>An optional {@code config.local.properties} file on the classpath
 * overrides any value from the base file.
 *
 * <h3>Supported keys and defaults</h3>
 * <table>
 *   <tr><th>Key</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>explorer.max.depth</td><td>3</td><td>Maximum traversal depth</td></tr>
 *   <tr><td>explorer.settle.ms</td><td>2000</td><td>Blocking wait after a successful tap</td></tr>
 *   <tr><td>explorer.back.settle.ms</td><td>1000</td><td>Blocking wait after navigating back</td></tr>
 *   <tr><td>explorer.output.dir</td><td>exploration</td><td>Directory for scripts, reports and screenshots</td></tr>
 *   <tr><td>explorer.timeout.hierarchy.sec</td><td>30</td><td>Snapshot capture timeout</td></tr>
 *   <tr><td>explorer.timeout.tap.sec</td><td>15</td><td>Activation timeout</td></tr>
 *   <tr><td>explorer.timeout.back.sec</td><td>10</td><td>Back navigation timeout</td></tr>
 *   <tr><td>explorer.timeout.screenshot.sec</td><td>5</td><td>Screenshot timeout</td></tr>
 *   <tr><td>maestro.path</td><td>~/.maestro/bin/maestro</td><td>Maestro CLI executable</td></tr>
 *   <tr><td>adb.path</td><td>adb</td><td>adb executable used for Android screenshots</td></tr>
 * </table>
 */
public class ExplorerConfig {

    private static final Logger log = LoggerFactory.getLogger(ExplorerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    private static final String KEY_MAX_DEPTH          = "explorer.max.depth";
    private static final String KEY_SETTLE_MS          = "explorer.settle.ms";
    private static final String KEY_BACK_SETTLE_MS     = "explorer.back.settle.ms";
    private static final String KEY_OUTPUT_DIR         = "explorer.output.dir";
    private static final String KEY_HIERARCHY_TIMEOUT  = "explorer.timeout.hierarchy.sec";
    private static final String KEY_TAP_TIMEOUT        = "explorer.timeout.tap.sec";
    private static final String KEY_BACK_TIMEOUT       = "explorer.timeout.back.sec";
    private static final String KEY_SCREENSHOT_TIMEOUT = "explorer.timeout.screenshot.sec";
    private static final String KEY_MAESTRO_PATH       = "maestro.path";
    private static final String KEY_ADB_PATH           = "adb.path";

    // Defaults
    private static final int    DEFAULT_MAX_DEPTH          = 3;
    private static final long   DEFAULT_SETTLE_MS          = 2000L;
    private static final long   DEFAULT_BACK_SETTLE_MS     = 1000L;
    private static final String DEFAULT_OUTPUT_DIR         = "exploration";
    private static final int    DEFAULT_HIERARCHY_TIMEOUT  = 30;
    private static final int    DEFAULT_TAP_TIMEOUT        = 15;
    private static final int    DEFAULT_BACK_TIMEOUT       = 10;
    private static final int    DEFAULT_SCREENSHOT_TIMEOUT = 5;
    private static final String DEFAULT_MAESTRO_PATH       = "~/.maestro/bin/maestro";
    private static final String DEFAULT_ADB_PATH           = "adb";

    private final Properties props;

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Loads configuration from the classpath. A missing base file is tolerated
     * and all defaults apply.
     */
    public ExplorerConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /**
     * Package-private constructor for tests — accepts a pre-populated
     * {@link Properties} instance, bypassing classpath I/O.
     */
    ExplorerConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    /** Maximum traversal depth (default: 3). Negative values fall back to the default. */
    public int getMaxDepth() {
        int depth = getInt(KEY_MAX_DEPTH, DEFAULT_MAX_DEPTH);
        if (depth < 0) {
            log.warn("Negative {} '{}' — using default {}", KEY_MAX_DEPTH, depth, DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
        return depth;
    }

    public void setMaxDepth(int depth) {
        props.setProperty(KEY_MAX_DEPTH, String.valueOf(depth));
    }

    /** Wait after a successful activation, in milliseconds (default: 2000). */
    public long getSettleMs() {
        return getLong(KEY_SETTLE_MS, DEFAULT_SETTLE_MS);
    }

    /** Wait after navigating back, in milliseconds (default: 1000). */
    public long getBackSettleMs() {
        return getLong(KEY_BACK_SETTLE_MS, DEFAULT_BACK_SETTLE_MS);
    }

    /** Output directory for all artifacts (default: "exploration"). */
    public String getOutputDir() {
        return props.getProperty(KEY_OUTPUT_DIR, DEFAULT_OUTPUT_DIR).trim();
    }

    public void setOutputDir(String dir) {
        props.setProperty(KEY_OUTPUT_DIR, dir);
    }

    public Duration getHierarchyTimeout() {
        return Duration.ofSeconds(getInt(KEY_HIERARCHY_TIMEOUT, DEFAULT_HIERARCHY_TIMEOUT));
    }

    public Duration getTapTimeout() {
        return Duration.ofSeconds(getInt(KEY_TAP_TIMEOUT, DEFAULT_TAP_TIMEOUT));
    }

    public Duration getBackTimeout() {
        return Duration.ofSeconds(getInt(KEY_BACK_TIMEOUT, DEFAULT_BACK_TIMEOUT));
    }

    public Duration getScreenshotTimeout() {
        return Duration.ofSeconds(getInt(KEY_SCREENSHOT_TIMEOUT, DEFAULT_SCREENSHOT_TIMEOUT));
    }

    /** Maestro executable, with a leading {@code ~} expanded to the user's home. */
    public String getMaestroPath() {
        return expandHome(props.getProperty(KEY_MAESTRO_PATH, DEFAULT_MAESTRO_PATH).trim());
    }

    public String getAdbPath() {
        return expandHome(props.getProperty(KEY_ADB_PATH, DEFAULT_ADB_PATH).trim());
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                log.warn("Classpath resource not found: {} — all explorer settings use defaults",
                        CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded explorer base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new ExplorationException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {} — using base config only: {}",
                    CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}' — using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}' — using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }
}
