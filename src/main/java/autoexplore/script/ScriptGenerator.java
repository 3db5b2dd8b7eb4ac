package autoexplore.script;

import autoexplore.driver.Locator;
import autoexplore.driver.MaestroSteps;
import autoexplore.explorer.ExplorationException;
import autoexplore.explorer.ExplorationResult;
import autoexplore.model.ExplorationIO;
import autoexplore.model.ExplorationReport;
import autoexplore.model.FlowRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects an {@link ExplorationResult} into a replayable Maestro flow and a
 * machine-readable {@link ExplorationReport}.
 *
 * <p>Flows are grouped by origin screen in first-seen order; each record
 * becomes tap, settle, screenshot, back, settle. Output depends only on the
 * result (the header timestamp is the run's finish time), so generating twice
 * from the same result yields identical text.
 */
public class ScriptGenerator {

    private static final Logger log = LoggerFactory.getLogger(ScriptGenerator.class);

    static final String START_SCREENSHOT = "exploration_start";

    private static final DateTimeFormatter HEADER_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.of("UTC"));

    public GeneratedArtifacts generate(ExplorationResult result) {
        String script = buildScript(result);
        ExplorationReport report = buildReport(result);
        String json;
        try {
            json = ExplorationIO.toJson(report);
        } catch (IOException e) {
            throw new ExplorationException("Cannot serialize exploration report", e);
        }
        log.debug("Generated script ({} chars) and report for {} flow(s)",
                script.length(), result.getFlows().size());
        return new GeneratedArtifacts(script, report, json);
    }

    // ── Script ────────────────────────────────────────────────────────────

    String buildScript(ExplorationResult result) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append(MaestroSteps.header(result.getAppId()));
        sb.append("# Auto-generated UI Exploration Tests\n");
        sb.append("# Generated: ").append(HEADER_FMT.format(result.getFinishedAt())).append(" UTC\n");
        sb.append("# Total screens explored: ").append(result.getScreenStates().size()).append('\n');
        sb.append("# Total interactions discovered: ").append(result.getFlows().size()).append('\n');
        if (result.isCancelled()) {
            sb.append("# NOTE: exploration was cancelled; flows are partial\n");
        }
        sb.append('\n');
        sb.append(MaestroSteps.WAIT_FOR_ANIMATION).append('\n');
        sb.append(MaestroSteps.takeScreenshot(START_SCREENSHOT)).append('\n');
        sb.append('\n');

        for (Map.Entry<String, List<FlowRecord>> group : groupByOrigin(result.getFlows()).entrySet()) {
            List<FlowRecord> flows = group.getValue();
            sb.append("\n# Screen: ").append(comment(group.getKey())).append('\n');
            sb.append("# Discovered ").append(flows.size()).append(" interactions\n\n");

            for (FlowRecord flow : flows) {
                sb.append("# Test: ").append(comment(flow.getAction().value())).append('\n');
                sb.append(MaestroSteps.tapOn(Locator.forElement(flow.getElement()))).append('\n');
                sb.append(MaestroSteps.WAIT_FOR_ANIMATION).append('\n');
                sb.append(MaestroSteps.takeScreenshot(flow.getToScreen())).append('\n');
                sb.append(MaestroSteps.BACK).append('\n');
                sb.append(MaestroSteps.WAIT_FOR_ANIMATION).append("\n\n");
            }
        }
        return sb.toString();
    }

    private static Map<String, List<FlowRecord>> groupByOrigin(List<FlowRecord> flows) {
        Map<String, List<FlowRecord>> groups = new LinkedHashMap<>();
        for (FlowRecord f : flows) {
            groups.computeIfAbsent(f.getFromScreen(), k -> new ArrayList<>()).add(f);
        }
        return groups;
    }

    /** Keeps YAML comments on one line. */
    private static String comment(String text) {
        return text == null ? "" : text.replaceAll("\\R", " ");
    }

    // ── Report ────────────────────────────────────────────────────────────

    ExplorationReport buildReport(ExplorationResult result) {
        ExplorationReport report = new ExplorationReport();
        report.setTimestamp(result.getFinishedAt());
        report.setAppId(result.getAppId());
        report.setPlatform(result.getPlatform().wireName());
        report.setMaxDepth(result.getMaxDepth());
        report.setCancelled(result.isCancelled());
        report.setElapsedMillis(result.getElapsed().toMillis());
        report.setTotalScreens(result.getScreenStates().size());
        report.setTotalInteractions(result.getFlows().size());
        report.setVisitedElements(result.getVisitedElements());
        report.setFlows(result.getFlows());
        if (result.getScreenshotsDir() != null) {
            report.setScreenshotsDir(result.getScreenshotsDir().toString());
        }
        return report;
    }
}
