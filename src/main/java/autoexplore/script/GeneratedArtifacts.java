package autoexplore.script;

import autoexplore.model.ExplorationReport;

/**
 * In-memory output of {@link ScriptGenerator}: the Maestro flow text, the
 * report document and its serialized JSON.
 */
public record GeneratedArtifacts(String script, ExplorationReport report, String reportJson) {}
