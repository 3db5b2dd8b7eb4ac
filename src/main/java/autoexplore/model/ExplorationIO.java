package autoexplore.model;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes {@link ExplorationReport} objects to/from JSON.
 *
 * <p>On read: validates the JSON against {@code exploration-report-schema.json}
 * before deserializing. On write: pretty-printed, with a trailing newline, in a
 * fixed property order so identical reports serialize to identical bytes.
 */
public class ExplorationIO {

    private static final Logger log = LoggerFactory.getLogger(ExplorationIO.class);
    private static final String SCHEMA_RESOURCE = "/exploration-report-schema.json";

    /** Singleton ObjectMapper — thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    /** Pretty printer pinned to {@code \n} regardless of platform. */
    private static final ObjectWriter WRITER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        WRITER = MAPPER.writer(new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter("  ", "\n")));
    }

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private ExplorationIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a report from a JSON file, validating it against the schema first.
     *
     * @throws IOException               if the file cannot be read or parsed
     * @throws SchemaValidationException if the document does not match the schema
     */
    public static ExplorationReport read(Path path) throws IOException {
        log.debug("Reading exploration report from: {}", path);
        String json = Files.readString(path, StandardCharsets.UTF_8);
        validateSchema(json, path.toString());
        ExplorationReport report = MAPPER.readValue(json, ExplorationReport.class);
        log.info("Loaded report for '{}' ({} screens, {} interactions) from {}",
                report.getAppId(), report.getTotalScreens(), report.getTotalInteractions(), path);
        return report;
    }

    /** Writes a report to a JSON file (parent directories are created). */
    public static void write(ExplorationReport report, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.writeString(path, toJson(report), StandardCharsets.UTF_8);
        log.info("Wrote exploration report ({} interactions) to {}", report.getTotalInteractions(), path);
    }

    /** Serializes a report to a pretty-printed JSON string ending with {@code \n}. */
    public static String toJson(ExplorationReport report) throws IOException {
        return WRITER.writeValueAsString(report) + "\n";
    }

    /** Deserializes a report from a JSON string (no schema validation). */
    public static ExplorationReport fromJson(String json) throws IOException {
        return MAPPER.readValue(json, ExplorationReport.class);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(String json, String source) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("exploration-report-schema.json not found on classpath — skipping schema validation");
            return;
        }
        try {
            Set<ValidationMessage> errors = schema.validate(MAPPER.readTree(json));
            if (!errors.isEmpty()) {
                StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
                errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
                throw new SchemaValidationException(sb.toString());
            }
        } catch (IOException e) {
            log.warn("Could not parse JSON for schema validation: {}", e.getMessage());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (ExplorationIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = ExplorationIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
