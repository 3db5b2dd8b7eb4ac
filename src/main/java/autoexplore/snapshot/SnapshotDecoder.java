package autoexplore.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decodes the textual output of a hierarchy dump (e.g. {@code maestro hierarchy})
 * into a {@link SnapshotNode} tree.
 *
 * <p>CLI backends print banner lines such as {@code Running on emulator-5554}
 * before the JSON document; decoding starts at the first line whose trimmed
 * text opens a JSON object or array. A line counts as an array opening only
 * when the bracket is followed by another JSON value or ends the line, so log
 * prefixes like {@code [INFO]} are skipped as banner text.
 */
public class SnapshotDecoder {

    private static final Logger log = LoggerFactory.getLogger(SnapshotDecoder.class);

    private static final String ATTRIBUTES = "attributes";
    private static final String CHILDREN   = "children";

    private static final Pattern JSON_START = Pattern.compile("^(\\{|\\[\\s*([\\[{\"\\]]|$))");

    private final ObjectMapper mapper;

    public SnapshotDecoder() {
        this(new ObjectMapper());
    }

    public SnapshotDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param backendOutput raw stdout of the hierarchy command
     * @return root node of the snapshot
     * @throws SnapshotUnavailableException if the output is blank, has no JSON
     *                                      start marker, or is not valid JSON
     */
    public SnapshotNode decode(String backendOutput) throws SnapshotUnavailableException {
        if (backendOutput == null || backendOutput.isBlank()) {
            throw new SnapshotUnavailableException("Backend returned no hierarchy output");
        }
        String json = stripBanner(backendOutput);
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SnapshotUnavailableException("Hierarchy output is not valid JSON: "
                    + e.getOriginalMessage(), e);
        }
        SnapshotNode node = toNode(root);
        if (node == null) {
            throw new SnapshotUnavailableException("Hierarchy root is not an object or array");
        }
        return node;
    }

    /**
     * Converts a Jackson tree into snapshot nodes. Objects become
     * {@link SnapshotNode.Tree}, arrays become {@link SnapshotNode.Sequence};
     * scalars return {@code null} and are dropped by the caller.
     */
    SnapshotNode toNode(JsonNode json) {
        if (json == null) return null;
        if (json.isObject()) {
            Map<String, String> attrs = new LinkedHashMap<>();
            JsonNode attrNode = json.get(ATTRIBUTES);
            if (attrNode != null && attrNode.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = attrNode.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    attrs.put(e.getKey(), e.getValue().isNull() ? "" : e.getValue().asText());
                }
            }
            List<SnapshotNode> children = new ArrayList<>();
            JsonNode childNode = json.get(CHILDREN);
            if (childNode != null && childNode.isArray()) {
                for (JsonNode c : childNode) {
                    SnapshotNode n = toNode(c);
                    if (n != null) children.add(n);
                }
            }
            return SnapshotNode.tree(attrs, children);
        }
        if (json.isArray()) {
            List<SnapshotNode> items = new ArrayList<>();
            for (JsonNode c : json) {
                SnapshotNode n = toNode(c);
                if (n != null) items.add(n);
            }
            return SnapshotNode.sequence(items);
        }
        return null;
    }

    private static String stripBanner(String output) throws SnapshotUnavailableException {
        String[] lines = output.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String trimmed = lines[i].strip();
            if (JSON_START.matcher(trimmed).find()) {
                if (i > 0) {
                    log.debug("Skipped {} banner line(s) before hierarchy JSON", i);
                }
                return String.join("\n", Arrays.copyOfRange(lines, i, lines.length));
            }
        }
        throw new SnapshotUnavailableException("No JSON content found in hierarchy output");
    }
}
