package autoexplore.snapshot;

import autoexplore.model.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Flattens a {@link SnapshotNode} tree into the interactable {@link Element}s
 * it contains, in pre-order.
 *
 * <p>A {@link SnapshotNode.Tree} is interactable when its {@code clickable}
 * attribute is the text {@code "true"}. Paths are built from
 * {@code /child[i]} segments for tree children and {@code /item[i]} for
 * sequence items, so the root itself has the empty path.
 */
public class SnapshotParser {

    private static final Logger log = LoggerFactory.getLogger(SnapshotParser.class);

    static final String ATTR_CLICKABLE     = "clickable";
    static final String ATTR_TEXT          = "text";
    static final String ATTR_ACCESSIBILITY = "accessibilityText";
    static final String ATTR_RESOURCE_ID   = "resource-id";
    static final String ATTR_BOUNDS        = "bounds";
    static final String ATTR_CLASS         = "class";

    /**
     * @param root snapshot root, as returned by the action driver
     * @return clickable elements in the order first encountered
     * @throws SnapshotUnavailableException if {@code root} is {@code null}
     */
    public List<Element> parse(SnapshotNode root) throws SnapshotUnavailableException {
        if (root == null) {
            throw new SnapshotUnavailableException("No snapshot to parse");
        }
        List<Element> out = new ArrayList<>();
        traverse(root, "", out);
        log.debug("Parsed {} clickable element(s) from snapshot", out.size());
        return Collections.unmodifiableList(out);
    }

    private void traverse(SnapshotNode node, String path, List<Element> out) {
        switch (node.kind()) {
            case TREE -> {
                SnapshotNode.Tree tree = node.asTree();
                if ("true".equals(tree.attribute(ATTR_CLICKABLE))) {
                    out.add(new Element(
                            tree.attribute(ATTR_TEXT),
                            tree.attribute(ATTR_ACCESSIBILITY),
                            tree.attribute(ATTR_RESOURCE_ID),
                            tree.attribute(ATTR_BOUNDS),
                            tree.attribute(ATTR_CLASS),
                            path));
                }
                List<SnapshotNode> children = tree.children();
                for (int i = 0; i < children.size(); i++) {
                    traverse(children.get(i), path + "/child[" + i + "]", out);
                }
            }
            case SEQUENCE -> {
                List<SnapshotNode> items = node.asSequence().items();
                for (int i = 0; i < items.size(); i++) {
                    traverse(items.get(i), path + "/item[" + i + "]", out);
                }
            }
        }
    }
}
