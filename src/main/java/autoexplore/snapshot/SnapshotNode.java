package autoexplore.snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a backend UI-tree snapshot.
 *
 * <p>Backends report nodes either as an attribute map with children
 * ({@link Tree}) or as a bare list of nodes ({@link Sequence}), nested in any
 * combination. Consumers dispatch on {@link #kind()}.
 */
public abstract class SnapshotNode {

    public enum Kind { TREE, SEQUENCE }

    private SnapshotNode() {}

    public abstract Kind kind();

    public Tree asTree() {
        throw new IllegalStateException("Not a TREE node: " + kind());
    }

    public Sequence asSequence() {
        throw new IllegalStateException("Not a SEQUENCE node: " + kind());
    }

    public static Tree tree(Map<String, String> attributes, List<SnapshotNode> children) {
        return new Tree(attributes, children);
    }

    public static Sequence sequence(List<SnapshotNode> items) {
        return new Sequence(items);
    }

    // ── Variants ──────────────────────────────────────────────────────────

    /** Map-shaped node: textual attributes plus ordered children. */
    public static final class Tree extends SnapshotNode {

        private final Map<String, String> attributes;
        private final List<SnapshotNode>  children;

        private Tree(Map<String, String> attributes, List<SnapshotNode> children) {
            this.attributes = attributes == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            this.children = children == null
                    ? Collections.emptyList()
                    : Collections.unmodifiableList(new ArrayList<>(children));
        }

        @Override public Kind kind()    { return Kind.TREE; }
        @Override public Tree asTree()  { return this; }

        public Map<String, String> attributes() { return attributes; }
        public List<SnapshotNode>  children()   { return children; }

        /** Attribute value, or the empty string when absent. */
        public String attribute(String name) {
            String v = attributes.get(name);
            return v == null ? "" : v;
        }

        @Override
        public String toString() {
            return "Tree" + attributes + "(" + children.size() + " children)";
        }
    }

    /** List-shaped node: ordered items without attributes of its own. */
    public static final class Sequence extends SnapshotNode {

        private final List<SnapshotNode> items;

        private Sequence(List<SnapshotNode> items) {
            this.items = items == null
                    ? Collections.emptyList()
                    : Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override public Kind     kind()       { return Kind.SEQUENCE; }
        @Override public Sequence asSequence() { return this; }

        public List<SnapshotNode> items() { return items; }

        @Override
        public String toString() {
            return "Sequence(" + items.size() + " items)";
        }
    }
}
