package autoexplore.snapshot;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SnapshotDecoderTest {

    private final SnapshotDecoder decoder = new SnapshotDecoder();

    private static final String HIERARCHY = String.join("\n",
            "{",
            "  \"attributes\": {\"resource-id\": \"root\"},",
            "  \"children\": [",
            "    {\"attributes\": {\"text\": \"Settings\", \"clickable\": \"true\", \"bounds\": \"[0,0][10,10]\"},",
            "     \"children\": []},",
            "    {\"attributes\": {\"text\": \"Off\", \"clickable\": false}}",
            "  ]",
            "}");

    @Test
    public void decodesAttributesAndChildren() throws Exception {
        SnapshotNode.Tree root = decoder.decode(HIERARCHY).asTree();

        assertThat(root.attribute("resource-id")).isEqualTo("root");
        assertThat(root.children()).hasSize(2);
        SnapshotNode.Tree first = root.children().get(0).asTree();
        assertThat(first.attribute("text")).isEqualTo("Settings");
        assertThat(first.attribute("clickable")).isEqualTo("true");
    }

    @Test
    public void nonStringAttributeValues_areRenderedAsText() throws Exception {
        SnapshotNode.Tree off = decoder.decode(HIERARCHY).asTree().children().get(1).asTree();

        assertThat(off.attribute("clickable")).isEqualTo("false");
        assertThat(off.children()).isEmpty();
    }

    @Test
    public void bannerLinesBeforeJson_areSkipped() throws Exception {
        String output = "Running on emulator-5554\nConnecting...\n" + HIERARCHY;

        SnapshotNode root = decoder.decode(output);

        assertThat(root.kind()).isEqualTo(SnapshotNode.Kind.TREE);
        assertThat(root.asTree().children()).hasSize(2);
    }

    @Test
    public void bracketedLogPrefix_isTreatedAsBanner() throws Exception {
        String output = "[INFO] Connecting to device\n[main] hierarchy follows\n" + HIERARCHY;

        SnapshotNode root = decoder.decode(output);

        assertThat(root.kind()).isEqualTo(SnapshotNode.Kind.TREE);
        assertThat(root.asTree().attribute("resource-id")).isEqualTo("root");
        assertThat(root.asTree().children()).hasSize(2);
    }

    @Test
    public void prettyPrintedTopLevelArray_afterBanner_isDecoded() throws Exception {
        String output = String.join("\n",
                "[WARN] slow device",
                "[",
                "  {\"attributes\": {\"text\": \"a\"}},",
                "  {\"attributes\": {\"text\": \"b\"}}",
                "]");

        SnapshotNode root = decoder.decode(output);

        assertThat(root.kind()).isEqualTo(SnapshotNode.Kind.SEQUENCE);
        assertThat(root.asSequence().items()).hasSize(2);
    }

    @Test
    public void onlyBracketedLogLines_throwNoJson() {
        assertThatThrownBy(() -> decoder.decode("[ERROR] device offline\n[1] retrying"))
                .isInstanceOf(SnapshotUnavailableException.class)
                .hasMessageContaining("No JSON");
    }

    @Test
    public void topLevelArray_becomesSequence() throws Exception {
        SnapshotNode root = decoder.decode("[{\"attributes\":{\"text\":\"a\"}}, 42, \"x\"]");

        assertThat(root.kind()).isEqualTo(SnapshotNode.Kind.SEQUENCE);
        assertThat(root.asSequence().items()).hasSize(1);
    }

    @Test
    public void blankOutput_throws() {
        assertThatThrownBy(() -> decoder.decode("   \n"))
                .isInstanceOf(SnapshotUnavailableException.class);
    }

    @Test
    public void outputWithoutJson_throws() {
        assertThatThrownBy(() -> decoder.decode("Error: device offline"))
                .isInstanceOf(SnapshotUnavailableException.class)
                .hasMessageContaining("No JSON");
    }

    @Test
    public void truncatedJson_throws() {
        assertThatThrownBy(() -> decoder.decode("{\"attributes\": {\"text\": "))
                .isInstanceOf(SnapshotUnavailableException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    public void treeAccessorOnSequence_throws() throws Exception {
        SnapshotNode seq = decoder.decode("[]");

        assertThatThrownBy(seq::asTree).isInstanceOf(IllegalStateException.class);
    }
}
