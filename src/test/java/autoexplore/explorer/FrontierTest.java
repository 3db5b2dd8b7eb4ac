package autoexplore.explorer;

import autoexplore.model.Element;
import autoexplore.model.ElementIdentity;
import autoexplore.model.FlowRecord;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FrontierTest {

    @Test
    public void markVisited_reportsFirstInsertionOnly() {
        Frontier f = new Frontier();

        assertThat(f.markVisited(ElementIdentity.of("text:A"))).isTrue();
        assertThat(f.markVisited(ElementIdentity.of("text:A"))).isFalse();
        assertThat(f.contains(ElementIdentity.of("text:A"))).isTrue();
        assertThat(f.size()).isEqualTo(1);
    }

    @Test
    public void snapshot_keepsInsertionOrderAndIsDetached() {
        Frontier f = new Frontier();
        f.markVisited(ElementIdentity.of("text:B"));
        f.markVisited(ElementIdentity.of("id:a"));

        List<ElementIdentity> snapshot = f.snapshot();
        f.markVisited(ElementIdentity.of("text:C"));

        assertThat(snapshot).extracting(ElementIdentity::value).containsExactly("text:B", "id:a");
        assertThatThrownBy(() -> snapshot.add(ElementIdentity.of("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void flowRecorder_keepsOrder() {
        FlowRecorder recorder = new FlowRecorder();
        Element e = new Element("A", "", "", "", "", "");
        recorder.record("s1", "s2", ElementIdentity.of("text:A"), 0, e);
        recorder.record("s2", "s3", ElementIdentity.of("text:B"), 1, e);

        assertThat(recorder.size()).isEqualTo(2);
        assertThat(recorder.records()).extracting(FlowRecord::getToScreen).containsExactly("s2", "s3");
    }
}
