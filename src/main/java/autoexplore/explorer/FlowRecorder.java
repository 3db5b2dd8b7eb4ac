package autoexplore.explorer;

import autoexplore.model.Element;
import autoexplore.model.ElementIdentity;
import autoexplore.model.FlowRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Append-only log of observed transitions, in the order they happened. */
public final class FlowRecorder {

    private final List<FlowRecord> records = new ArrayList<>();

    public FlowRecord record(String fromScreen, String toScreen, ElementIdentity action,
                             int depth, Element element) {
        FlowRecord r = new FlowRecord(fromScreen, toScreen, action, depth, element);
        records.add(r);
        return r;
    }

    public int size() {
        return records.size();
    }

    /** Copy of the log in recorded order. */
    public List<FlowRecord> records() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }
}
