package autoexplore.explorer;

import autoexplore.model.ElementIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Identities already attempted in the current run. Grows monotonically and is
 * global across screens: an identity marked on one screen is skipped on all
 * others. Insertion order is kept for reporting.
 */
public final class Frontier {

    private final Set<ElementIdentity> visited = new LinkedHashSet<>();

    public boolean contains(ElementIdentity identity) {
        return visited.contains(identity);
    }

    /**
     * Marks {@code identity} as attempted.
     *
     * @return {@code true} if it was not already present
     */
    public boolean markVisited(ElementIdentity identity) {
        return visited.add(identity);
    }

    public int size() {
        return visited.size();
    }

    /** Copy of the contents in insertion order. */
    public List<ElementIdentity> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(visited));
    }
}
