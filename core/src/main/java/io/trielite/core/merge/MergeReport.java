package io.trielite.core.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * Listener that keeps every conflict it sees, for callers that need an audit trail.
 * Not thread safe; use one report per merge.
 */
public final class MergeReport implements MergeListener {

    private final List<MergeConflict> conflicts = new ArrayList<>();

    @Override
    public void onConflict(MergeConflict conflict) {
        conflicts.add(conflict);
    }

    public List<MergeConflict> conflicts() {
        return List.copyOf(conflicts);
    }

    public List<MergeConflict> conflicts(MergeConflict.Kind kind) {
        return conflicts.stream().filter(c -> c.kind() == kind).toList();
    }

    public boolean isClean() {
        return conflicts.isEmpty();
    }
}
