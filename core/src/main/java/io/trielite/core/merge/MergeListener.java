package io.trielite.core.merge;

import java.util.Objects;

/**
 * Receives the conflicts a merge resolved. Implementations must not throw;
 * the merge itself is pure and does not retry or escalate.
 */
@FunctionalInterface
public interface MergeListener {

    MergeListener NONE = conflict -> { };

    void onConflict(MergeConflict conflict);

    default MergeListener andThen(MergeListener next) {
        Objects.requireNonNull(next, "next");
        return conflict -> {
            onConflict(conflict);
            next.onConflict(conflict);
        };
    }
}
