package io.trielite.core.merge;

import java.util.Objects;

/**
 * Knobs of the merge engine.
 *
 * Supports:
 *  - valuePolicy: who wins when two unversioned leaves disagree
 *  - listener:    where resolved conflicts are reported
 *
 * Concurrent versioned leaves need no knob: both versions are kept as
 * siblings and collapsed only when read (see {@code ConflictResolver}).
 */
public record MergeConfig(
        ValueConflictPolicy valuePolicy,
        MergeListener listener
) {

    public MergeConfig {
        Objects.requireNonNull(valuePolicy, "valuePolicy");
        Objects.requireNonNull(listener, "listener");
    }

    /** Incoming wins for plain leaves, conflicts logged. */
    public static MergeConfig defaults() {
        return new MergeConfig(
                ValueConflictPolicy.INCOMING_WINS,
                new LoggingMergeListener()
        );
    }

    public MergeConfig withValuePolicy(ValueConflictPolicy policy) {
        return new MergeConfig(policy, listener);
    }

    public MergeConfig withListener(MergeListener l) {
        return new MergeConfig(valuePolicy, l);
    }
}
