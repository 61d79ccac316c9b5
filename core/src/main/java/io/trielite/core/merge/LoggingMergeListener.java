package io.trielite.core.merge;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs resolved conflicts.
 * Structural conflicts are schema-evolution events and go out at INFO;
 * value and concurrent-write conflicts are routine and go out at FINE.
 */
public final class LoggingMergeListener implements MergeListener {
    private static final Logger log = Logger.getLogger(LoggingMergeListener.class.getName());

    @Override
    public void onConflict(MergeConflict conflict) {
        Level level = conflict.kind() == MergeConflict.Kind.STRUCTURAL ? Level.INFO : Level.FINE;
        if (!log.isLoggable(level)) return;
        log.log(level, String.format(
                "merge conflict %s at %s: left=%s right=%s -> %s",
                conflict.kind(),
                conflict.path(),
                conflict.left(),
                conflict.right(),
                conflict.chosen()
        ));
    }
}
