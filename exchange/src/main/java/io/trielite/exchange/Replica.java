// file: src/main/java/io/trielite/exchange/Replica.java
package io.trielite.exchange;

import io.trielite.core.CausalOrder;
import io.trielite.core.Container;
import io.trielite.core.VectorClock;
import io.trielite.core.merge.MergeConfig;
import io.trielite.core.merge.TrieMerger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holder of one replica's live state and its history.
 * <p>
 * Responsibilities:
 *  - Apply local writes to the current {@link Container}.
 *  - Accept containers from peers (at-least-once: duplicates and stale
 *    deliveries are detected by version and ignored).
 *  - Keep superseded containers in an append-only history log.
 * <p>
 * Concurrency:
 *  - Writers are serialized on this object.
 *  - {@link #current()} is a volatile read and never blocks; the containers it
 *    hands out are immutable.
 */
public final class Replica {
    private static final Logger log = Logger.getLogger(Replica.class.getName());

    private final TrieMerger merger;
    private final int historyLimit;
    private final List<Container> history = new ArrayList<>();

    private volatile Container current;

    public Replica(String id) {
        this(Container.create(id), MergeConfig.defaults(), Integer.MAX_VALUE);
    }

    /**
     * @param initial      starting state; its id becomes this replica's id
     * @param mergeConfig  policies used when receiving remote containers
     * @param historyLimit max superseded containers retained (oldest dropped first)
     */
    public Replica(Container initial, MergeConfig mergeConfig, int historyLimit) {
        if (historyLimit < 0) throw new IllegalArgumentException("historyLimit must be >= 0");
        this.current = Objects.requireNonNull(initial, "initial");
        this.merger = new TrieMerger(Objects.requireNonNull(mergeConfig, "mergeConfig"));
        this.historyLimit = historyLimit;
    }

    public String id() {
        return current.id();
    }

    public Container current() {
        return current;
    }

    /** Superseded containers, oldest first. */
    public synchronized List<Container> history() {
        return List.copyOf(history);
    }

    // ----------------- local writes -----------------

    public Container setValue(List<String> path, Object payload) {
        return write(c -> c.setValue(path, payload));
    }

    public Container setContainer(List<String> path, Object payload) {
        return write(c -> c.setContainer(path, payload));
    }

    public Container updateValue(List<String> path, Object payload) {
        return write(c -> c.updateValue(path, payload));
    }

    public Container removeValue(List<String> path) {
        return write(c -> c.removeValue(path));
    }

    public Container removePath(List<String> path) {
        return write(c -> c.removePath(path));
    }

    /**
     * Apply an arbitrary local write. If {@code op} throws, nothing changes.
     */
    public synchronized Container write(UnaryOperator<Container> op) {
        Container next = Objects.requireNonNull(op.apply(current), "write returned null");
        if (!next.id().equals(current.id())) {
            throw new IllegalStateException("write changed replica id from " + current.id() + " to " + next.id());
        }
        advance(next);
        return next;
    }

    // ----------------- remote intake -----------------

    /**
     * Merge a container received from a peer.
     *
     * @return true if local state changed; false for duplicates or stale deliveries
     */
    public synchronized boolean receive(Container remote) {
        Objects.requireNonNull(remote, "remote");
        CausalOrder order = remote.version().compare(current.version());
        if (order == CausalOrder.BEFORE || order == CausalOrder.EQUAL) {
            log.log(Level.FINE, "replica {0}: ignoring {1} from {2}, already covered by {3}",
                    new Object[]{id(), remote.version(), remote.id(), current.version()});
            return false;
        }

        Container merged = merger.merge(current, remote);
        advance(merged);
        log.log(Level.FINE, "replica {0}: merged {1} from {2}, now at {3}",
                new Object[]{id(), remote.version(), remote.id(), merged.version()});
        return true;
    }

    public boolean receiveJson(String json) {
        return receive(ContainerJson.read(json));
    }

    public String exportJson() {
        return ContainerJson.write(current);
    }

    /**
     * Latest state (history or current) whose version does not go beyond {@code horizon}.
     */
    public synchronized Optional<Container> asOf(VectorClock horizon) {
        Objects.requireNonNull(horizon, "horizon");
        if (covered(current, horizon)) return Optional.of(current);
        for (int i = history.size() - 1; i >= 0; i--) {
            if (covered(history.get(i), horizon)) return Optional.of(history.get(i));
        }
        return Optional.empty();
    }

    private static boolean covered(Container c, VectorClock horizon) {
        CausalOrder order = c.version().compare(horizon);
        return order == CausalOrder.BEFORE || order == CausalOrder.EQUAL;
    }

    private void advance(Container next) {
        if (historyLimit > 0) {
            history.add(current);
            if (history.size() > historyLimit) history.remove(0);
        }
        current = next;
    }
}
