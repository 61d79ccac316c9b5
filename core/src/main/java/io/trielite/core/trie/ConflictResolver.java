// file: src/main/java/io/trielite/core/trie/ConflictResolver.java
package io.trielite.core.trie;

import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Policy for choosing a single version from the siblings of a versioned leaf.
 * <p>
 * This only decides what a reader sees. Merges keep every concurrent sibling,
 * so replicas converge whichever resolver their readers use.
 */
public interface ConflictResolver {

    ConflictResolver DEFAULT = new ReplicaOrder();

    /**
     * Choose one sibling from a non-empty list. A tombstone may be chosen, in
     * which case the leaf reads as "no value".
     */
    TrieNode.Sibling choose(List<TrieNode.Sibling> siblings);

    /**
     * Default resolver.
     * <p>
     * Order of precedence:
     *  - a live value beats a tombstone (concurrent add wins over remove),
     *  - then clocks are compared entry by entry in descending replica-id
     *    order, the larger counter at the first difference winning,
     *  - then the canonical value text decides.
     */
    final class ReplicaOrder implements ConflictResolver {

        /** Winner first. Also the canonical sibling order of {@link TrieNode.Versioned}. */
        public static final Comparator<TrieNode.Sibling> PRECEDENCE = (a, b) -> -ReplicaOrder.compare(a, b);

        @Override
        public TrieNode.Sibling choose(List<TrieNode.Sibling> siblings) {
            if (siblings == null || siblings.isEmpty())
                throw new IllegalArgumentException("siblings must not be empty");
            TrieNode.Sibling best = siblings.get(0);
            for (int i = 1; i < siblings.size(); i++) {
                if (compare(siblings.get(i), best) > 0) best = siblings.get(i);
            }
            return best;
        }

        private static int compare(TrieNode.Sibling a, TrieNode.Sibling b) {
            if (a.isTombstone() != b.isTombstone()) return a.isTombstone() ? -1 : 1;

            var ids = new TreeSet<String>(a.version().entries().keySet());
            ids.addAll(b.version().entries().keySet());
            for (String id : ids.descendingSet()) {
                int cmp = Integer.compare(a.version().get(id), b.version().get(id));
                if (cmp != 0) return cmp;
            }
            if (a.isTombstone()) return 0;
            return a.value().canonical().compareTo(b.value().canonical());
        }
    }
}
