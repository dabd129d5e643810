package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.chars.Char2IntMap;
import it.unimi.dsi.fastutil.chars.Char2IntSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

import java.util.Arrays;

import static software.amazon.ahocorasick.Automaton.NONE;
import static software.amazon.ahocorasick.Automaton.ROOT;

/**
 * Computes the failure and output links of a fully built trie. Both passes walk the trie in level order, which
 * guarantees that a state's parent, and every state shallower than it, has its links set before the state itself.
 */
class LinkResolver {

    private LinkResolver() { }

    /**
     * Lists the states of the trie in level order, children of a state in ascending symbol order.
     *
     * @param children the child maps of the trie, indexed by state
     * @return every state index, root first
     */
    static int[] levelOrder(final Char2IntSortedMap[] children) {
        final int[] order = new int[children.length];
        int size = 0;
        order[size++] = ROOT;
        for (int head = 0; head < size; head++) {
            for (Char2IntMap.Entry edge : children[order[head]].char2IntEntrySet()) {
                order[size++] = edge.getIntValue();
            }
        }
        return order;
    }

    /**
     * The failure link of a state points at the state of the longest proper suffix of its string that is also in the
     * trie. The root has none.
     *
     * @param children the child maps of the trie, indexed by state
     * @return the failure link of each state, {@link Automaton#NONE} for the root
     */
    static int[] resolveFailureLinks(final Char2IntSortedMap[] children) {
        final int[] fail = new int[children.length];
        Arrays.fill(fail, NONE);

        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(ROOT);
        while (!queue.isEmpty()) {
            final int parent = queue.dequeueInt();

            // a state's queue visit sets the links of its children
            for (Char2IntMap.Entry edge : children[parent].char2IntEntrySet()) {
                final char symbol = edge.getCharKey();
                final int child = edge.getIntValue();
                queue.enqueue(child);

                // the only proper suffix of a single symbol is the empty string
                if (parent == ROOT) {
                    fail[child] = ROOT;
                    continue;
                }

                // fall back along the parent's failure chain until some state extends by the same symbol
                int candidate = fail[parent];
                while (candidate != ROOT && !children[candidate].containsKey(symbol)) {
                    candidate = fail[candidate];
                }
                final int target = children[candidate].get(symbol);
                fail[child] = target == NONE ? ROOT : target;
            }
        }
        return fail;
    }

    /**
     * The output link of a state points at the nearest state along its failure chain that terminates a pattern. The
     * root never counts, as it would only ever report empty matches.
     *
     * @param order the states in level order, see {@link #levelOrder}
     * @param fail the failure links
     * @param patternIds the pattern terminating at each state, or {@link Automaton#NONE}
     * @return the output link of each state, {@link Automaton#NONE} where there is none
     */
    static int[] resolveOutputLinks(final int[] order, final int[] fail, final int[] patternIds) {
        final int[] out = new int[fail.length];
        Arrays.fill(out, NONE);
        for (int state : order) {
            if (state == ROOT) {
                continue;
            }
            final int failState = fail[state];
            if (failState != ROOT && patternIds[failState] != NONE) {
                out[state] = failState;
            } else {
                out[state] = out[failState];
            }
        }
        return out;
    }

    /**
     * Checks that every failure link points strictly closer to the root, which is what bounds the fallback loops of
     * both link resolution and matching.
     *
     * @throws IllegalStateException if a link does not
     */
    static void checkLinks(final int[] depths, final int[] fail, final int[] out) {
        if (fail[ROOT] != NONE || out[ROOT] != NONE) {
            throw new IllegalStateException("Root state must not have links");
        }
        for (int state = 1; state < fail.length; state++) {
            if (fail[state] == NONE || depths[fail[state]] >= depths[state]) {
                throw new IllegalStateException(String.format(
                        "Failure link of state %d at depth %d does not lead towards the root", state, depths[state]));
            }
            if (out[state] != NONE && depths[out[state]] >= depths[state]) {
                throw new IllegalStateException(String.format(
                        "Output link of state %d at depth %d does not lead towards the root", state, depths[state]));
            }
        }
    }
}
