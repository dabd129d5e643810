package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.chars.Char2IntRBTreeMap;
import it.unimi.dsi.fastutil.chars.Char2IntSortedMap;
import it.unimi.dsi.fastutil.chars.Char2IntSortedMaps;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.List;

import static software.amazon.ahocorasick.Automaton.NONE;
import static software.amazon.ahocorasick.Automaton.ROOT;

/**
 * Builds the prefix tree of a pattern list. States live in an arena and are addressed by index, the root being
 * index 0. A state's children map symbols to child indexes; the child owns nothing back, so failure and output links
 * computed later are plain indexes into the same arena.
 *
 * Not thread safe, and single use: once {@link #children()} has been called the arena is frozen.
 */
class TrieBuilder {

    private final Alphabet alphabet;

    private final List<Char2IntSortedMap> children = new ArrayList<>();
    private final IntArrayList depths = new IntArrayList();
    private final IntArrayList patternIds = new IntArrayList();

    private int patternCount = 0;
    private boolean frozen = false;

    TrieBuilder(final Alphabet alphabet) {
        this.alphabet = alphabet;
        newState(0);
    }

    /**
     * Adds the next pattern, whose id is the number of patterns added before it. Adding a pattern that is already
     * present moves the pattern id of its terminal state to the new id, so the last of a set of duplicates wins.
     *
     * @param pattern the pattern
     * @return the id given to the pattern
     * @throws InvalidSymbolException if the pattern contains a symbol outside the alphabet; nothing is added then
     */
    int insert(final CharSequence pattern) {
        if (frozen) {
            throw new IllegalStateException("Trie is already built");
        }
        final int patternId = patternCount;

        // check the whole pattern first so a rejected one leaves no dangling states behind
        final int invalid = alphabet.indexOfInvalid(pattern);
        if (invalid >= 0) {
            throw InvalidSymbolException.inPattern(pattern.charAt(invalid), patternId, invalid, alphabet);
        }

        int state = ROOT;
        for (int i = 0; i < pattern.length(); i++) {
            final char symbol = pattern.charAt(i);
            int next = children.get(state).get(symbol);
            if (next == NONE) {
                next = newState(depths.getInt(state) + 1);
                children.get(state).put(symbol, next);
            }
            state = next;
        }
        patternIds.set(state, patternId);
        patternCount++;
        return patternId;
    }

    private int newState(final int depth) {
        Char2IntSortedMap edges = new Char2IntRBTreeMap();
        edges.defaultReturnValue(NONE);
        children.add(edges);
        depths.add(depth);
        patternIds.add(NONE);
        return children.size() - 1;
    }

    int stateCount() {
        return children.size();
    }

    int patternCount() {
        return patternCount;
    }

    /**
     * Freezes the arena and returns the read-only child maps, indexed by state.
     */
    Char2IntSortedMap[] children() {
        frozen = true;
        Char2IntSortedMap[] result = new Char2IntSortedMap[children.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = Char2IntSortedMaps.unmodifiable(children.get(i));
        }
        return result;
    }

    int[] depths() {
        return depths.toIntArray();
    }

    int[] patternIds() {
        return patternIds.toIntArray();
    }
}
