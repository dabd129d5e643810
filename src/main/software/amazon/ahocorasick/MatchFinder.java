package software.amazon.ahocorasick;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

import static software.amazon.ahocorasick.Automaton.NONE;
import static software.amazon.ahocorasick.Automaton.ROOT;

/**
 * Runs an Automaton over a source of symbols, one symbol at a time, and hands out the matches as they are found.
 * The only state is a cursor into the automaton, the offset of the last consumed symbol, and the position in the
 * output chain of that offset; the automaton itself is never modified.
 */
@NotThreadSafe
class MatchFinder implements Iterator<Match> {

    private static final Logger LOGGER = LoggerFactory.getLogger(MatchFinder.class);

    private final Automaton automaton;
    private final Alphabet alphabet;
    private final InvalidSymbolPolicy invalidSymbolPolicy;
    private final PrimitiveIterator.OfInt symbols;

    private int state = ROOT;
    private int offset = -1;

    // the next state of the current offset's output chain still to be reported
    private int pendingOutput = NONE;

    private Match next = null;

    // set once a symbol is rejected; the scan is over and every later call rethrows it
    private InvalidSymbolException failure = null;

    MatchFinder(final Automaton automaton, final PrimitiveIterator.OfInt symbols) {
        this.automaton = automaton;
        this.alphabet = automaton.getConfiguration().getAlphabet();
        this.invalidSymbolPolicy = automaton.getConfiguration().getInvalidSymbolPolicy();
        this.symbols = symbols;
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            next = advance();
        }
        return next != null;
    }

    @Override
    public Match next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final Match match = next;
        next = null;
        return match;
    }

    private Match advance() {
        if (failure != null) {
            throw failure;
        }
        if (pendingOutput != NONE) {
            return reportFrom(pendingOutput);
        }

        while (symbols.hasNext()) {
            final char symbol = (char) symbols.nextInt();
            offset++;

            if (!alphabet.contains(symbol)) {
                if (invalidSymbolPolicy == InvalidSymbolPolicy.REJECT) {
                    state = ROOT;
                    failure = InvalidSymbolException.inText(symbol, offset, alphabet);
                    throw failure;
                }
                LOGGER.debug("Skipping symbol '{}' at offset {}", Alphabet.printable(symbol), offset);
                state = ROOT;
                continue;
            }

            state = transition(state, symbol);
            if (state == ROOT) {
                continue;
            }

            if (automaton.patternId(state) != NONE) {
                return reportFrom(state);
            }
            if (automaton.out(state) != NONE) {
                return reportFrom(automaton.out(state));
            }
        }
        return null;
    }

    /**
     * Takes the child of {@code from} on {@code symbol}, falling back along failure links while there is none. Each
     * fallback moves strictly closer to the root, which ends the loop.
     */
    private int transition(int from, final char symbol) {
        while (true) {
            final int child = automaton.child(from, symbol);
            if (child != NONE) {
                return child;
            }
            if (from == ROOT) {
                return ROOT;
            }
            from = automaton.fail(from);
        }
    }

    private Match reportFrom(final int matchState) {
        pendingOutput = automaton.out(matchState);
        return automaton.matchEndingAt(matchState, offset);
    }
}
