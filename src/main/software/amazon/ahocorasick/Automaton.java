package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.chars.Char2IntSortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An Aho-Corasick automaton: a trie of patterns whose states are cross-linked by failure links and output links,
 * so that one left-to-right pass over a text finds every occurrence of every pattern, in time proportional to the
 * length of the text plus the number of matches.
 *
 * An Automaton can only be obtained through {@link #build} or {@link #builder()}, which run the whole pipeline of
 * trie construction, failure links and output links. It is immutable afterwards, so any number of threads may scan
 * with it at the same time; each scan holds its own cursor.
 *
 * States are kept in an arena and addressed by index. The root is state 0.
 */
@Immutable
@ThreadSafe
public final class Automaton {

    private static final Logger LOGGER = LoggerFactory.getLogger(Automaton.class);

    static final int ROOT = 0;
    static final int NONE = -1;

    private final Configuration configuration;
    private final List<String> patterns;

    private final Char2IntSortedMap[] children;
    private final int[] depths;
    private final int[] patternIds;
    private final int[] fail;
    private final int[] out;
    private final int maxDepth;

    private Automaton(final Configuration configuration, final List<String> patterns,
                      final Char2IntSortedMap[] children, final int[] depths, final int[] patternIds,
                      final int[] fail, final int[] out) {
        this.configuration = configuration;
        this.patterns = patterns;
        this.children = children;
        this.depths = depths;
        this.patternIds = patternIds;
        this.fail = fail;
        this.out = out;
        this.maxDepth = Arrays.stream(depths).max().orElse(0);
    }

    /**
     * Builds an automaton over {@link Alphabet#LOWERCASE_LATIN} that rejects foreign symbols.
     *
     * @param patterns the patterns; a pattern's id is its index in this list. The empty pattern is accepted and
     *                 known to {@link #containsPattern}, but never reported as a match, since it would match at every
     *                 offset.
     * @return the automaton
     * @throws InvalidSymbolException if a pattern contains a symbol outside the alphabet
     */
    public static Automaton build(@Nonnull final List<String> patterns) {
        return builder().build(patterns);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Automaton build(final Configuration configuration, final List<String> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        final List<String> copy = Collections.unmodifiableList(new ArrayList<>(patterns));

        final TrieBuilder trie = new TrieBuilder(configuration.getAlphabet());
        for (int i = 0; i < copy.size(); i++) {
            final int patternId = i;
            trie.insert(Objects.requireNonNull(copy.get(i), () -> "pattern " + patternId));
        }

        final Char2IntSortedMap[] children = trie.children();
        final int[] depths = trie.depths();
        final int[] patternIds = trie.patternIds();
        final int[] fail = LinkResolver.resolveFailureLinks(children);
        final int[] out = LinkResolver.resolveOutputLinks(LinkResolver.levelOrder(children), fail, patternIds);
        LinkResolver.checkLinks(depths, fail, out);

        final Automaton automaton = new Automaton(configuration, copy, children, depths, patternIds, fail, out);
        LOGGER.debug("Built automaton with {} states, max depth {}, from {} patterns over {}",
                automaton.getStateCount(), automaton.getMaxDepth(), copy.size(), configuration.getAlphabet());
        return automaton;
    }

    /**
     * Scans a text lazily. Every call starts from the root state, so scanning the same text twice yields the same
     * sequence of matches.
     *
     * Matches come in non-decreasing order of end offset. Matches sharing an end offset come longest first: the
     * pattern ending at the current state, then those reached through output links.
     *
     * @param text the text to scan
     * @return an iterator over the matches; {@code next()} throws {@link InvalidSymbolException} on reaching a symbol
     *         outside the alphabet, unless the configuration says to skip it. After that the iterator stays failed:
     *         every later {@code hasNext()} or {@code next()} throws the same exception.
     */
    public Iterator<Match> scan(@Nonnull final CharSequence text) {
        Objects.requireNonNull(text, "text");
        return new MatchFinder(this, text.chars().iterator());
    }

    /**
     * Scans a character stream lazily. Characters are only read as far as matches are pulled from the iterator.
     * An {@link IOException} from the reader is rethrown as {@link UncheckedIOException}. Closing the
     * reader is up to the caller.
     *
     * @param text the character stream to scan
     * @return an iterator over the matches
     */
    public Iterator<Match> scan(@Nonnull final Reader text) {
        Objects.requireNonNull(text, "text");
        return new MatchFinder(this, new ReaderSymbols(text));
    }

    public Stream<Match> stream(@Nonnull final CharSequence text) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(scan(text),
                Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * @param text the text to scan
     * @return all matches, in scan order. The list may be empty but never null.
     */
    public List<Match> findAll(@Nonnull final CharSequence text) {
        final List<Match> matches = new ArrayList<>();
        scan(text).forEachRemaining(matches::add);
        return matches;
    }

    /**
     * @param text the text to scan
     * @return the first match in scan order, or {@code null} if there is none
     */
    @Nullable
    public Match findFirst(@Nonnull final CharSequence text) {
        final Iterator<Match> matches = scan(text);
        return matches.hasNext() ? matches.next() : null;
    }

    public boolean containsMatch(@Nonnull final CharSequence text) {
        return scan(text).hasNext();
    }

    /**
     * @return true if {@code pattern} is one of the patterns this automaton was built from
     */
    public boolean containsPattern(@Nonnull final CharSequence pattern) {
        final int state = walk(pattern);
        return state != NONE && patternIds[state] != NONE;
    }

    /**
     * @return true if {@code prefix} is a prefix of at least one pattern. The empty string always is.
     */
    public boolean hasPrefix(@Nonnull final CharSequence prefix) {
        return walk(prefix) != NONE;
    }

    private int walk(final CharSequence path) {
        Objects.requireNonNull(path, "path");
        int state = ROOT;
        for (int i = 0; i < path.length() && state != NONE; i++) {
            state = children[state].get(path.charAt(i));
        }
        return state;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    public int getPatternCount() {
        return patterns.size();
    }

    /**
     * @return the patterns this automaton was built from, read-only, in id order; duplicates included
     */
    public List<String> getPatterns() {
        return patterns;
    }

    public String getPattern(final int patternId) {
        if (patternId < 0 || patternId >= patterns.size()) {
            throw new IllegalArgumentException("No pattern with id " + patternId);
        }
        return patterns.get(patternId);
    }

    /**
     * @return the number of states, which is the number of distinct pattern prefixes including the empty one
     */
    public int getStateCount() {
        return children.length;
    }

    /**
     * @return the length of the longest pattern
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    int child(final int state, final char symbol) {
        return children[state].get(symbol);
    }

    int fail(final int state) {
        return fail[state];
    }

    int out(final int state) {
        return out[state];
    }

    int patternId(final int state) {
        return patternIds[state];
    }

    int depth(final int state) {
        return depths[state];
    }

    Match matchEndingAt(final int state, final int endOffset) {
        final int patternId = patternIds[state];
        return new Match(patternId, patterns.get(patternId), endOffset - depths[state] + 1, endOffset);
    }

    @Override
    public String toString() {
        return "Automaton{patterns=" + patterns.size() + ", states=" + children.length + ", maxDepth=" + maxDepth
                + ", " + configuration + "}";
    }

    public static class Builder {

        private final Configuration.Builder configuration = Configuration.builder();

        Builder() {}

        public Builder withAlphabet(Alphabet alphabet) {
            configuration.withAlphabet(alphabet);
            return this;
        }

        public Builder withInvalidSymbolPolicy(InvalidSymbolPolicy invalidSymbolPolicy) {
            configuration.withInvalidSymbolPolicy(invalidSymbolPolicy);
            return this;
        }

        /**
         * Takes every setting from {@code configuration}. Later {@code with} calls override single settings.
         */
        public Builder withConfiguration(Configuration configuration) {
            Objects.requireNonNull(configuration, "configuration");
            this.configuration
                    .withAlphabet(configuration.getAlphabet())
                    .withInvalidSymbolPolicy(configuration.getInvalidSymbolPolicy());
            return this;
        }

        /**
         * @param patterns the patterns; a pattern's id is its index in this list. The empty pattern is accepted and
         *                 known to {@link Automaton#containsPattern}, but never reported as a match.
         * @return the automaton
         * @throws InvalidSymbolException if a pattern contains a symbol outside the alphabet
         */
        public Automaton build(@Nonnull List<String> patterns) {
            return Automaton.build(configuration.build(), patterns);
        }

        public Automaton build(@Nonnull String... patterns) {
            return build(Arrays.asList(patterns));
        }
    }

    /**
     * Adapts a Reader to the symbol source of a MatchFinder.
     */
    private static final class ReaderSymbols implements PrimitiveIterator.OfInt {

        private final Reader reader;
        private final char[] buffer = new char[4096];
        private int length = 0;
        private int index = 0;
        private boolean eof = false;

        private ReaderSymbols(final Reader reader) {
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            while (index == length && !eof) {
                try {
                    final int read = reader.read(buffer, 0, buffer.length);
                    if (read < 0) {
                        eof = true;
                    } else {
                        length = read;
                        index = 0;
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return index < length;
        }

        @Override
        public int nextInt() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer[index++];
        }
    }
}
