package software.amazon.ahocorasick;

import it.unimi.dsi.fastutil.chars.CharAVLTreeSet;
import it.unimi.dsi.fastutil.chars.CharSortedSet;
import it.unimi.dsi.fastutil.chars.CharSortedSets;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * The finite, totally ordered set of symbols an Automaton is built over. Patterns may only contain symbols of the
 * alphabet, and text symbols outside it are handled according to the {@link InvalidSymbolPolicy}.
 */
@Immutable
@ThreadSafe
public final class Alphabet {

    /**
     * Lower-case English letters, a to z.
     */
    public static final Alphabet LOWERCASE_LATIN = range('a', 'z');

    /**
     * The 7-bit ASCII range, including control characters.
     */
    public static final Alphabet ASCII = range((char) 0, (char) 127);

    // Contiguous alphabets skip the set lookup entirely
    private final char first;
    private final char last;
    private final boolean contiguous;
    private final CharSortedSet symbols;

    private Alphabet(final CharSortedSet symbols) {
        this.symbols = CharSortedSets.unmodifiable(symbols);
        this.first = symbols.firstChar();
        this.last = symbols.lastChar();
        this.contiguous = (last - first + 1) == symbols.size();
    }

    /**
     * Creates an alphabet of every symbol between {@code first} and {@code last}, both inclusive.
     *
     * @param first the smallest symbol
     * @param last the largest symbol
     * @return the alphabet
     * @throws IllegalArgumentException if {@code last} sorts before {@code first}
     */
    public static Alphabet range(final char first, final char last) {
        if (last < first) {
            throw new IllegalArgumentException(
                    String.format("Alphabet range is inverted: '%s' sorts after '%s'", first, last));
        }
        CharSortedSet set = new CharAVLTreeSet();
        for (int c = first; c <= last; c++) {
            set.add((char) c);
        }
        return new Alphabet(set);
    }

    /**
     * Creates an alphabet from the distinct symbols of {@code symbols}. Order and repetition don't matter.
     *
     * @param symbols the symbols of the alphabet
     * @return the alphabet
     * @throws IllegalArgumentException if {@code symbols} is empty
     */
    public static Alphabet of(@Nonnull final CharSequence symbols) {
        Objects.requireNonNull(symbols, "symbols");
        if (symbols.length() == 0) {
            throw new IllegalArgumentException("Alphabet must contain at least one symbol");
        }
        CharSortedSet set = new CharAVLTreeSet();
        for (int i = 0; i < symbols.length(); i++) {
            set.add(symbols.charAt(i));
        }
        return new Alphabet(set);
    }

    public boolean contains(final char symbol) {
        if (symbol < first || symbol > last) {
            return false;
        }
        return contiguous || symbols.contains(symbol);
    }

    /**
     * Returns the index of the first symbol of {@code text} that is not in this alphabet.
     *
     * @param text the text to check
     * @return the offset of the first foreign symbol, or -1 if every symbol belongs to the alphabet
     */
    int indexOfInvalid(final CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            if (!contains(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    public int size() {
        return symbols.size();
    }

    public char first() {
        return first;
    }

    public char last() {
        return last;
    }

    /**
     * @return the symbols of this alphabet in ascending order, read-only
     */
    public CharSortedSet symbols() {
        return symbols;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return symbols.equals(((Alphabet) o).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        if (contiguous) {
            return "Alphabet[" + printable(first) + ".." + printable(last) + "]";
        }
        StringBuilder sb = new StringBuilder("Alphabet[");
        for (char c : symbols) {
            sb.append(printable(c));
        }
        return sb.append(']').toString();
    }

    static String printable(final char c) {
        if (c < 0x20 || c > 0x7e) {
            return String.format("\\u%04x", (int) c);
        }
        return String.valueOf(c);
    }
}
