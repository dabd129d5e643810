package software.amazon.ahocorasick;

/**
 * A RuntimeException that indicates a symbol outside the automaton's alphabet, either in a pattern being added or in
 * a text being scanned.
 */
public class InvalidSymbolException extends RuntimeException {

    private final char symbol;
    private final int position;

    public InvalidSymbolException(final String msg, final char symbol, final int position) {
        super(msg);
        this.symbol = symbol;
        this.position = position;
    }

    static InvalidSymbolException inText(final char symbol, final int position, final Alphabet alphabet) {
        return new InvalidSymbolException(String.format("Symbol '%s' at offset %d is not in %s",
                Alphabet.printable(symbol), position, alphabet), symbol, position);
    }

    static InvalidSymbolException inPattern(final char symbol, final int patternId, final int offset,
                                            final Alphabet alphabet) {
        return new InvalidSymbolException(String.format("Pattern %d has symbol '%s' at offset %d which is not in %s",
                patternId, Alphabet.printable(symbol), offset, alphabet), symbol, offset);
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * @return the text offset of the symbol, or its offset within the pattern for a rejected pattern
     */
    public int getPosition() {
        return position;
    }
}
