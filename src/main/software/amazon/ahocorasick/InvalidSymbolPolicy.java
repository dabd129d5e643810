package software.amazon.ahocorasick;

/**
 * What a scan does when the text contains a symbol that is not part of the automaton's {@link Alphabet}.
 */
public enum InvalidSymbolPolicy {

    /**
     * Fail the scan with an {@link InvalidSymbolException}.
     */
    REJECT,

    /**
     * Consume the symbol and restart matching from the root. No match can span a skipped symbol.
     */
    SKIP
}
