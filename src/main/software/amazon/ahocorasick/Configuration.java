package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

/**
 * Configuration for an Automaton.
 */
@Immutable
public class Configuration {

    /**
     * The symbols patterns and texts are drawn from. Defaults to {@link Alphabet#LOWERCASE_LATIN}.
     */
    private final Alphabet alphabet;

    /**
     * How a scan treats a text symbol outside the alphabet. Defaults to {@link InvalidSymbolPolicy#REJECT}, which
     * fails the scan at the offending offset. {@link InvalidSymbolPolicy#SKIP} consumes the symbol and restarts
     * matching from the root state instead.
     */
    private final InvalidSymbolPolicy invalidSymbolPolicy;

    private Configuration(Alphabet alphabet, InvalidSymbolPolicy invalidSymbolPolicy) {
        this.alphabet = alphabet;
        this.invalidSymbolPolicy = invalidSymbolPolicy;
    }

    public Alphabet getAlphabet() {
        return alphabet;
    }

    public InvalidSymbolPolicy getInvalidSymbolPolicy() {
        return invalidSymbolPolicy;
    }

    @Override
    public String toString() {
        return "Configuration{alphabet=" + alphabet + ", invalidSymbolPolicy=" + invalidSymbolPolicy + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private Alphabet alphabet = Alphabet.LOWERCASE_LATIN;
        private InvalidSymbolPolicy invalidSymbolPolicy = InvalidSymbolPolicy.REJECT;

        Builder() {}

        public Builder withAlphabet(Alphabet alphabet) {
            this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
            return this;
        }

        public Builder withInvalidSymbolPolicy(InvalidSymbolPolicy invalidSymbolPolicy) {
            this.invalidSymbolPolicy = Objects.requireNonNull(invalidSymbolPolicy, "invalidSymbolPolicy");
            return this;
        }

        public Configuration build() {
            return new Configuration(alphabet, invalidSymbolPolicy);
        }
    }
}
