package software.amazon.ahocorasick;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a list of patterns from JSON. Two forms are accepted, a bare array of strings:
 * <pre>
 *   [ "he", "she", "his", "hers" ]
 * </pre>
 * or an object with a single "patterns" field holding such an array:
 * <pre>
 *   { "patterns": [ "he", "she", "his", "hers" ] }
 * </pre>
 * The order of the array is kept, so each pattern's id is its index in the array. Duplicates are kept as well.
 */
public class PatternListCompiler {

    static final String PATTERNS_FIELD = "patterns";

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    private PatternListCompiler() { }

    /**
     * Verify the syntax of a pattern list
     * @param source pattern list, as a String
     * @return null if the pattern list is valid, otherwise an error message
     */
    public static String check(final String source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final Reader source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final byte[] source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    public static String check(final InputStream source) {
        try {
            doCompile(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a pattern list from its JSON form.
     *
     * @param source pattern list, as a String
     * @return the patterns, in document order
     * @throws IOException if the pattern list isn't syntactically valid
     */
    public static List<String> compile(final String source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final Reader source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final byte[] source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    public static List<String> compile(final InputStream source) throws IOException {
        return doCompile(JSON_FACTORY.createParser(source));
    }

    private static List<String> doCompile(final JsonParser parser) throws IOException {
        final List<String> patterns;
        final JsonToken first = parser.nextToken();
        if (first == JsonToken.START_ARRAY) {
            patterns = readPatterns(parser);
        } else if (first == JsonToken.START_OBJECT) {
            patterns = readPatternsObject(parser);
        } else {
            barf(parser, "Pattern list must be an array or an object");
            return null;
        }
        if (parser.nextToken() != null) {
            barf(parser, "Unexpected content after the pattern list");
        }
        parser.close();
        return patterns;
    }

    private static List<String> readPatternsObject(final JsonParser parser) throws IOException {
        List<String> patterns = null;
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String fieldName = parser.getCurrentName();
            if (!PATTERNS_FIELD.equals(fieldName)) {
                barf(parser, String.format("Unrecognized field \"%s\", only \"%s\" is allowed", fieldName,
                        PATTERNS_FIELD));
            }
            if (patterns != null) {
                barf(parser, String.format("\"%s\" appears more than once", PATTERNS_FIELD));
            }
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                barf(parser, String.format("\"%s\" must be an array", PATTERNS_FIELD));
            }
            patterns = readPatterns(parser);
        }
        if (patterns == null) {
            barf(parser, String.format("\"%s\" is missing", PATTERNS_FIELD));
        }
        return patterns;
    }

    private static List<String> readPatterns(final JsonParser parser) throws IOException {
        final List<String> patterns = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token != JsonToken.VALUE_STRING) {
                barf(parser, "Pattern must be a string");
            }
            patterns.add(parser.getText());
        }
        return patterns;
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}
