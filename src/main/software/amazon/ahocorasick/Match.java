package software.amazon.ahocorasick;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * One occurrence of a pattern in a scanned text. Offsets are zero-based and both inclusive, so a one-symbol match
 * has equal start and end offsets.
 */
@Immutable
@ThreadSafe
public final class Match {

    private final int patternId;
    private final String pattern;
    private final int startOffset;
    private final int endOffset;

    Match(final int patternId, final String pattern, final int startOffset, final int endOffset) {
        this.patternId = patternId;
        this.pattern = pattern;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    /**
     * @return the index of the matched pattern in the list the automaton was built from
     */
    public int getPatternId() {
        return patternId;
    }

    public String getPattern() {
        return pattern;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int length() {
        return endOffset - startOffset + 1;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Match match = (Match) o;
        return patternId == match.patternId && startOffset == match.startOffset && endOffset == match.endOffset
                && Objects.equals(pattern, match.pattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patternId, pattern, startOffset, endOffset);
    }

    @Override
    public String toString() {
        return "Match{" + pattern + "#" + patternId + " [" + startOffset + ", " + endOffset + "]}";
    }
}
