package software.amazon.ahocorasick;

import org.junit.Test;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsEqual.equalTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AutomatonTest {

    private static Match match(Automaton automaton, int patternId, int start, int end) {
        return new Match(patternId, automaton.getPattern(patternId), start, end);
    }

    @Test
    public void WHEN_SuffixPatternsOverlap_THEN_LongestIsReportedFirst() {
        Automaton automaton = Automaton.build(Arrays.asList("he", "she"));

        List<Match> matches = automaton.findAll("ushers");

        assertEquals(Arrays.asList(match(automaton, 1, 1, 3), match(automaton, 0, 2, 3)), matches);
    }

    @Test
    public void WHEN_PrefixPatternsShareAPath_THEN_EachIsReportedAtItsOwnEnd() {
        Automaton automaton = Automaton.build(Arrays.asList("a", "ab", "bc"));

        List<Match> matches = automaton.findAll("abc");

        assertEquals(Arrays.asList(
                match(automaton, 0, 0, 0),
                match(automaton, 1, 0, 1),
                match(automaton, 2, 1, 2)), matches);
    }

    @Test
    public void WHEN_ClassicPatternSetIsScanned_THEN_AllOccurrencesAreFound() {
        Automaton automaton = Automaton.build(Arrays.asList("he", "she", "his", "hers"));

        List<String> found = automaton.findAll("ahishers").stream()
                .map(m -> m.getPattern() + "@" + m.getStartOffset())
                .collect(Collectors.toList());

        assertEquals(Arrays.asList("his@1", "she@3", "he@4", "hers@4"), found);
    }

    @Test
    public void WHEN_PatternsAreEmpty_THEN_NothingMatches() {
        Automaton automaton = Automaton.build(Collections.emptyList());

        assertEquals(1, automaton.getStateCount());
        assertEquals(0, automaton.getMaxDepth());
        assertTrue(automaton.findAll("abracadabra").isEmpty());
        assertFalse(automaton.containsMatch("abracadabra"));
    }

    @Test
    public void WHEN_TextIsEmpty_THEN_NothingMatches() {
        Automaton automaton = Automaton.build(Arrays.asList("a", "b"));

        assertTrue(automaton.findAll("").isEmpty());
        assertNull(automaton.findFirst(""));
    }

    @Test
    public void WHEN_PatternIsTheWholeText_THEN_ExactlyOneMatchAtZero() {
        Automaton automaton = Automaton.build(Collections.singletonList("abracadabra"));

        List<Match> matches = automaton.findAll("abracadabra");

        assertEquals(Collections.singletonList(match(automaton, 0, 0, 10)), matches);
        assertEquals(11, matches.get(0).length());
    }

    @Test
    public void WHEN_PatternOverlapsItself_THEN_EveryOccurrenceIsReported() {
        Automaton automaton = Automaton.build(Collections.singletonList("aa"));

        List<Integer> starts = automaton.findAll("aaaa").stream()
                .map(Match::getStartOffset)
                .collect(Collectors.toList());

        assertEquals(Arrays.asList(0, 1, 2), starts);
    }

    @Test
    public void WHEN_PatternIsDuplicated_THEN_LastInsertedIdWins() {
        Automaton automaton = Automaton.build(Arrays.asList("ab", "cd", "ab"));

        List<Match> matches = automaton.findAll("xabx");

        assertEquals(Collections.singletonList(match(automaton, 2, 1, 2)), matches);
        assertEquals(3, automaton.getPatternCount());
        assertEquals(Arrays.asList("ab", "cd", "ab"), automaton.getPatterns());
    }

    @Test
    public void WHEN_EmptyPatternIsAdded_THEN_ItIsKnownButNeverReported() {
        Automaton automaton = Automaton.build(Arrays.asList("", "b"));

        assertTrue(automaton.containsPattern(""));
        assertEquals(Collections.singletonList(match(automaton, 1, 1, 1)), automaton.findAll("abc"));
    }

    @Test
    public void WHEN_SameTextIsScannedTwice_THEN_SequencesAreIdentical() {
        Automaton automaton = Automaton.build(Arrays.asList("a", "aa", "ba", "aab"));
        String text = "baabaaabab";

        assertEquals(automaton.findAll(text), automaton.findAll(text));
    }

    @Test
    public void WHEN_FindFirstIsCalled_THEN_TheFirstMatchInScanOrderIsReturned() {
        Automaton automaton = Automaton.build(Arrays.asList("cd", "bcd", "z"));

        assertEquals(match(automaton, 1, 1, 3), automaton.findFirst("abcdz"));
        assertTrue(automaton.containsMatch("abcdz"));
        assertFalse(automaton.containsMatch("abce"));
    }

    @Test
    public void WHEN_StreamIsUsed_THEN_ItMatchesTheIterator() {
        Automaton automaton = Automaton.build(Arrays.asList("he", "she", "his", "hers"));

        assertEquals(automaton.findAll("ushershis"), automaton.stream("ushershis").collect(Collectors.toList()));
        assertEquals(2, automaton.stream("ushershis").filter(m -> m.getPattern().startsWith("h")).limit(2).count());
    }

    @Test
    public void WHEN_ReaderIsScanned_THEN_ResultsMatchTheStringScan() {
        Automaton automaton = Automaton.build(Arrays.asList("ab", "ba"));
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 5000; i++) {
            sb.append("ab");
        }
        String text = sb.toString();

        Iterator<Match> fromReader = automaton.scan(new StringReader(text));
        List<Match> expected = automaton.findAll(text);
        for (Match m : expected) {
            assertTrue(fromReader.hasNext());
            assertEquals(m, fromReader.next());
        }
        assertFalse(fromReader.hasNext());
        assertEquals(9999, expected.size());
    }

    @Test
    public void WHEN_ReaderFails_THEN_UncheckedIOExceptionIsThrown() {
        Automaton automaton = Automaton.build(Collections.singletonList("a"));
        Reader broken = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("kaboom");
            }

            @Override
            public void close() {
            }
        };

        try {
            automaton.scan(broken).hasNext();
            fail("expected UncheckedIOException");
        } catch (UncheckedIOException e) {
            assertEquals("kaboom", e.getCause().getMessage());
        }
    }

    @Test
    public void WHEN_PatternHasForeignSymbol_THEN_BuildIsRejected() {
        try {
            Automaton.build(Arrays.asList("ok", "nOk"));
            fail("expected InvalidSymbolException");
        } catch (InvalidSymbolException e) {
            assertEquals('O', e.getSymbol());
            assertEquals(1, e.getPosition());
            assertThat(e.getMessage(), containsString("Pattern 1"));
        }
    }

    @Test(expected = NullPointerException.class)
    public void WHEN_PatternIsNull_THEN_BuildIsRejected() {
        Automaton.build(Arrays.asList("a", null));
    }

    @Test(expected = NullPointerException.class)
    public void WHEN_PatternListIsNull_THEN_BuildIsRejected() {
        Automaton.build((List<String>) null);
    }

    @Test
    public void WHEN_PatternListChangesAfterBuild_THEN_AutomatonIsUnaffected() {
        List<String> patterns = new ArrayList<>(Arrays.asList("a", "b"));
        Automaton automaton = Automaton.build(patterns);
        patterns.set(0, "z");

        assertEquals("a", automaton.getPattern(0));
        try {
            automaton.getPatterns().add("c");
            fail("expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void WHEN_PatternIdIsUnknown_THEN_GetPatternFails() {
        Automaton.build(Collections.singletonList("a")).getPattern(1);
    }

    @Test
    public void WHEN_MembershipIsQueried_THEN_PatternsAndPrefixesAreKnown() {
        Automaton automaton = Automaton.build(Arrays.asList("tea", "ted", "ten", "inn"));

        assertTrue(automaton.containsPattern("ten"));
        assertFalse(automaton.containsPattern("te"));
        assertFalse(automaton.containsPattern("tent"));
        assertFalse(automaton.containsPattern("TEN"));
        assertTrue(automaton.hasPrefix("te"));
        assertTrue(automaton.hasPrefix("inn"));
        assertTrue(automaton.hasPrefix(""));
        assertFalse(automaton.hasPrefix("tx"));
        assertFalse(automaton.containsPattern(""));
    }

    @Test
    public void WHEN_AutomatonIsBuilt_THEN_SizeReflectsDistinctPrefixes() {
        Automaton automaton = Automaton.build(Arrays.asList("tea", "ted", "ten", "inn"));

        // root, t, te, tea, ted, ten, i, in, inn
        assertEquals(9, automaton.getStateCount());
        assertEquals(3, automaton.getMaxDepth());
        assertThat(automaton.toString(), containsString("states=9"));
    }

    @Test
    public void WHEN_BuilderIsConfigured_THEN_ConfigurationIsKept() {
        Alphabet dna = Alphabet.of("ACGT");
        Automaton automaton = Automaton.builder()
                .withAlphabet(dna)
                .withInvalidSymbolPolicy(InvalidSymbolPolicy.SKIP)
                .build("GATTACA", "TAC");

        assertThat(automaton.getConfiguration().getAlphabet(), is(equalTo(dna)));
        assertThat(automaton.getConfiguration().getInvalidSymbolPolicy(), is(InvalidSymbolPolicy.SKIP));
        assertEquals(Arrays.asList(match(automaton, 1, 3, 5), match(automaton, 0, 0, 6)),
                automaton.findAll("GATTACA"));
    }

    @Test
    public void WHEN_BuilderGetsAConfiguration_THEN_ItReplacesEarlierSettings() {
        Configuration configuration = Configuration.builder().withAlphabet(Alphabet.ASCII).build();
        Automaton automaton = Automaton.builder()
                .withInvalidSymbolPolicy(InvalidSymbolPolicy.SKIP)
                .withConfiguration(configuration)
                .build("A b");

        assertThat(automaton.getConfiguration().getAlphabet(), is(equalTo(Alphabet.ASCII)));
        assertThat(automaton.getConfiguration().getInvalidSymbolPolicy(), is(InvalidSymbolPolicy.REJECT));
        assertEquals(1, automaton.findAll("xA by").size());
    }

    @Test
    public void WHEN_BuilderSettingFollowsAConfiguration_THEN_OnlyThatSettingChanges() {
        Configuration configuration = Configuration.builder()
                .withAlphabet(Alphabet.ASCII)
                .withInvalidSymbolPolicy(InvalidSymbolPolicy.SKIP)
                .build();
        Alphabet ab = Alphabet.of("ab");
        Automaton automaton = Automaton.builder()
                .withConfiguration(configuration)
                .withAlphabet(ab)
                .build("ab");

        assertThat(automaton.getConfiguration().getAlphabet(), is(equalTo(ab)));
        assertThat(automaton.getConfiguration().getInvalidSymbolPolicy(), is(InvalidSymbolPolicy.SKIP));
        assertEquals(Collections.singletonList(match(automaton, 0, 3, 4)), automaton.findAll("a-bab"));
    }

    @Test
    public void WHEN_AutomatonIsSharedAcrossThreads_THEN_EveryScanSeesTheSameMatches() throws Exception {
        Automaton automaton = Automaton.build(Arrays.asList("he", "she", "his", "hers", "s", "hh"));
        String text = "ahishershhhsheshishe";
        List<Match> expected = automaton.findAll(text);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<Match>>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> automaton.findAll(text)));
            }
            for (Future<List<Match>> future : futures) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
