package search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import utilities.Sequences;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class KnuthMorrisPrattTest {

    @Test
    @DisplayName("LPS table of a periodic pattern")
    void testLps() {
        assertThat(KnuthMorrisPratt.of("abacabcabacad").lps())
                .containsExactly(0, 0, 1, 0, 1, 2, 0, 1, 2, 3, 4, 5, 0);
        assertThat(KnuthMorrisPratt.of("aaaa").lps()).containsExactly(0, 1, 2, 3);
        assertThat(KnuthMorrisPratt.of("").lps()).isEmpty();
    }

    @Test
    @DisplayName("LPS is computed once and handed out as a copy")
    void testLpsIsCopied() {
        Pattern<Character> p = Pattern.of("abab");
        int[] lps = p.lps();
        lps[3] = 99;
        assertThat(p.lps()).containsExactly(0, 0, 1, 2);
    }

    @Test
    @DisplayName("Pattern is an immutable snapshot of its source")
    void testPatternSnapshot() {
        List<String> src = new java.util.ArrayList<>(List.of("x", "y"));
        KnuthMorrisPratt<String> kmp = new KnuthMorrisPratt<>(src);
        src.set(0, "z");
        assertThat(kmp.pattern()).containsExactly("x", "y");
    }

    @Test
    @DisplayName("Scans a one-shot stream without materialising it")
    void testStreamsThroughIterator() {
        KnuthMorrisPratt<Character> kmp = KnuthMorrisPratt.of("aa");
        Iterator<Character> once = Stream.of('a', 'a', 'a', 'b', 'a', 'a').iterator();
        Iterable<Character> single = () -> once;
        assertThat(kmp.findAll(single).toIntArray()).containsExactly(0, 1, 4);
    }

    @Test
    @DisplayName("Word-level patterns")
    void testWordTokens() {
        List<String> text = List.of("to", "be", "or", "not", "to", "be");
        KnuthMorrisPratt<String> kmp = new KnuthMorrisPratt<>(List.of("to", "be"));
        assertThat(kmp.findAll(text).toIntArray()).containsExactly(0, 4);
        assertThat(KnuthMorrisPratt.of("b").findAll(Sequences.chars("abcb")).toIntArray()).containsExactly(1, 3);
    }
}
