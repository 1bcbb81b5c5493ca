package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.commons.math3.util.Pair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StringAhoCorasickTest {

    @Test
    @DisplayName("String facade maps results back to words")
    void testSearch() {
        StringAhoCorasick ac = new StringAhoCorasick(List.of("a", "ab", "bab", "bc", "bca", "c", "caa"));
        Map<String, IntArrayList> found = ac.search("abccab");
        assertThat(found).containsOnlyKeys("a", "ab", "bc", "c");
        assertThat(found.get("a").toIntArray()).containsExactly(0, 4);
        assertThat(found.get("ab").toIntArray()).containsExactly(0, 4);
        assertThat(found.get("bc").toIntArray()).containsExactly(1);
        assertThat(found.get("c").toIntArray()).containsExactly(2, 3);
    }

    @Test
    @DisplayName("Words ending at a position are resolved from ids")
    void testWordsEndingAt() {
        StringAhoCorasick ac = new StringAhoCorasick(List.of("he", "she", "his", "hers"));
        EndIndexScanner<Character> scanner = ac.searchEndIndices("ushe");
        scanner.next();
        scanner.next();
        scanner.next();
        Pair<Integer, List<String>> last = ac.wordsEndingAt(scanner.next());
        assertThat(last.getFirst()).isEqualTo(3);
        assertThat(last.getSecond()).containsExactly("he", "she");
        assertThat(ac.words()).containsExactly("he", "she", "his", "hers");
        assertThat(ac.automaton().patternCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Length scanner over a string")
    void testLengths() {
        StringAhoCorasick ac = new StringAhoCorasick(List.of("aa", "a"));
        LengthScanner<Character> scanner = ac.searchLengths("aaa");
        assertThat(scanner.next().toIntArray()).containsExactly(1);
        assertThat(scanner.next().toIntArray()).containsExactly(1, 2);
        assertThat(scanner.next().toIntArray()).containsExactly(1, 2);
    }
}
