package hashing;

import datagenerators.TextGenerator;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import search.KnuthMorrisPratt;
import utilities.MatcherConfiguration;
import utilities.Sequences;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RollingHashSearchTest {

    @Test
    @DisplayName("Multi-pattern search groups patterns by length")
    void testSearchAll() {
        Map<String, IntArrayList> found = RollingHashSearch.searchAll("ahishers",
                List.of("he", "she", "his", "hers", "xyz", ""));
        assertThat(found).containsOnlyKeys("he", "she", "his", "hers");
        assertThat(found.get("he").toIntArray()).containsExactly(4);
        assertThat(found.get("she").toIntArray()).containsExactly(3);
        assertThat(found.get("his").toIntArray()).containsExactly(1);
        assertThat(found.get("hers").toIntArray()).containsExactly(4);
    }

    @Test
    @DisplayName("Duplicate patterns are reported once")
    void testDuplicatePatterns() {
        Map<String, IntArrayList> found = RollingHashSearch.searchAll("aaaa", List.of("aa", "aa"));
        assertThat(found).containsOnlyKeys("aa");
        assertThat(found.get("aa").toIntArray()).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("A tiny modulus forces collisions which verification filters out")
    void testCollisionsAreVerified() {
        MatcherConfiguration weak = MatcherConfiguration.builder()
                .rollingBases(2L)
                .rollingModulus(3L)
                .build();
        RollingHashSearch<Character> search =
                new RollingHashSearch<>(Sequences.chars("ab"), weak, ElementKeyMapper.DEFAULT);
        String text = "abcabdbaabba";
        assertThat(search.findAll(Sequences.chars(text)).toIntArray())
                .isEqualTo(KnuthMorrisPratt.of("ab").findAll(Sequences.chars(text)).toIntArray());
    }

    @Test
    @DisplayName("Multi-pattern results agree with KMP on random input")
    void testSearchAllAgreesWithKmp() {
        TextGenerator gen = new TextGenerator(7L);
        for (int round = 0; round < 40; round++) {
            String text = gen.uniform(80, 3);
            List<String> patterns = gen.patterns(text, 8, 5, 3);
            Map<String, IntArrayList> found = RollingHashSearch.searchAll(text, patterns);
            for (String p : patterns) {
                IntArrayList expected = KnuthMorrisPratt.of(p).findAll(Sequences.chars(text));
                if (expected.isEmpty()) {
                    assertThat(found).doesNotContainKey(p);
                } else {
                    assertThat(found.get(p).toIntArray()).as("pattern %s", p).isEqualTo(expected.toIntArray());
                }
            }
        }
    }
}
