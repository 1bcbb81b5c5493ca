package palindromes;

import datagenerators.TextGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import search.BruteForce;
import utilities.Sequences;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ManacherTest {

    @Test
    @DisplayName("Radii of a sample string")
    void testRadii() {
        assertThat(Manacher.radii("ebabad")).containsExactly(0, 0, 1, 1, 0, 0);
        assertThat(Manacher.radii("")).isEmpty();
        assertThat(Manacher.radii("aaaaa")).containsExactly(0, 1, 2, 1, 0);
    }

    @Test
    @DisplayName("Radii agree with brute force, plain and interleaved")
    void testRadiiBruteForce() {
        TextGenerator gen = new TextGenerator(5L);
        for (int round = 0; round < 200; round++) {
            List<Character> s = Sequences.chars(gen.uniform(gen.nextInt(40), 1 + gen.nextInt(3)));
            assertThat(Manacher.radii(s)).isEqualTo(BruteForce.radii(s));
            List<Object> inter = Manacher.interleave(s);
            assertThat(Manacher.radii(inter)).isEqualTo(BruteForce.radii(inter));
        }
    }

    @Test
    @DisplayName("Interleaving wraps every element in separators")
    void testInterleave() {
        List<Object> inter = Manacher.interleave(Sequences.chars("ab"));
        assertThat(inter).hasSize(5);
        assertThat(inter.get(1)).isEqualTo('a');
        assertThat(inter.get(3)).isEqualTo('b');
        assertThat(inter.get(0)).isSameAs(inter.get(2));
        assertThat(inter.toString()).isEqualTo("[#, a, #, b, #]");
    }

    @Test
    @DisplayName("All longest palindromic substrings in order of position")
    void testLongest() {
        assertThat(Manacher.longestPalindromicSubstrings("ebabad")).containsExactly("bab", "aba");
        assertThat(Manacher.longestPalindromicSubstrings("cbbd")).containsExactly("bb");
        assertThat(Manacher.longestPalindromicSubstrings("abc")).containsExactly("a", "b", "c");
        assertThat(Manacher.longestPalindromicSubstrings("")).containsExactly("");
        assertThat(Manacher.longestPalindrome("forgeeksskeegfor")).isEqualTo("geeksskeeg");
        assertThat(Manacher.longestPalindrome("ebabad")).isEqualTo("bab");
    }

    @Test
    @DisplayName("Longest palindromes over generic elements")
    void testLongestGeneric() {
        assertThat(Manacher.longestPalindromicRuns(List.of(1, 2, 3, 2, 1, 9)))
                .containsExactly(List.of(1, 2, 3, 2, 1));
        assertThat(Manacher.longestPalindromicRuns(List.<Integer>of()))
                .containsExactly(List.of());
        assertThat(Manacher.longestPalindromicRuns(List.of("to", "be", "be", "to", "or")))
                .containsExactly(List.of("to", "be", "be", "to"));
    }

    @Test
    @DisplayName("Palindromic substring count")
    void testCount() {
        assertThat(Manacher.countPalindromicSubstrings("ebabad")).isEqualTo(8L);
        assertThat(Manacher.countPalindromicSubstrings("aaa")).isEqualTo(6L);
        assertThat(Manacher.countPalindromicSubstrings("")).isZero();
        assertThat(Manacher.countPalindromicRuns(List.of(1, 1, 2))).isEqualTo(4L);
        TextGenerator gen = new TextGenerator(8L);
        for (int round = 0; round < 100; round++) {
            String s = gen.uniform(gen.nextInt(30), 1 + gen.nextInt(3));
            assertThat(Manacher.countPalindromicSubstrings(s)).as(s).isEqualTo(BruteForce.countPalindromes(s));
        }
    }
}
