package hashing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import utilities.MatcherConfiguration;
import utilities.Sequences;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollingHashTest {

    private final MatcherConfiguration config = MatcherConfiguration.defaults();

    @Test
    @DisplayName("Every window hash equals the hash of the window computed from scratch")
    void testSlidingMatchesDirectHash() {
        String text = "the quick brown fox jumps over the lazy dog";
        for (int length = 1; length <= 6; length++) {
            RollingHash<Character> windows = RollingHash.of(Sequences.chars(text), length);
            int start = 0;
            while (windows.hasNext()) {
                long[] expected = RollingHash.hashOf(Sequences.chars(text.substring(start, start + length)),
                        config, ElementKeyMapper.DEFAULT);
                assertThat(windows.next()).as("length=%d start=%d", length, start).isEqualTo(expected);
                start++;
            }
            assertThat(start).isEqualTo(text.length() - length + 1);
        }
    }

    @Test
    @DisplayName("Single window hash follows the polynomial definition")
    void testPolynomialDefinition() {
        MatcherConfiguration single = MatcherConfiguration.builder()
                .rollingBases(31L)
                .rollingModulus(1_000_000_007L)
                .build();
        RollingHash<Integer> windows = RollingHash.of(List.of(1, 2, 3), 3, single);
        assertThat(windows.next()).containsExactly(31L * 31L + 2L * 31L + 3L);
        assertThat(windows.hasNext()).isFalse();
    }

    @Test
    @DisplayName("Equal windows hash equally regardless of position")
    void testEqualWindowsEqualHashes() {
        List<long[]> hashes = new ArrayList<>();
        RollingHash.of(Sequences.chars("abcXabc"), 3).forEachRemaining(hashes::add);
        assertThat(hashes).hasSize(5);
        assertThat(hashes.get(0)).isEqualTo(hashes.get(4));
        assertThat(hashes.get(0)).isNotEqualTo(hashes.get(1));
    }

    @Test
    @DisplayName("Text shorter than the window yields nothing")
    void testShortText() {
        RollingHash<Character> windows = RollingHash.of(Sequences.chars("ab"), 3);
        assertThat(windows.hasNext()).isFalse();
        assertThatThrownBy(windows::next).isInstanceOf(java.util.NoSuchElementException.class);
    }

    @Test
    @DisplayName("Non-positive window length is rejected")
    void testInvalidLength() {
        assertThatThrownBy(() -> RollingHash.of(Sequences.chars("abc"), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RollingHash.of(Sequences.chars("abc"), -2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Modular exponentiation")
    void testPowMod() {
        assertThat(RollingHash.powMod(2, 10, 1_000_000_007L)).isEqualTo(1024L);
        assertThat(RollingHash.powMod(7, 0, 13)).isEqualTo(1L);
        assertThat(RollingHash.powMod(3, 4, 5)).isEqualTo(1L);
    }
}
