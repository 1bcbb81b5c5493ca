package palindromes;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import utilities.Sequences;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Manacher's algorithm and the palindrome queries built on it.
 *
 * {@link #radii} gives, per centre, half the length (rounded down) of the longest
 * odd-length palindrome centred there. Running it over the {@link #interleave interleaved}
 * sequence {@code # s0 # s1 # ... # s(n-1) #} covers even-length palindromes too: the
 * radius at any position of the interleaved sequence equals the length of the
 * corresponding palindrome in the input.
 */
public final class Manacher {

    private static final Object SEPARATOR = new Object() {
        @Override
        public String toString() {
            return "#";
        }
    };

    private Manacher() {
        throw new AssertionError("Manacher must not be instantiated");
    }

    public static int[] radii(List<?> s) {
        Objects.requireNonNull(s, "s");
        int n = s.size();
        int[] res = new int[n];
        int centre = 0;
        int right = 0; // rightmost index covered by the palindrome around centre
        for (int i = 0; i < n; i++) {
            if (i < right) {
                int mirror = (centre << 1) - i;
                res[i] = Math.min(res[mirror], right - i);
            }
            while (i - res[i] - 1 >= 0 && i + res[i] + 1 < n
                    && Objects.equals(s.get(i + res[i] + 1), s.get(i - res[i] - 1))) {
                res[i]++;
            }
            if (i + res[i] > right) {
                right = i + res[i];
                centre = i;
            }
        }
        return res;
    }

    public static int[] radii(CharSequence s) {
        return radii(Sequences.chars(s));
    }

    /** {@code # s0 # s1 ... # s(n-1) #}, length 2n + 1; the separator equals no element. */
    public static List<Object> interleave(List<?> s) {
        Objects.requireNonNull(s, "s");
        return new Interleaved(s);
    }

    /**
     * All palindromic runs (contiguous sublists) of maximal length, in order of position.
     * An empty input yields a single empty run.
     */
    public static <T> List<List<T>> longestPalindromicRuns(List<T> s) {
        Objects.requireNonNull(s, "s");
        List<List<T>> res = new ArrayList<>();
        if (s.isEmpty()) {
            res.add(List.of());
            return res;
        }
        int[] arr = radii(interleave(s));
        int maxLen = -1;
        IntArrayList centres = new IntArrayList();
        for (int i = 0; i < arr.length; i++) {
            int num = arr[i];
            if (num < maxLen) continue;
            if (num > maxLen) {
                maxLen = num;
                centres.clear();
            }
            centres.add(i);
        }
        for (int k = 0; k < centres.size(); k++) {
            int start = (centres.getInt(k) - maxLen) >> 1;
            res.add(s.subList(start, start + maxLen));
        }
        return res;
    }

    public static List<String> longestPalindromicSubstrings(String s) {
        Objects.requireNonNull(s, "s");
        List<List<Character>> runs = longestPalindromicRuns(Sequences.chars(s));
        List<String> res = new ArrayList<>(runs.size());
        for (List<Character> run : runs) {
            StringBuilder sb = new StringBuilder(run.size());
            for (Character c : run) {
                sb.append(c.charValue());
            }
            res.add(sb.toString());
        }
        return res;
    }

    /** The longest palindromic substring; the leftmost one on ties. */
    public static String longestPalindrome(String s) {
        return longestPalindromicSubstrings(s).get(0);
    }

    /** Number of (start, end) pairs delimiting a palindromic substring. */
    public static long countPalindromicSubstrings(CharSequence s) {
        return countPalindromicRuns(Sequences.chars(s));
    }

    public static long countPalindromicRuns(List<?> s) {
        long total = 0;
        for (int r : radii(interleave(s))) {
            total += (r + 1) >> 1;
        }
        return total;
    }

    private static final class Interleaved extends AbstractList<Object> implements RandomAccess {
        private final List<?> s;

        Interleaved(List<?> s) {
            this.s = s;
        }

        @Override
        public Object get(int index) {
            if (index < 0 || index >= size()) {
                throw new IndexOutOfBoundsException("index " + index);
            }
            return (index & 1) == 0 ? SEPARATOR : s.get(index >> 1);
        }

        @Override
        public int size() {
            return (s.size() << 1) + 1;
        }
    }
}
