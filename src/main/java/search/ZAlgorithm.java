package search;

import utilities.Sequences;

import java.util.AbstractList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.RandomAccess;

/**
 * Z-algorithm search. The Z-array is computed over {@code pattern + SEPARATOR + text};
 * the separator equals no element, so no position can match across it.
 */
public final class ZAlgorithm<T> implements SequenceMatcher<T> {

    private static final Object SEPARATOR = new Object() {
        @Override
        public String toString() {
            return "$";
        }
    };

    private final List<T> pattern;

    public ZAlgorithm(List<? extends T> pattern) {
        this.pattern = Sequences.freeze(pattern);
    }

    public static ZAlgorithm<Character> of(CharSequence pattern) {
        return new ZAlgorithm<>(Sequences.chars(pattern));
    }

    @Override
    public List<T> pattern() {
        return pattern;
    }

    /**
     * z[i] is the length of the longest run starting at i that equals a prefix of
     * {@code s}; by convention z[0] = |s|.
     */
    public static int[] zArray(List<?> s) {
        Objects.requireNonNull(s, "s");
        int n = s.size();
        int[] z = new int[n];
        if (n == 0) {
            return z;
        }
        int left = 0;
        int right = 0; // [left, right) is the rightmost window known to match a prefix
        for (int i = 1; i < n; i++) {
            if (i < right) {
                z[i] = Math.min(right - i, z[i - left]);
            }
            while (i + z[i] < n && Objects.equals(s.get(z[i]), s.get(i + z[i]))) {
                z[i]++;
            }
            if (i + z[i] > right) {
                left = i;
                right = i + z[i];
            }
        }
        z[0] = n;
        return z;
    }

    public static int[] zArray(CharSequence s) {
        return zArray(Sequences.chars(s));
    }

    @Override
    public PrimitiveIterator.OfInt matchStarts(Iterable<? extends T> text) {
        List<? extends T> t = Sequences.asList(text);
        final int m = pattern.size();
        final int[] z = zArray(new Joined(pattern, t));
        return new PrimitiveIterator.OfInt() {
            private int i = nextMatch(0);

            private int nextMatch(int from) {
                for (int k = from; k < t.size() && k + m <= t.size(); k++) {
                    if (z[m + 1 + k] >= m) {
                        return k;
                    }
                }
                return -1;
            }

            @Override
            public boolean hasNext() {
                return i >= 0;
            }

            @Override
            public int nextInt() {
                if (i < 0) {
                    throw new NoSuchElementException();
                }
                int out = i;
                i = nextMatch(i + 1);
                return out;
            }
        };
    }

    // pattern, SEPARATOR, text as one read-only list without copying either side.
    private static final class Joined extends AbstractList<Object> implements RandomAccess {
        private final List<?> head;
        private final List<?> tail;

        Joined(List<?> head, List<?> tail) {
            this.head = head;
            this.tail = tail;
        }

        @Override
        public Object get(int index) {
            int h = head.size();
            if (index < h) return head.get(index);
            if (index == h) return SEPARATOR;
            return tail.get(index - h - 1);
        }

        @Override
        public int size() {
            return head.size() + 1 + tail.size();
        }
    }
}
