package search;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;

/**
 * Knuth-Morris-Pratt search. The text is consumed strictly forward through its iterator,
 * so arbitrarily long sequences can be scanned without buffering them.
 */
public final class KnuthMorrisPratt<T> implements SequenceMatcher<T> {

    private final Pattern<T> pattern;

    public KnuthMorrisPratt(Pattern<T> pattern) {
        this.pattern = Objects.requireNonNull(pattern, "pattern");
    }

    public KnuthMorrisPratt(List<? extends T> pattern) {
        this(Pattern.of(pattern));
    }

    public static KnuthMorrisPratt<Character> of(CharSequence pattern) {
        return new KnuthMorrisPratt<>(Pattern.of(pattern));
    }

    @Override
    public List<T> pattern() {
        return pattern.elements();
    }

    public int[] lps() {
        return pattern.lps();
    }

    @Override
    public PrimitiveIterator.OfInt matchStarts(Iterable<? extends T> text) {
        Objects.requireNonNull(text, "text");
        return new Scanner(text.iterator());
    }

    private final class Scanner implements PrimitiveIterator.OfInt {
        private final Iterator<? extends T> input;
        private final int m = pattern.size();
        private int i = -1;   // index of the last consumed text element
        private int j = 0;    // matched prefix length
        private int pending = -1;

        Scanner(Iterator<? extends T> input) {
            this.input = input;
        }

        @Override
        public boolean hasNext() {
            if (pending >= 0) {
                return true;
            }
            while (input.hasNext()) {
                T element = input.next();
                i++;
                if (m == 0) {
                    pending = i;
                    return true;
                }
                while (j > 0 && !Objects.equals(element, pattern.get(j))) {
                    j = pattern.lpsAt(j - 1);
                }
                if (Objects.equals(element, pattern.get(j))) {
                    j++;
                    if (j == m) {
                        pending = i - m + 1;
                        j = pattern.lpsAt(m - 1);
                        return true;
                    }
                }
            }
            return false;
        }

        @Override
        public int nextInt() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int out = pending;
            pending = -1;
            return out;
        }
    }
}
