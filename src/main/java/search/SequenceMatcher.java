package search;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.List;
import java.util.PrimitiveIterator;

/**
 * Exact single-pattern search over arbitrary element sequences. Elements are compared
 * with {@link java.util.Objects#equals(Object, Object)}.
 *
 * An empty pattern matches at every index of the text; a pattern longer than the text
 * never matches.
 */
public interface SequenceMatcher<T> {

    List<T> pattern();

    /**
     * Lazily yields every start index of the pattern in {@code text}, strictly ascending.
     * The iterator is forward-only; calling this method again performs a fresh scan.
     */
    PrimitiveIterator.OfInt matchStarts(Iterable<? extends T> text);

    default IntArrayList findAll(Iterable<? extends T> text) {
        IntArrayList out = new IntArrayList();
        PrimitiveIterator.OfInt it = matchStarts(text);
        while (it.hasNext()) {
            out.add(it.nextInt());
        }
        return out;
    }
}
