package utilities;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

public final class Sequences {
    private Sequences() {
        throw new AssertionError("Sequences must not be instantiated");
    }

    // Read-only List<Character> view over a CharSequence; no copy is made.
    public static List<Character> chars(CharSequence csq) {
        Objects.requireNonNull(csq, "csq");
        return new CharListView(csq);
    }

    // Materialises any Iterable into a List, returning it as-is when it already is one.
    @SuppressWarnings("unchecked")
    public static <T> List<T> asList(Iterable<? extends T> items) {
        Objects.requireNonNull(items, "items");
        if (items instanceof List<?>) {
            return (List<T>) items;
        }
        ArrayList<T> out = new ArrayList<>();
        for (T item : items) {
            out.add(item);
        }
        return out;
    }

    // Unmodifiable snapshot of a pattern.
    public static <T> List<T> freeze(List<? extends T> items) {
        Objects.requireNonNull(items, "items");
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    private static final class CharListView extends AbstractList<Character> implements RandomAccess {
        private final CharSequence csq;

        CharListView(CharSequence csq) {
            this.csq = csq;
        }

        @Override
        public Character get(int index) {
            return csq.charAt(index);
        }

        @Override
        public int size() {
            return csq.length();
        }
    }
}
