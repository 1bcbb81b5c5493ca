package search;

import utilities.Sequences;

import java.util.List;
import java.util.Objects;

/**
 * An immutable search pattern together with its prefix function (the KMP
 * longest-proper-prefix-that-is-also-a-suffix table), computed once at construction.
 */
public final class Pattern<T> {
    private final List<T> elements;
    private final int[] pi;

    private Pattern(List<T> elements) {
        this.elements = elements;
        this.pi = prefixFunction(elements);
    }

    public static <T> Pattern<T> of(List<? extends T> elements) {
        return new Pattern<>(Sequences.freeze(elements));
    }

    public static Pattern<Character> of(CharSequence s) {
        return new Pattern<>(Sequences.freeze(Sequences.chars(s)));
    }

    public List<T> elements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public T get(int i) {
        return elements.get(i);
    }

    // pi[i] = length of the longest proper prefix of elements[0..i] that is also its suffix.
    public int[] lps() {
        return pi.clone();
    }

    int lpsAt(int i) {
        return pi[i];
    }

    @Override
    public String toString() {
        return "Pattern" + elements;
    }

    static <T> int[] prefixFunction(List<T> text) {
        int[] pi = new int[text.size()];
        int k = 0;
        for (int i = 1; i < text.size(); ++i) {
            while (k > 0 && !Objects.equals(text.get(k), text.get(i))) k = pi[k - 1];
            if (Objects.equals(text.get(k), text.get(i))) ++k;
            pi[i] = k;
        }
        return pi;
    }
}
