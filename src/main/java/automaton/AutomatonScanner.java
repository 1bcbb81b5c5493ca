package automaton;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Folds {@link AhoCorasick#step} over a text iterator, producing one result per text
 * element. Single pass and forward only; to scan again ask the automaton for a new
 * scanner.
 */
public abstract class AutomatonScanner<T, R> implements Iterator<R> {

    protected final AhoCorasick<T> automaton;
    private final Iterator<? extends T> input;
    private int node = AhoCorasick.ROOT;
    private int position = -1;

    protected AutomatonScanner(AhoCorasick<T> automaton, Iterator<? extends T> input) {
        this.automaton = automaton;
        this.input = input;
    }

    @Override
    public boolean hasNext() {
        return input.hasNext();
    }

    @Override
    public R next() {
        if (!input.hasNext()) {
            throw new NoSuchElementException();
        }
        node = automaton.step(node, input.next());
        position++;
        return emit(position, node);
    }

    /** Index of the last consumed text element, -1 before the first call to next(). */
    public int position() {
        return position;
    }

    /** Automaton state after the last consumed element. */
    public int state() {
        return node;
    }

    protected abstract R emit(int position, int node);
}
