package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.commons.math3.util.Pair;

import java.util.BitSet;
import java.util.Iterator;

/** Yields (text index, ascending ids of the patterns whose occurrence ends at that index). */
public final class EndIndexScanner<T> extends AutomatonScanner<T, Pair<Integer, IntArrayList>> {

    EndIndexScanner(AhoCorasick<T> automaton, Iterator<? extends T> input) {
        super(automaton, input);
    }

    @Override
    protected Pair<Integer, IntArrayList> emit(int position, int node) {
        BitSet bm = automaton.matchesAt(node);
        IntArrayList ids = new IntArrayList(bm.cardinality());
        for (int k = bm.nextSetBit(0); k >= 0; k = bm.nextSetBit(k + 1)) {
            ids.add(k);
        }
        return new Pair<>(position, ids);
    }
}
