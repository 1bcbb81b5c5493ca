package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.BitSet;
import java.util.Iterator;

/**
 * Yields, per text index, the ascending distinct lengths of the patterns ending there.
 * Patterns of equal length are indistinguishable here; use {@link EndIndexScanner} when
 * identities matter.
 */
public final class LengthScanner<T> extends AutomatonScanner<T, IntArrayList> {

    LengthScanner(AhoCorasick<T> automaton, Iterator<? extends T> input) {
        super(automaton, input);
    }

    @Override
    protected IntArrayList emit(int position, int node) {
        BitSet bm = automaton.lengthsAt(node);
        IntArrayList lengths = new IntArrayList(bm.cardinality());
        for (int len = bm.nextSetBit(0); len >= 0; len = bm.nextSetBit(len + 1)) {
            lengths.add(len);
        }
        return lengths;
    }
}
