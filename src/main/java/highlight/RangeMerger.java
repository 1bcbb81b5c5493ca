package highlight;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Two-stage merge of match ranges.
 *
 * First every pattern's occurrences are merged on their own: they all have the same
 * length and arrive in ascending start order, so a single sweep suffices. Then the
 * per-pattern lists are combined with a k-way merge driven by a min-heap holding one
 * frontier cursor per pattern that still has ranges left.
 */
public final class RangeMerger {

    private RangeMerger() {
    }

    /**
     * Merges the occurrences of one pattern of length {@code length} starting at the
     * ascending {@code starts} into disjoint, non-touching ranges. Zero-length occurrences
     * cover nothing and are dropped.
     */
    public static List<MatchRange> mergePerPattern(IntList starts, int length, int patternId) {
        List<MatchRange> out = new ArrayList<>();
        if (length <= 0 || starts.isEmpty()) {
            return out;
        }
        int curStart = starts.getInt(0);
        int curEnd = curStart + length;
        for (int i = 1; i < starts.size(); i++) {
            int s = starts.getInt(i);
            if (s <= curEnd) {
                curEnd = Math.max(curEnd, s + length);
            } else {
                out.add(new MatchRange(curStart, curEnd, patternId));
                curStart = s;
                curEnd = s + length;
            }
        }
        out.add(new MatchRange(curStart, curEnd, patternId));
        return out;
    }

    /**
     * Union of the per-pattern range lists (each ascending and disjoint) as ascending,
     * maximal spans: no two returned spans overlap or touch.
     */
    public static List<MatchRange> union(List<List<MatchRange>> perPattern) {
        // heap order: earliest start, then longest range, then lowest list index
        PriorityQueue<Cursor> heap = new PriorityQueue<>(
                Math.max(1, perPattern.size()),
                Comparator.<Cursor>comparingInt(c -> c.range().start())
                        .thenComparing(Comparator.<Cursor>comparingInt(c -> c.range().end()).reversed())
                        .thenComparingInt(Cursor::list));
        for (int i = 0; i < perPattern.size(); i++) {
            List<MatchRange> ranges = perPattern.get(i);
            if (!ranges.isEmpty()) {
                heap.add(new Cursor(i, 0, ranges.get(0)));
            }
        }

        List<MatchRange> spans = new ArrayList<>();
        if (heap.isEmpty()) {
            return spans;
        }
        Cursor first = heap.poll();
        int activeStart = first.range().start();
        int activeEnd = first.range().end();
        advance(heap, perPattern, first);

        while (!heap.isEmpty()) {
            Cursor c = heap.poll();
            MatchRange r = c.range();
            if (r.start() <= activeEnd) {
                activeEnd = Math.max(activeEnd, r.end());
            } else {
                spans.add(new MatchRange(activeStart, activeEnd, MatchRange.MERGED));
                activeStart = r.start();
                activeEnd = r.end();
            }
            advance(heap, perPattern, c);
        }
        spans.add(new MatchRange(activeStart, activeEnd, MatchRange.MERGED));
        return spans;
    }

    private static void advance(PriorityQueue<Cursor> heap, List<List<MatchRange>> perPattern, Cursor c) {
        List<MatchRange> ranges = perPattern.get(c.list());
        int next = c.index() + 1;
        if (next < ranges.size()) {
            heap.add(new Cursor(c.list(), next, ranges.get(next)));
        }
    }

    // Position of the next unconsumed range in perPattern.get(list).
    private record Cursor(int list, int index, MatchRange range) {
    }
}
