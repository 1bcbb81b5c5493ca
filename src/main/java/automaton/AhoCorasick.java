package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import utilities.MatchLogger;
import utilities.MatcherConfiguration;
import utilities.Sequences;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aho-Corasick automaton over an arbitrary element type.
 *
 * Construction inserts every pattern into a trie, then computes failure links breadth
 * first. While doing so each node's match set (ids of the patterns ending at the node,
 * directly or through its failure chain) and length set (lengths of those patterns) are
 * closed over the failure link, so a scan only ever reads the set of the current node.
 * Both sets are growable {@link BitSet}s, which places no ceiling on the pattern count
 * apart from the optional {@link MatcherConfiguration#maxPatterns()}.
 *
 * Instances are immutable after {@link #build} returns and may be scanned concurrently;
 * the scanners themselves carry per-caller state and must not be shared.
 */
public final class AhoCorasick<T> {

    public static final int ROOT = 0;
    // returned by Object2IntOpenHashMap lookups for a missing edge
    static final int NO_EDGE = -1;

    private final List<List<T>> patterns;
    private final int[] patternLengths;
    // id of the first pattern equal to each pattern; search() reports per distinct pattern
    private final int[] canonicalIds;

    private final Object2IntOpenHashMap<T>[] transitions;
    private final int[] failure;
    private final BitSet[] matchBits;
    private final BitSet[] lengthBits;

    private AhoCorasick(List<List<T>> patterns,
                        int[] canonicalIds,
                        Object2IntOpenHashMap<T>[] transitions,
                        int[] failure,
                        BitSet[] matchBits,
                        BitSet[] lengthBits) {
        this.patterns = patterns;
        this.patternLengths = new int[patterns.size()];
        for (int i = 0; i < patterns.size(); i++) {
            patternLengths[i] = patterns.get(i).size();
        }
        this.canonicalIds = canonicalIds;
        this.transitions = transitions;
        this.failure = failure;
        this.matchBits = matchBits;
        this.lengthBits = lengthBits;
    }

    public static <T> AhoCorasick<T> build(List<? extends List<? extends T>> patterns) {
        return build(patterns, MatcherConfiguration.defaults());
    }

    @SuppressWarnings("unchecked")
    public static <T> AhoCorasick<T> build(List<? extends List<? extends T>> patterns, MatcherConfiguration config) {
        Objects.requireNonNull(patterns, "patterns");
        Objects.requireNonNull(config, "config");
        if (patterns.size() > config.maxPatterns()) {
            MatchLogger.warning("Rejecting " + patterns.size() + " patterns, ceiling is " + config.maxPatterns());
            throw new IllegalArgumentException("pattern count " + patterns.size()
                    + " exceeds configured maxPatterns " + config.maxPatterns());
        }

        List<List<T>> frozen = new ArrayList<>(patterns.size());
        int[] canonical = new int[patterns.size()];
        Map<List<T>, Integer> firstId = new HashMap<>();
        for (int i = 0; i < patterns.size(); i++) {
            List<T> p = Sequences.freeze(Objects.requireNonNull(patterns.get(i), "pattern " + i));
            frozen.add(p);
            Integer first = firstId.putIfAbsent(p, i);
            canonical[i] = (first == null) ? i : first;
        }

        ObjectArrayList<Object2IntOpenHashMap<T>> goTo = new ObjectArrayList<>();
        ObjectArrayList<BitSet> out = new ObjectArrayList<>();
        ObjectArrayList<BitSet> outLens = new ObjectArrayList<>();
        goTo.add(newEdgeMap());
        out.add(new BitSet());
        outLens.add(new BitSet());

        // Phase 1: trie
        for (int i = 0; i < frozen.size(); i++) {
            List<T> word = frozen.get(i);
            int j = ROOT;
            for (T element : word) {
                int next = goTo.get(j).getInt(element);
                if (next == NO_EDGE) {
                    next = goTo.size();
                    goTo.get(j).put(element, next);
                    goTo.add(newEdgeMap());
                    out.add(new BitSet());
                    outLens.add(new BitSet());
                }
                j = next;
            }
            out.get(j).set(i);
            outLens.get(j).set(word.size());
        }

        // Phase 2: failure links, BFS from the root's children
        int n = goTo.size();
        int[] fail = new int[n];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        for (Object2IntMap.Entry<T> e : goTo.get(ROOT).object2IntEntrySet()) {
            int child = e.getIntValue();
            fail[child] = ROOT;
            out.get(child).or(out.get(ROOT));
            outLens.get(child).or(outLens.get(ROOT));
            queue.enqueue(child);
        }
        while (!queue.isEmpty()) {
            int j = queue.dequeueInt();
            for (Object2IntMap.Entry<T> e : goTo.get(j).object2IntEntrySet()) {
                T element = e.getKey();
                int child = e.getIntValue();
                int f = fail[j];
                while (f != ROOT && !goTo.get(f).containsKey(element)) {
                    f = fail[f];
                }
                int target = goTo.get(f).getInt(element);
                f = (target == NO_EDGE) ? ROOT : target;
                fail[child] = f;
                // f is strictly shallower than child, so its sets are already closed
                out.get(child).or(out.get(f));
                outLens.get(child).or(outLens.get(f));
                queue.enqueue(child);
            }
        }

        for (Object2IntOpenHashMap<T> edges : goTo) {
            edges.trim();
        }

        AhoCorasick<T> ac = new AhoCorasick<>(
                Collections.unmodifiableList(frozen),
                canonical,
                goTo.toArray(new Object2IntOpenHashMap[0]),
                fail,
                out.toArray(new BitSet[0]),
                outLens.toArray(new BitSet[0]));

        String stats = "Built Aho-Corasick automaton: patterns=" + frozen.size() + " nodes=" + n;
        if (config.logBuildStats()) {
            MatchLogger.info(stats);
        } else {
            MatchLogger.debug(stats);
        }
        return ac;
    }

    /** Convenience for character patterns; see also {@link StringAhoCorasick}. */
    public static AhoCorasick<Character> forStrings(List<String> words) {
        return forStrings(words, MatcherConfiguration.defaults());
    }

    public static AhoCorasick<Character> forStrings(List<String> words, MatcherConfiguration config) {
        Objects.requireNonNull(words, "words");
        List<List<Character>> charPatterns = new ArrayList<>(words.size());
        for (String w : words) {
            charPatterns.add(Sequences.chars(w));
        }
        return build(charPatterns, config);
    }

    private static <T> Object2IntOpenHashMap<T> newEdgeMap() {
        Object2IntOpenHashMap<T> edges = new Object2IntOpenHashMap<>(4);
        edges.defaultReturnValue(NO_EDGE);
        return edges;
    }

    /**
     * The goto function: follows the direct edge on {@code element} if there is one,
     * otherwise falls back along failure links; returns the root when no suffix of the
     * current path extended by {@code element} is a trie path.
     */
    public int step(int node, T element) {
        int j = node;
        while (j != ROOT && !transitions[j].containsKey(element)) {
            j = failure[j];
        }
        int next = transitions[j].getInt(element);
        return next == NO_EDGE ? ROOT : next;
    }

    /**
     * Start indices of every pattern in {@code text}. Keys are the distinct patterns that
     * occur, in order of first occurrence; each list is strictly ascending. Identical
     * patterns share one key.
     */
    public Map<List<T>, IntArrayList> search(Iterable<? extends T> text) {
        Objects.requireNonNull(text, "text");
        IntArrayList[] starts = new IntArrayList[patterns.size()];
        IntArrayList firstSeen = new IntArrayList();
        int j = ROOT;
        int i = 0;
        for (T element : text) {
            j = step(j, element);
            BitSet bm = matchBits[j];
            for (int k = bm.nextSetBit(0); k >= 0; k = bm.nextSetBit(k + 1)) {
                if (canonicalIds[k] != k) {
                    continue;
                }
                int length = patternLengths[k];
                // the empty pattern is reported before every element
                int start = length == 0 ? i : i - length + 1;
                if (starts[k] == null) {
                    starts[k] = new IntArrayList();
                    firstSeen.add(k);
                }
                starts[k].add(start);
            }
            i++;
        }
        Map<List<T>, IntArrayList> res = new LinkedHashMap<>(Math.max(16, firstSeen.size() * 2));
        for (int n = 0; n < firstSeen.size(); n++) {
            int k = firstSeen.getInt(n);
            res.put(patterns.get(k), starts[k]);
        }
        return res;
    }

    /** Lazily yields, per text position, the ids of the patterns whose match ends there. */
    public EndIndexScanner<T> searchEndIndices(Iterable<? extends T> text) {
        Objects.requireNonNull(text, "text");
        return new EndIndexScanner<>(this, text.iterator());
    }

    /** Lazily yields, per text position, the distinct lengths of the patterns ending there. */
    public LengthScanner<T> searchLengths(Iterable<? extends T> text) {
        Objects.requireNonNull(text, "text");
        return new LengthScanner<>(this, text.iterator());
    }

    public EndIndexScanner<T> searchEndIndices(Iterator<? extends T> text) {
        return new EndIndexScanner<>(this, Objects.requireNonNull(text, "text"));
    }

    public LengthScanner<T> searchLengths(Iterator<? extends T> text) {
        return new LengthScanner<>(this, Objects.requireNonNull(text, "text"));
    }

    // ---- read-only views used by the scanners; no copies ----

    BitSet matchesAt(int node) {
        return matchBits[node];
    }

    BitSet lengthsAt(int node) {
        return lengthBits[node];
    }

    // ---- introspection ----

    public int nodeCount() {
        return transitions.length;
    }

    public int patternCount() {
        return patterns.size();
    }

    public List<T> pattern(int id) {
        return patterns.get(id);
    }

    public List<List<T>> patterns() {
        return patterns;
    }

    public int patternLength(int id) {
        return patternLengths[id];
    }

    public int failure(int node) {
        return failure[node];
    }

    /** Direct trie edge from {@code node} on {@code element}, or -1 if there is none. */
    public int child(int node, T element) {
        return transitions[node].getInt(element);
    }

    public BitSet matchBits(int node) {
        return (BitSet) matchBits[node].clone();
    }

    public BitSet lengthBits(int node) {
        return (BitSet) lengthBits[node].clone();
    }

    @Override
    public String toString() {
        return "AhoCorasick{patterns=" + patterns.size() + ", nodes=" + transitions.length + "}";
    }
}
