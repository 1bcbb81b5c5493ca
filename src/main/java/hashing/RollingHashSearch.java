package hashing;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import search.SequenceMatcher;
import utilities.MatcherConfiguration;
import utilities.Sequences;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.PrimitiveIterator;
import java.util.function.ToLongFunction;
import java.util.stream.IntStream;

/**
 * Rabin-Karp style search over {@link RollingHash} windows. With the default
 * configuration two bases are used (double hashing); a window whose every hash equals the
 * pattern's is compared element by element, so reported matches are always exact.
 */
public final class RollingHashSearch<T> implements SequenceMatcher<T> {

    private final List<T> pattern;
    private final MatcherConfiguration config;
    private final ToLongFunction<Object> mapper;
    private final long[] patternHash;

    public RollingHashSearch(List<? extends T> pattern, MatcherConfiguration config, ToLongFunction<Object> mapper) {
        this.pattern = Sequences.freeze(pattern);
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.patternHash = RollingHash.hashOf(this.pattern, config, mapper);
    }

    public RollingHashSearch(List<? extends T> pattern) {
        this(pattern, MatcherConfiguration.defaults(), ElementKeyMapper.DEFAULT);
    }

    public static RollingHashSearch<Character> of(CharSequence pattern) {
        return new RollingHashSearch<>(Sequences.chars(pattern));
    }

    @Override
    public List<T> pattern() {
        return pattern;
    }

    @Override
    public PrimitiveIterator.OfInt matchStarts(Iterable<? extends T> text) {
        List<? extends T> t = Sequences.asList(text);
        final int m = pattern.size();
        if (m == 0) {
            return IntStream.range(0, t.size()).iterator();
        }
        final RollingHash<T> windows = new RollingHash<>(t, m, config, mapper);
        return new PrimitiveIterator.OfInt() {
            private int start = -1;     // start index of the last window pulled
            private int pending = -1;

            @Override
            public boolean hasNext() {
                if (pending >= 0) {
                    return true;
                }
                while (windows.hasNext()) {
                    long[] h = windows.next();
                    start++;
                    if (Arrays.equals(h, patternHash) && regionEquals(t, start, pattern)) {
                        pending = start;
                        return true;
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
        };
    }

    /**
     * Finds every pattern at once: patterns are grouped by length and each distinct length
     * costs one rolling pass over the text. Keys of the result are the distinct patterns
     * that occur at least once, each mapped to its ascending start indices. Empty patterns
     * are ignored.
     */
    public static <T> Map<List<T>, IntArrayList> searchAll(List<? extends T> text,
                                                           List<? extends List<? extends T>> patterns,
                                                           MatcherConfiguration config,
                                                           ToLongFunction<Object> mapper) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(patterns, "patterns");

        // length -> (first hash component -> candidates)
        Int2ObjectLinkedOpenHashMap<Long2ObjectOpenHashMap<List<HashedPattern<T>>>> byLength =
                new Int2ObjectLinkedOpenHashMap<>();
        for (List<? extends T> p : patterns) {
            if (p.isEmpty() || p.size() > text.size()) {
                continue;
            }
            List<T> frozen = Sequences.freeze(p);
            long[] h = RollingHash.hashOf(frozen, config, mapper);
            Long2ObjectOpenHashMap<List<HashedPattern<T>>> buckets = byLength.get(frozen.size());
            if (buckets == null) {
                buckets = new Long2ObjectOpenHashMap<>();
                byLength.put(frozen.size(), buckets);
            }
            List<HashedPattern<T>> bucket = buckets.get(h[0]);
            if (bucket == null) {
                bucket = new ArrayList<>(1);
                buckets.put(h[0], bucket);
            }
            boolean duplicate = false;
            for (HashedPattern<T> hp : bucket) {
                if (hp.elements().equals(frozen)) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) {
                bucket.add(new HashedPattern<>(frozen, h));
            }
        }

        Map<List<T>, IntArrayList> res = new LinkedHashMap<>();
        for (Int2ObjectMap.Entry<Long2ObjectOpenHashMap<List<HashedPattern<T>>>> e
                : byLength.int2ObjectEntrySet()) {
            int length = e.getIntKey();
            Long2ObjectOpenHashMap<List<HashedPattern<T>>> buckets = e.getValue();
            RollingHash<T> windows = new RollingHash<>(text, length, config, mapper);
            int start = 0;
            while (windows.hasNext()) {
                long[] h = windows.next();
                List<HashedPattern<T>> bucket = buckets.get(h[0]);
                if (bucket != null) {
                    for (HashedPattern<T> hp : bucket) {
                        if (Arrays.equals(hp.hash(), h) && regionEquals(text, start, hp.elements())) {
                            res.computeIfAbsent(hp.elements(), k -> new IntArrayList()).add(start);
                        }
                    }
                }
                start++;
            }
        }
        return res;
    }

    public static <T> Map<List<T>, IntArrayList> searchAll(List<? extends T> text,
                                                           List<? extends List<? extends T>> patterns) {
        return searchAll(text, patterns, MatcherConfiguration.defaults(), ElementKeyMapper.DEFAULT);
    }

    // String convenience mirroring searchAll for character patterns.
    public static Map<String, IntArrayList> searchAll(String text, List<String> patterns) {
        Objects.requireNonNull(patterns, "patterns");
        List<List<Character>> charPatterns = new ArrayList<>(patterns.size());
        for (String p : patterns) {
            charPatterns.add(Sequences.chars(p));
        }
        Map<List<Character>, IntArrayList> found = searchAll(Sequences.chars(text), charPatterns);
        Map<String, IntArrayList> res = new LinkedHashMap<>();
        for (Map.Entry<List<Character>, IntArrayList> e : found.entrySet()) {
            StringBuilder sb = new StringBuilder(e.getKey().size());
            for (Character c : e.getKey()) {
                sb.append(c.charValue());
            }
            res.put(sb.toString(), e.getValue());
        }
        return res;
    }

    private static boolean regionEquals(List<?> text, int start, List<?> p) {
        if (start + p.size() > text.size()) {
            return false;
        }
        for (int k = 0; k < p.size(); k++) {
            if (!Objects.equals(text.get(start + k), p.get(k))) {
                return false;
            }
        }
        return true;
    }

    private record HashedPattern<T>(List<T> elements, long[] hash) {
    }
}
