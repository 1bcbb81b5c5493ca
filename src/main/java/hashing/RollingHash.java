package hashing;

import utilities.MatcherConfiguration;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.ToLongFunction;

/**
 * Lazily yields the polynomial hash of every window of {@code length} consecutive
 * elements, in order of the window's first element. One hash is produced per base, all
 * modulo the same modulus:
 *
 *   H(w) = (v0 * b^(L-1) + v1 * b^(L-2) + ... + v(L-1)) mod M
 *
 * The text is pulled through its iterator, one element per window after the first, so
 * only the last {@code length} element values are kept. Forward-only; a new instance
 * performs a fresh pass.
 */
public final class RollingHash<T> implements Iterator<long[]> {

    private final Iterator<? extends T> input;
    private final int length;
    private final long[] bases;
    private final long modulus;
    private final long[] outgoingMults; // b^L mod M per base
    private final ToLongFunction<Object> mapper;
    private final LongRingBuffer window;
    private final long[] hash;

    private boolean started = false;
    private boolean ready = false;
    private boolean exhausted = false;

    public RollingHash(Iterable<? extends T> text, int length, MatcherConfiguration config, ToLongFunction<Object> mapper) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(config, "config");
        if (length <= 0) {
            throw new IllegalArgumentException("window length must be positive");
        }
        this.input = text.iterator();
        this.length = length;
        this.bases = config.rollingBases();
        this.modulus = config.rollingModulus();
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.window = new LongRingBuffer(length);
        this.hash = new long[bases.length];
        this.outgoingMults = new long[bases.length];
        for (int j = 0; j < bases.length; j++) {
            outgoingMults[j] = powMod(bases[j], length, modulus);
        }
    }

    public static <T> RollingHash<T> of(Iterable<? extends T> text, int length) {
        return new RollingHash<>(text, length, MatcherConfiguration.defaults(), ElementKeyMapper.DEFAULT);
    }

    public static <T> RollingHash<T> of(Iterable<? extends T> text, int length, MatcherConfiguration config) {
        return new RollingHash<>(text, length, config, ElementKeyMapper.DEFAULT);
    }

    /** Hash of a complete sequence, consistent with the window hashes produced by this class. */
    public static long[] hashOf(Iterable<?> sequence, MatcherConfiguration config, ToLongFunction<Object> mapper) {
        long[] bases = config.rollingBases();
        long modulus = config.rollingModulus();
        long[] h = new long[bases.length];
        for (Object element : sequence) {
            long v = Math.floorMod(mapper.applyAsLong(element), modulus);
            for (int j = 0; j < bases.length; j++) {
                h[j] = (h[j] * bases[j] + v) % modulus;
            }
        }
        return h;
    }

    @Override
    public boolean hasNext() {
        if (ready) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        if (!started) {
            started = true;
            // Bootstrap: read the first window and hash it from scratch.
            for (int i = 0; i < length; i++) {
                if (!input.hasNext()) {
                    exhausted = true;
                    return false;
                }
                long v = valueOf(input.next());
                window.append(v);
                for (int j = 0; j < bases.length; j++) {
                    hash[j] = (hash[j] * bases[j] + v) % modulus;
                }
            }
            ready = true;
            return true;
        }
        if (!input.hasNext()) {
            exhausted = true;
            return false;
        }
        long incoming = valueOf(input.next());
        long outgoing = window.oldest();
        window.append(incoming);
        for (int j = 0; j < bases.length; j++) {
            long h = (hash[j] * bases[j]) % modulus;
            h = (h - (outgoingMults[j] * outgoing) % modulus + modulus) % modulus;
            hash[j] = (h + incoming) % modulus;
        }
        ready = true;
        return true;
    }

    @Override
    public long[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ready = false;
        return hash.clone();
    }

    private long valueOf(T element) {
        return Math.floorMod(mapper.applyAsLong(element), modulus);
    }

    static long powMod(long base, int exp, long modulus) {
        long result = 1 % modulus;
        long b = base % modulus;
        int e = exp;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = (result * b) % modulus;
            }
            b = (b * b) % modulus;
            e >>= 1;
        }
        return result;
    }
}
