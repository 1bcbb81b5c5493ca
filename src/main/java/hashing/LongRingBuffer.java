package hashing;

import java.util.NoSuchElementException;

// Fixed-size circular buffer of primitive longs; once filled, each append overwrites the oldest value.
public final class LongRingBuffer {

    private final long[] buf;
    private int          pos    = 0;
    private int          filled = 0;

    public LongRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.buf = new long[capacity];
    }

    public boolean isFilled() {
        return filled >= buf.length;
    }

    public boolean isEmpty() {
        return filled == 0;
    }

    public void append(long value) {
        buf[pos] = value;
        pos = (pos + 1) % buf.length;
        if (filled < buf.length) {
            filled++;
        }
    }

    // Oldest retained value, i.e. the one the next append evicts when the buffer is filled.
    public long oldest() {
        if (isEmpty()) {
            throw new NoSuchElementException("buffer is empty");
        }
        return isFilled() ? buf[pos] : buf[0];
    }
}
