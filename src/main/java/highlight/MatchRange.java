package highlight;

/** Half-open interval [start, end) over a text, owned by pattern {@code patternId}. */
public record MatchRange(int start, int end, int patternId) {

    // owner of a span produced by merging ranges of several patterns
    public static final int MERGED = -1;
}
