package highlight;

import automaton.AhoCorasick;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import utilities.MatchLogger;
import utilities.MatcherConfiguration;
import utilities.Sequences;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Wraps every maximal run of text covered by occurrences of the given words in the
 * configured open/close markers. Overlapping and touching occurrences, of the same word
 * or of different words, end up inside a single pair of markers. Removing the markers
 * from the output always gives back the input text.
 */
public final class BoldTagger {

    private final MatcherConfiguration config;

    public BoldTagger() {
        this(MatcherConfiguration.defaults());
    }

    public BoldTagger(MatcherConfiguration config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public String addBoldTag(String text, List<String> words) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(words, "words");
        if (text.isEmpty() || words.isEmpty()) {
            return text;
        }
        List<MatchRange> spans = boldSpans(text, words);
        if (spans.isEmpty()) {
            return text;
        }
        return render(text, spans);
    }

    /** Ascending, maximal, non-touching spans of {@code text} covered by the words. */
    public List<MatchRange> boldSpans(CharSequence text, List<String> words) {
        AhoCorasick<Character> ac = AhoCorasick.forStrings(words, config);
        Map<List<Character>, IntArrayList> starts = ac.search(Sequences.chars(text));

        List<List<MatchRange>> perPattern = new ArrayList<>(starts.size());
        int id = 0;
        for (Map.Entry<List<Character>, IntArrayList> e : starts.entrySet()) {
            List<MatchRange> ranges = RangeMerger.mergePerPattern(e.getValue(), e.getKey().size(), id++);
            if (!ranges.isEmpty()) {
                perPattern.add(ranges);
            }
        }
        List<MatchRange> spans = RangeMerger.union(perPattern);
        MatchLogger.trace("Bold spans: words=" + words.size() + " patternsFound=" + starts.size()
                + " spans=" + spans.size());
        return spans;
    }

    /** Inserts the markers around {@code spans}, which must be ascending and disjoint. */
    public String render(CharSequence text, List<MatchRange> spans) {
        String open = config.openTag();
        String close = config.closeTag();
        StringBuilder sb = new StringBuilder(text.length() + spans.size() * (open.length() + close.length()));
        int cursor = 0;
        for (MatchRange span : spans) {
            if (span.start() > cursor) {
                sb.append(text, cursor, span.start());
            }
            sb.append(open).append(text, span.start(), span.end()).append(close);
            cursor = span.end();
        }
        if (cursor < text.length()) {
            sb.append(text, cursor, text.length());
        }
        return sb.toString();
    }
}
