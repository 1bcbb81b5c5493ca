package automaton;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.apache.commons.math3.util.Pair;
import utilities.MatcherConfiguration;
import utilities.Sequences;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

// String-keyed facade over AhoCorasick<Character>.
public final class StringAhoCorasick {

    private final List<String> words;
    private final AhoCorasick<Character> automaton;

    public StringAhoCorasick(List<String> words) {
        this(words, MatcherConfiguration.defaults());
    }

    public StringAhoCorasick(List<String> words, MatcherConfiguration config) {
        this.words = List.copyOf(Objects.requireNonNull(words, "words"));
        this.automaton = AhoCorasick.forStrings(this.words, config);
    }

    public List<String> words() {
        return words;
    }

    public AhoCorasick<Character> automaton() {
        return automaton;
    }

    public Map<String, IntArrayList> search(CharSequence text) {
        Map<List<Character>, IntArrayList> found = automaton.search(Sequences.chars(text));
        Map<String, IntArrayList> res = new LinkedHashMap<>();
        for (Map.Entry<List<Character>, IntArrayList> e : found.entrySet()) {
            res.put(toString(e.getKey()), e.getValue());
        }
        return res;
    }

    public EndIndexScanner<Character> searchEndIndices(CharSequence text) {
        return automaton.searchEndIndices(Sequences.chars(text));
    }

    public LengthScanner<Character> searchLengths(CharSequence text) {
        return automaton.searchLengths(Sequences.chars(text));
    }

    // Words (not ids) ending at each index; helper for callers that do not track ids.
    public Pair<Integer, List<String>> wordsEndingAt(Pair<Integer, IntArrayList> entry) {
        IntArrayList ids = entry.getSecond();
        String[] out = new String[ids.size()];
        for (int i = 0; i < ids.size(); i++) {
            out[i] = words.get(ids.getInt(i));
        }
        return new Pair<>(entry.getFirst(), List.of(out));
    }

    private static String toString(List<Character> chars) {
        StringBuilder sb = new StringBuilder(chars.size());
        for (Character c : chars) {
            sb.append(c.charValue());
        }
        return sb.toString();
    }
}
