package kwe.util.keyword;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Objects;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

/**
 * Word co-occurrence statistics for the candidate phrases of one document. Two words co-occur when they belong to the same candidate phrase.
 * <p>
 * For every occurrence of a word in a phrase of length L, the word's frequency grows by one and its degree by L: one for the word itself and one for each of
 * its L - 1 companions. The companions are kept in a co-occurrence matrix, so degree is frequency plus the sum of the word's row. As a consequence degree is
 * never below frequency, and the two are equal only for words that always stand alone.
 * </p>
 */
public final class CoOccurrenceGraph {

    /** word frequencies, in order of first appearance */
    private final ImmutableMap<String,Integer> frequencies;

    /** word degrees, in order of first appearance */
    private final ImmutableMap<String,Integer> degrees;

    /** off-diagonal co-occurrence counts: row word, column companion word */
    private final ImmutableTable<String,String,Integer> coOccurrences;

    private CoOccurrenceGraph(ImmutableMap<String,Integer> frequencies, ImmutableMap<String,Integer> degrees,
                    ImmutableTable<String,String,Integer> coOccurrences) {
        this.frequencies = frequencies;
        this.degrees = degrees;
        this.coOccurrences = coOccurrences;
    }

    /**
     * Build the graph from every candidate phrase of a document, including phrases too long to become keywords.
     *
     * @param phrases
     *            the candidate phrases, with repetitions.
     * @return the co-occurrence graph; empty if there are no phrases.
     */
    public static CoOccurrenceGraph build(List<CandidatePhrase> phrases) {
        final Map<String,Integer> frequencies = new LinkedHashMap<>();
        final Table<String,String,Integer> matrix = HashBasedTable.create();

        for (CandidatePhrase phrase : phrases) {
            final List<String> words = phrase.getWords();
            for (int i = 0; i < words.size(); i++) {
                final String word = words.get(i);
                frequencies.merge(word, 1, Integer::sum);
                for (int j = 0; j < words.size(); j++) {
                    if (i != j) {
                        final String companion = words.get(j);
                        final Integer count = matrix.get(word, companion);
                        matrix.put(word, companion, count == null ? 1 : count + 1);
                    }
                }
            }
        }

        final ImmutableMap.Builder<String,Integer> degrees = ImmutableMap.builder();
        for (Map.Entry<String,Integer> e : frequencies.entrySet()) {
            int degree = e.getValue();
            for (int count : matrix.row(e.getKey()).values()) {
                degree += count;
            }
            degrees.put(e.getKey(), degree);
        }

        return new CoOccurrenceGraph(ImmutableMap.copyOf(frequencies), degrees.build(), ImmutableTable.copyOf(matrix));
    }

    public int frequency(String word) {
        return frequencies.getOrDefault(word, 0);
    }

    public int degree(String word) {
        return degrees.getOrDefault(word, 0);
    }

    /**
     * @param word
     *            a normalized word.
     * @return degree / frequency for the word, or zero if the word is not in the graph.
     */
    public double wordScore(String word) {
        final int frequency = frequency(word);
        return frequency == 0 ? 0.0 : ((double) degree(word)) / frequency;
    }

    /**
     * @param word
     *            a normalized word.
     * @return the words that co-occur with the word and how many times they do.
     */
    public ImmutableMap<String,Integer> coOccurrences(String word) {
        return coOccurrences.row(word);
    }

    public int distinctWordCount() {
        return frequencies.size();
    }

    public ImmutableSet<String> words() {
        return frequencies.keySet();
    }

    public ImmutableMap<String,Integer> getFrequencies() {
        return frequencies;
    }

    public ImmutableMap<String,Integer> getDegrees() {
        return degrees;
    }

    public boolean isEmpty() {
        return frequencies.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass())
            return false;
        CoOccurrenceGraph that = (CoOccurrenceGraph) o;
        return Objects.equal(frequencies, that.frequencies) && Objects.equal(degrees, that.degrees) && Objects.equal(coOccurrences, that.coOccurrences);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(frequencies, degrees, coOccurrences);
    }

    @Override
    public String toString() {
        return "CoOccurrenceGraph{frequencies=" + frequencies + ", degrees=" + degrees + '}';
    }
}
