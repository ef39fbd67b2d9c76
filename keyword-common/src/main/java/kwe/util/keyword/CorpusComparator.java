package kwe.util.keyword;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Re-ranks the candidates of a target document by how well they discriminate it from a corpus of related documents.
 * <p>
 * The weight of a phrase is {@code tf * log(N / df)}, where tf counts the phrase in the target document, N is the number of corpus documents and df the number
 * of corpus documents containing the phrase. Containment is checked against each document's token stream: the phrase's normalized words must appear as a
 * contiguous run within one sentence. A phrase does not have to be a candidate in the other document to count. df is floored at one. When no corpus documents
 * are supplied the logarithm is replaced by one, leaving the weight equal to tf.
 * </p>
 * <p>
 * Corpus documents are independent of each other and may be processed in parallel; document frequencies are summed, so the result does not depend on the
 * order in which documents are processed.
 * </p>
 */
public class CorpusComparator {
    private static final Logger log = LoggerFactory.getLogger(CorpusComparator.class);

    private final Segmenter segmenter;
    private final TargetInclusion targetInclusion;
    private final boolean parallel;

    public CorpusComparator(Segmenter segmenter, TargetInclusion targetInclusion, boolean parallel) {
        this.segmenter = Preconditions.checkNotNull(segmenter, "segmenter");
        this.targetInclusion = Preconditions.checkNotNull(targetInclusion, "targetInclusion");
        this.parallel = parallel;
    }

    public TargetInclusion getTargetInclusion() {
        return targetInclusion;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Weight each candidate against the corpus and rank the results.
     *
     * @param candidates
     *            the pruned candidates of the target document.
     * @param target
     *            the raw text of the target document.
     * @param corpus
     *            the raw text of each corpus document.
     * @return one ranked keyword per candidate, ordered by {@link RankedKeyword#BY_RANK}.
     */
    public List<RankedKeyword> rank(List<ScoredCandidate> candidates, String target, List<String> corpus) {
        final TermStatistics stats = computeStatistics(candidates, target, corpus);

        final List<RankedKeyword> ranked = new ArrayList<>(candidates.size());
        for (ScoredCandidate candidate : candidates) {
            final String key = candidate.getPhrase().getKey();
            final int tf = stats.getTermFrequency(key);
            final int df = stats.getDocumentFrequency(key);
            final double weight = stats.isDiscriminative() ? weight(tf, df, stats.getTotalDocuments()) : tf;
            ranked.add(new RankedKeyword(candidate, weight, tf, df));
        }
        ranked.sort(RankedKeyword.BY_RANK);
        return ranked;
    }

    /**
     * Count each candidate in the target and in the corpus.
     *
     * @param candidates
     *            the candidates to count.
     * @param target
     *            the raw text of the target document.
     * @param corpus
     *            the raw text of each corpus document.
     * @return term and document frequencies keyed by normalized phrase.
     */
    public TermStatistics computeStatistics(List<ScoredCandidate> candidates, String target, List<String> corpus) {
        Preconditions.checkNotNull(corpus, "corpus");
        final Set<List<String>> phrases = new LinkedHashSet<>();
        for (ScoredCandidate candidate : candidates) {
            phrases.add(candidate.getPhrase().getWords());
        }

        final List<List<String>> targetSentences = tokenize(target);
        final Map<String,Integer> termFrequencies = new HashMap<>();
        for (List<String> phrase : phrases) {
            termFrequencies.put(String.join(" ", phrase), countOccurrences(targetSentences, phrase));
        }

        final Stream<String> documents = parallel ? corpus.parallelStream() : corpus.stream();
        final Map<String,Long> counted = documents.map(this::tokenize).flatMap(sentences -> containedPhrases(sentences, phrases).stream())
                        .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        final Map<String,Integer> documentFrequencies = new HashMap<>();
        counted.forEach((key, count) -> documentFrequencies.put(key, count.intValue()));

        int totalDocuments = corpus.size();
        if (targetInclusion == TargetInclusion.INCLUDE_TARGET) {
            totalDocuments++;
            termFrequencies.forEach((key, tf) -> {
                if (tf > 0) {
                    documentFrequencies.merge(key, 1, Integer::sum);
                }
            });
        }

        if (log.isDebugEnabled()) {
            log.debug("Compared {} phrases against {} documents ({})", phrases.size(), totalDocuments, targetInclusion);
            log.debug("tf: {}", termFrequencies);
            log.debug("df: {}", documentFrequencies);
        }
        return new TermStatistics(termFrequencies, documentFrequencies, totalDocuments, !corpus.isEmpty());
    }

    /**
     * @param termFrequency
     *            occurrences of the phrase in the target document.
     * @param documentFrequency
     *            corpus documents containing the phrase; values below one are treated as one.
     * @param totalDocuments
     *            the number of corpus documents.
     * @return {@code termFrequency * log(totalDocuments / documentFrequency)}
     */
    public static double weight(int termFrequency, int documentFrequency, int totalDocuments) {
        return termFrequency * Math.log(((double) totalDocuments) / Math.max(1, documentFrequency));
    }

    /**
     * Count the occurrences of a phrase as a contiguous run of words within a single sentence. Overlapping occurrences are counted.
     *
     * @param sentences
     *            the normalized words of each sentence.
     * @param phrase
     *            the normalized words of the phrase.
     * @return the number of occurrences.
     */
    static int countOccurrences(List<List<String>> sentences, List<String> phrase) {
        int count = 0;
        for (List<String> sentence : sentences) {
            for (int start = 0; start + phrase.size() <= sentence.size(); start++) {
                if (sentence.subList(start, start + phrase.size()).equals(phrase)) {
                    count++;
                }
            }
        }
        return count;
    }

    private static Set<String> containedPhrases(List<List<String>> sentences, Set<List<String>> phrases) {
        final Set<String> contained = new LinkedHashSet<>();
        for (List<String> phrase : phrases) {
            if (countOccurrences(sentences, phrase) > 0) {
                contained.add(String.join(" ", phrase));
            }
        }
        return contained;
    }

    private List<List<String>> tokenize(String document) {
        return segmenter.breakSentences(document).stream()
                        .map(sentence -> segmenter.tokenizeSentence(sentence).stream().map(Token::getNormalized).collect(Collectors.toList()))
                        .collect(Collectors.toList());
    }

    /** Term and document frequencies for the candidates of one extraction. */
    public static final class TermStatistics {
        private final ImmutableMap<String,Integer> termFrequencies;
        private final ImmutableMap<String,Integer> documentFrequencies;
        private final int totalDocuments;
        private final boolean discriminative;

        TermStatistics(Map<String,Integer> termFrequencies, Map<String,Integer> documentFrequencies, int totalDocuments, boolean discriminative) {
            this.termFrequencies = ImmutableMap.copyOf(termFrequencies);
            this.documentFrequencies = ImmutableMap.copyOf(documentFrequencies);
            this.totalDocuments = totalDocuments;
            this.discriminative = discriminative;
        }

        public int getTermFrequency(String phrase) {
            return termFrequencies.getOrDefault(phrase, 0);
        }

        /** @return the number of counted documents containing the phrase, without flooring. */
        public int getDocumentFrequency(String phrase) {
            return documentFrequencies.getOrDefault(phrase, 0);
        }

        public int getTotalDocuments() {
            return totalDocuments;
        }

        /** @return false when there were no corpus documents to compare against. */
        public boolean isDiscriminative() {
            return discriminative;
        }

        public ImmutableMap<String,Integer> getTermFrequencies() {
            return termFrequencies;
        }

        public ImmutableMap<String,Integer> getDocumentFrequencies() {
            return documentFrequencies;
        }
    }
}
