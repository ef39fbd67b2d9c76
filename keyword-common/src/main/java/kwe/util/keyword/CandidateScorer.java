package kwe.util.keyword;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Scores candidate phrases with the RAKE measure and prunes them to the best third of the document's vocabulary.
 * <p>
 * A phrase scores the sum of degree / frequency over its words. Following Mihalcea and Tarau (2004), the number of candidates kept is one third of the
 * distinct words in the co-occurrence graph, rounded down; when that comes out as zero every candidate is kept.
 * </p>
 */
public class CandidateScorer {
    private static final Logger log = LoggerFactory.getLogger(CandidateScorer.class);

    /** phrases with more words than this feed the graph but never become keywords */
    private final int maxKeywordSize;

    public CandidateScorer(int maxKeywordSize) {
        if (maxKeywordSize < 1) {
            throw new InvalidConfigurationException("maxKeywordSize must be at least 1, was " + maxKeywordSize);
        }
        this.maxKeywordSize = maxKeywordSize;
    }

    public int getMaxKeywordSize() {
        return maxKeywordSize;
    }

    /**
     * Score every unique candidate phrase that fits within the maximum keyword size.
     *
     * @param graph
     *            the co-occurrence graph built from all of the phrases.
     * @param phrases
     *            the candidate phrases in document order, with repetitions.
     * @return one scored candidate per distinct phrase, best first. The first occurrence of a phrase supplies its surface form and its tie-breaking position.
     */
    public List<ScoredCandidate> score(CoOccurrenceGraph graph, List<CandidatePhrase> phrases) {
        Preconditions.checkNotNull(graph, "graph");
        final Map<CandidatePhrase,ScoredCandidate> unique = new LinkedHashMap<>();
        for (int i = 0; i < phrases.size(); i++) {
            final CandidatePhrase phrase = phrases.get(i);
            if (phrase.size() > maxKeywordSize || unique.containsKey(phrase)) {
                continue;
            }
            unique.put(phrase, new ScoredCandidate(phrase, scorePhrase(graph, phrase), i));
        }

        final List<ScoredCandidate> scored = new ArrayList<>(unique.values());
        scored.sort(ScoredCandidate.BY_SCORE);
        return scored;
    }

    /**
     * Keep the best {@link #pruneSize(int)} candidates.
     *
     * @param graph
     *            the graph the candidates were scored against.
     * @param scored
     *            candidates sorted best first, as returned by {@link #score(CoOccurrenceGraph, List)}.
     * @return the leading candidates.
     */
    public List<ScoredCandidate> prune(CoOccurrenceGraph graph, List<ScoredCandidate> scored) {
        final int n = pruneSize(graph.distinctWordCount());
        final List<ScoredCandidate> pruned = (n == 0 || n >= scored.size()) ? scored : scored.subList(0, n);

        if (log.isDebugEnabled()) {
            log.debug("{} distinct words, keeping {} of {} candidates", graph.distinctWordCount(), pruned.size(), scored.size());
        }
        return new ArrayList<>(pruned);
    }

    public List<ScoredCandidate> scoreAndPrune(CoOccurrenceGraph graph, List<CandidatePhrase> phrases) {
        return prune(graph, score(graph, phrases));
    }

    /**
     * @param distinctWords
     *            the number of distinct words in a co-occurrence graph.
     * @return one third of the distinct words, rounded down. Zero means no pruning.
     */
    public static int pruneSize(int distinctWords) {
        return distinctWords / 3;
    }

    static double scorePhrase(CoOccurrenceGraph graph, CandidatePhrase phrase) {
        double score = 0.0;
        for (String word : phrase.getWords()) {
            score += graph.wordScore(word);
        }
        return score;
    }
}
