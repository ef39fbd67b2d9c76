package kwe.util.keyword;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

import kwe.util.keyword.language.BaseKeywordLanguage;
import kwe.util.keyword.language.KeywordLanguage;

/**
 * A hybrid keyword extractor: candidates are scored within the target document using RAKE, then re-ranked by TF-IDF against a corpus of related documents.
 * <p>
 * To use this implementation, create an instance with the builder and call {@link #extract(String, List, int, int)}, or {@link #extractKeywords(String, List)}
 * to use the configured keyword size and count. Higher scores are better.
 * </p>
 * <p>
 * The steps are:
 * </p>
 * <ol>
 * <li>segment the target into candidate phrases delimited by stopwords and sentence ends;</li>
 * <li>build the word co-occurrence graph over all candidate phrases;</li>
 * <li>score unique phrases that fit the maximum keyword size with RAKE and keep the best third of the vocabulary;</li>
 * <li>weight the survivors by term frequency in the target and inverse document frequency in the corpus.</li>
 * </ol>
 * <p>
 * Sources:
 * </p>
 * <ul>
 * <li>Rose, Stuart, et al. "Automatic keyword extraction from individual documents." Text Mining (2010): 1-20.</li>
 * <li>Salton, Gerard, and Christopher Buckley. "Term-weighting approaches in automatic text retrieval." Information Processing & Management 24.5 (1988): 513-523.</li>
 * </ul>
 */
public class RakeTfIdfKeywordExtractor {
    public static final int DEFAULT_MAX_KEYWORD_SIZE = 3;
    public static final int DEFAULT_KEYWORD_COUNT = 10;
    public static final int DEFAULT_MAX_CONTENT_LENGTH = 0;

    private static final Logger log = LoggerFactory.getLogger(RakeTfIdfKeywordExtractor.class);

    private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

    /** splits documents into sentences, tokens and candidate phrases */
    private final Segmenter segmenter;

    /** maximum number of words in an extracted keyword */
    private final int maxKeywordSize;

    /** maximum number of keywords to extract */
    private final int keywordCount;

    /** the maximum number of target characters to process, zero or less for no limit; corpus documents are always read in full */
    private final int maxContentLength;

    /** whether the target document is counted as part of the corpus */
    private final TargetInclusion targetInclusion;

    /** whether corpus documents are processed in parallel */
    private final boolean parallelCorpus;

    // use the builder to construct.
    private RakeTfIdfKeywordExtractor(Segmenter segmenter, int maxKeywordSize, int keywordCount, int maxContentLength, TargetInclusion targetInclusion,
                    boolean parallelCorpus) {
        this.segmenter = segmenter;
        this.maxKeywordSize = maxKeywordSize;
        this.keywordCount = keywordCount;
        this.maxContentLength = maxContentLength;
        this.targetInclusion = targetInclusion;
        this.parallelCorpus = parallelCorpus;
    }

    public Segmenter getSegmenter() {
        return segmenter;
    }

    public int getMaxKeywordSize() {
        return maxKeywordSize;
    }

    public int getKeywordCount() {
        return keywordCount;
    }

    public int getMaxContentLength() {
        return maxContentLength;
    }

    public TargetInclusion getTargetInclusion() {
        return targetInclusion;
    }

    public boolean isParallelCorpus() {
        return parallelCorpus;
    }

    /**
     * Extract keywords with the configured keyword size and count.
     *
     * @param target
     *            the document to extract keywords from.
     * @param corpus
     *            related documents the target is compared against.
     * @return a map of keywords to scores, ranked from highest to lowest score.
     */
    public LinkedHashMap<String,Double> extractKeywords(String target, List<String> corpus) {
        return extract(target, corpus, maxKeywordSize, keywordCount).stream()
                        .collect(Collectors.toMap(RankedKeyword::getKeyword, RankedKeyword::getScore, Double::sum, LinkedHashMap::new));
    }

    /**
     * Main entrypoint. Extract the best keywords of the target document relative to the corpus.
     *
     * @param target
     *            the document to extract keywords from. Empty or blank documents produce no keywords.
     * @param corpus
     *            related documents the target is compared against, possibly empty.
     * @param maxKeywordSize
     *            the maximum number of words in a keyword, at least 1.
     * @param limit
     *            the maximum number of keywords to return, at least 1.
     * @return at most {@code limit} keywords, highest score first.
     * @throws InvalidConfigurationException
     *             if {@code maxKeywordSize} or {@code limit} is below 1.
     */
    public List<RankedKeyword> extract(String target, List<String> corpus, int maxKeywordSize, int limit) {
        validate(maxKeywordSize, limit);
        Preconditions.checkNotNull(target, "target");
        Preconditions.checkNotNull(corpus, "corpus");

        final String trimmedTarget = trimContent(target);
        final List<CandidatePhrase> phrases = segmenter.segment(trimmedTarget);
        if (phrases.isEmpty()) {
            log.debug("No candidate phrases found in target document");
            return Collections.emptyList();
        }

        final CoOccurrenceGraph graph = CoOccurrenceGraph.build(phrases);
        final List<ScoredCandidate> candidates = new CandidateScorer(maxKeywordSize).scoreAndPrune(graph, phrases);

        if (log.isDebugEnabled()) {
            log.debug(" --- graph and candidates --- ");
            log.debug("graph: {}", graph);
            log.debug("candidates: {}", candidates);
            log.debug(" --- ");
        }

        final List<RankedKeyword> ranked = new CorpusComparator(segmenter, targetInclusion, parallelCorpus).rank(candidates, trimmedTarget, corpus);

        return ranked.size() > limit ? ranked.subList(0, limit) : ranked;
    }

    static void validate(int maxKeywordSize, int limit) {
        if (maxKeywordSize < 1) {
            throw new InvalidConfigurationException("maxKeywordSize must be at least 1, was " + maxKeywordSize);
        }
        if (limit < 1) {
            throw new InvalidConfigurationException("limit must be at least 1, was " + limit);
        }
    }

    /**
     * Cut the target down to the maximum content length. The cut backs off to the last whitespace so no word is split.
     */
    String trimContent(String input) {
        if (maxContentLength <= 0 || input.length() <= maxContentLength) {
            return input;
        }
        int end = maxContentLength;
        if (!WHITESPACE.matches(input.charAt(end))) {
            end = Math.max(0, WHITESPACE.lastIndexIn(input.subSequence(0, end)));
        }
        log.debug("Target trimmed from {} to {} characters", input.length(), end);
        return input.substring(0, end);
    }
    public static class Builder {
        /** maximum number of words in an extracted keyword */
        private int maxKeywordSize = DEFAULT_MAX_KEYWORD_SIZE;

        /** maximum number of keywords to extract */
        private int keywordCount = DEFAULT_KEYWORD_COUNT;

        /** the maximum number of target characters to process, zero for no limit */
        private int maxContentLength = DEFAULT_MAX_CONTENT_LENGTH;

        private TargetInclusion targetInclusion = TargetInclusion.EXCLUDE_TARGET;

        private boolean parallelCorpus = false;

        private KeywordLanguage language = BaseKeywordLanguage.ENGLISH;

        /** overrides the language's stopwords when set */
        private StopwordSet stopwords;

        /** overrides the language entirely when set */
        private Segmenter segmenter;

        public Builder() {}

        public Builder withMaxKeywordSize(int maxKeywordSize) {
            this.maxKeywordSize = maxKeywordSize;
            return this;
        }

        public Builder withKeywordCount(int keywordCount) {
            this.keywordCount = keywordCount;
            return this;
        }

        public Builder withMaxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
            return this;
        }

        public Builder withTargetInclusion(TargetInclusion targetInclusion) {
            this.targetInclusion = targetInclusion;
            return this;
        }

        public Builder withParallelCorpus(boolean parallelCorpus) {
            this.parallelCorpus = parallelCorpus;
            return this;
        }

        public Builder withLanguage(KeywordLanguage language) {
            this.language = language;
            return this;
        }

        public Builder withStopwords(StopwordSet stopwords) {
            this.stopwords = stopwords;
            return this;
        }

        public Builder withStopwords(Collection<String> stopwords) {
            return withStopwords(StopwordSet.of(stopwords));
        }

        public Builder withSegmenter(Segmenter segmenter) {
            this.segmenter = segmenter;
            return this;
        }

        /**
         * @return a configured extractor.
         * @throws InvalidConfigurationException
         *             if the keyword size or count is below 1.
         */
        public RakeTfIdfKeywordExtractor build() {
            validate(maxKeywordSize, keywordCount);
            Preconditions.checkNotNull(targetInclusion, "targetInclusion");

            Segmenter resolved = segmenter;
            if (resolved == null) {
                Preconditions.checkNotNull(language, "language");
                final StopwordSet resolvedStopwords = stopwords == null ? language.getStopwords() : stopwords;
                resolved = new BreakIteratorSegmenter(resolvedStopwords, language.getSentenceBreakIterator());
            }
            return new RakeTfIdfKeywordExtractor(resolved, maxKeywordSize, keywordCount, maxContentLength, targetInclusion, parallelCorpus);
        }
    }
}
