package kwe.util.keyword;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kwe.util.keyword.language.KeywordLanguage;

/**
 * The KeywordExtractor serves as the glue between callers holding string options and the keyword extractor implementation. It interprets the options and
 * translates them into configuration for the extractor, extracts keywords from a target document against its corpus and then packages the results into
 * something that can be serialized and returned to the caller.
 */
public class KeywordExtractor {
    private static final Logger logger = LoggerFactory.getLogger(KeywordExtractor.class);

    public static final String MAX_KEYWORD_SIZE = "max.keyword.size";
    public static final String MAX_KEYWORDS = "max.keyword.count";
    public static final String MAX_CONTENT_CHARS = "max.content.chars";
    public static final String INCLUDE_TARGET = "corpus.include.target";
    public static final String PARALLEL_CORPUS = "corpus.parallel";

    public static final KeywordResults EMPTY_RESULTS = new KeywordResults();

    /** maximum number of words in an extracted keyword */
    private int maxKeywordSize = RakeTfIdfKeywordExtractor.DEFAULT_MAX_KEYWORD_SIZE;

    /** maximum number of keywords to extract */
    private int keywordCount = RakeTfIdfKeywordExtractor.DEFAULT_KEYWORD_COUNT;

    /** the maximum number of characters to process per document */
    private int maxContentLength = RakeTfIdfKeywordExtractor.DEFAULT_MAX_CONTENT_LENGTH;

    /** whether the target document counts toward document frequencies */
    private TargetInclusion targetInclusion = TargetInclusion.EXCLUDE_TARGET;

    /** whether corpus documents are processed in parallel */
    private boolean parallelCorpus = false;

    /** the source to record for the extraction */
    private final String source;

    /** the language to use for extraction */
    private final String language;

    final RakeTfIdfKeywordExtractor keywordExtractor;

    /**
     * Creates a {@code KeywordExtractor}, a lightweight wrapper for {@link RakeTfIdfKeywordExtractor} that handles choosing a language for keyword processing
     * and property-based configuration.
     *
     * @param source
     *            used to name the source of the target document, carried forward into the results object.
     * @param language
     *            the language to use when extracting content, if the language can't be found in the {@link KeywordLanguage.Registry}, it will default to
     *            english. This language will also be included in the results object.
     * @param options
     *            values for the options related to {@code MAX_KEYWORD_SIZE}, {@code MAX_KEYWORDS}, {@code MAX_CONTENT_CHARS}, {@code INCLUDE_TARGET} or
     *            {@code PARALLEL_CORPUS}.
     * @throws InvalidConfigurationException
     *             if an option can not be parsed or is out of range.
     */
    public KeywordExtractor(String source, String language, Map<String,String> options) {
        this.source = source;

        parseOptions(options);

        this.language = language;
        KeywordLanguage keywordLanguage = KeywordLanguage.Registry.find(language);

        logger.debug("Input language was {}, resolved language for extraction is {}", this.language, keywordLanguage.getLanguageName());

        //@formatter:off
        keywordExtractor = new RakeTfIdfKeywordExtractor.Builder()
                .withMaxKeywordSize(maxKeywordSize)
                .withKeywordCount(keywordCount)
                .withMaxContentLength(maxContentLength)
                .withTargetInclusion(targetInclusion)
                .withParallelCorpus(parallelCorpus)
                .withLanguage(keywordLanguage)
                .build();
        //@formatter:on
    }

    private void parseOptions(Map<String,String> options) {
        if (options.containsKey(MAX_KEYWORD_SIZE)) {
            maxKeywordSize = parseInt(options, MAX_KEYWORD_SIZE);
        }

        if (options.containsKey(MAX_KEYWORDS)) {
            keywordCount = parseInt(options, MAX_KEYWORDS);
        }

        if (options.containsKey(MAX_CONTENT_CHARS)) {
            maxContentLength = parseInt(options, MAX_CONTENT_CHARS);
        }

        if (options.containsKey(INCLUDE_TARGET)) {
            targetInclusion = parseBoolean(options, INCLUDE_TARGET) ? TargetInclusion.INCLUDE_TARGET : TargetInclusion.EXCLUDE_TARGET;
        }

        if (options.containsKey(PARALLEL_CORPUS)) {
            parallelCorpus = parseBoolean(options, PARALLEL_CORPUS);
        }
    }

    /**
     * Extract keywords from the target document relative to the corpus.
     *
     * @param target
     *            the document to extract keywords from.
     * @param corpus
     *            related documents the target is compared against.
     * @return a KeywordResults object containing the ranked keywords, or an empty KeywordResults object if no keywords can be extracted.
     */
    @Nonnull
    public KeywordResults extractKeywords(String target, List<String> corpus) {
        final LinkedHashMap<String,Double> keywords = keywordExtractor.extractKeywords(target, corpus);
        if (logger.isDebugEnabled()) {
            logger.debug("Extracted {} keywords from {} against {} corpus documents.", keywords.size(), source, corpus.size());
        }
        if (keywords.isEmpty()) {
            return EMPTY_RESULTS;
        }
        return new KeywordResults(source, language, keywords);
    }

    public RakeTfIdfKeywordExtractor getKeywordExtractor() {
        return keywordExtractor;
    }

    private static int parseInt(Map<String,String> options, String key) {
        final String value = options.get(key);
        if (value == null) {
            throw new InvalidConfigurationException("Option " + key + " must be an integer, was null");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Option " + key + " must be an integer, was '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(Map<String,String> options, String key) {
        final String value = options.get(key);
        if ("true".equalsIgnoreCase(value)) {
            return true;
        } else if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new InvalidConfigurationException("Option " + key + " must be true or false, was '" + value + "'");
    }
}
