package kwe.util.keyword;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.ibm.icu.text.BreakIterator;

import kwe.util.keyword.language.KeywordLanguage;

/**
 * A {@link Segmenter} that breaks sentences with an ICU4J {@link BreakIterator} and words with a regular expression. Every line of input is broken into
 * sentences independently, so line breaks always end a sentence.
 * <p>
 * Words are runs of letters, digits, underscores, hyphens, apostrophes and degree signs, or currency amounts such as {@code $12.50}. Tokens made only of
 * punctuation are discarded.
 * </p>
 */
public class BreakIteratorSegmenter implements Segmenter {
    private static final Logger log = LoggerFactory.getLogger(BreakIteratorSegmenter.class);

    public static final Pattern WORD_PATTERN = Pattern.compile("['°\\w-]+|[$€£][\\d.]+", Pattern.UNICODE_CHARACTER_CLASS);

    static final CharMatcher PUNCTUATION = CharMatcher.anyOf("!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~–°");

    private static final Splitter LINE_SPLITTER = Splitter.onPattern("\\R").omitEmptyStrings().trimResults();

    private final StopwordSet stopwords;

    /** a prototype iterator; cloned for each call since break iterators hold the text they iterate over */
    private final BreakIterator sentenceBreakIterator;

    public BreakIteratorSegmenter(StopwordSet stopwords, BreakIterator sentenceBreakIterator) {
        this.stopwords = Preconditions.checkNotNull(stopwords, "stopwords");
        this.sentenceBreakIterator = Preconditions.checkNotNull(sentenceBreakIterator, "sentenceBreakIterator");
    }

    public static BreakIteratorSegmenter forLanguage(KeywordLanguage language) {
        return new BreakIteratorSegmenter(language.getStopwords(), language.getSentenceBreakIterator());
    }

    public StopwordSet getStopwords() {
        return stopwords;
    }

    @Override
    public List<String> breakSentences(String text) {
        final List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }

        final BreakIterator iterator = (BreakIterator) sentenceBreakIterator.clone();
        for (String line : LINE_SPLITTER.split(text)) {
            iterator.setText(line);
            int start = iterator.first();
            for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
                String sentence = line.substring(start, end).trim();
                if (!sentence.isBlank()) {
                    sentences.add(sentence);
                }
            }
        }
        return sentences;
    }

    @Override
    public List<Token> tokenizeSentence(String sentence) {
        final List<Token> tokens = new ArrayList<>();
        final Matcher matcher = WORD_PATTERN.matcher(sentence);
        while (matcher.find()) {
            final String word = matcher.group();
            if (!PUNCTUATION.matchesAllOf(word)) {
                tokens.add(new Token(word));
            }
        }
        return tokens;
    }

    @Override
    public List<CandidatePhrase> chunkPhrases(List<String> sentences) {
        final List<CandidatePhrase> phrases = new ArrayList<>();
        for (String sentence : sentences) {
            List<Token> chunk = new ArrayList<>();
            for (Token token : tokenizeSentence(sentence)) {
                if (stopwords.contains(token.getNormalized())) {
                    closeChunk(chunk, phrases);
                    chunk = new ArrayList<>();
                } else {
                    chunk.add(token);
                }
            }
            closeChunk(chunk, phrases);
        }

        if (log.isDebugEnabled()) {
            log.debug("Chunked {} sentences into {} candidate phrases", sentences.size(), phrases.size());
        }
        return phrases;
    }

    private static void closeChunk(List<Token> chunk, List<CandidatePhrase> phrases) {
        if (!chunk.isEmpty()) {
            phrases.add(CandidatePhrase.of(chunk));
        }
    }
}
