package kwe.util.keyword;

import java.util.List;

/**
 * Splits raw text into sentences and sentences into candidate phrases. Implementations must be deterministic: segmenting the same text twice yields equal
 * results, so callers may re-derive phrases rather than keep them.
 */
public interface Segmenter {

    /**
     * Break text into sentences. Blank sentences are dropped.
     *
     * @param text
     *            the raw text of a document.
     * @return the sentences, in document order.
     */
    List<String> breakSentences(String text);

    /**
     * Split a single sentence into word tokens, discarding punctuation. Stopwords are kept.
     *
     * @param sentence
     *            a sentence produced by {@link #breakSentences(String)}.
     * @return the word tokens, in order.
     */
    List<Token> tokenizeSentence(String sentence);

    /**
     * Chunk sentences into candidate phrases, using stopwords and sentence ends as delimiters. A phrase never contains a stopword and never spans two sentences.
     *
     * @param sentences
     *            the sentences to chunk.
     * @return candidate phrases in document order, with repetitions.
     */
    List<CandidatePhrase> chunkPhrases(List<String> sentences);

    default List<CandidatePhrase> segment(String text) {
        return chunkPhrases(breakSentences(text));
    }
}
