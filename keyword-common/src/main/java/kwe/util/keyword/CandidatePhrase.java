package kwe.util.keyword;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A contiguous run of non-stopword tokens found between delimiters. Two phrases are equal when their normalized word sequences are equal, regardless of the
 * surface forms they were built from.
 */
public final class CandidatePhrase {
    private static final Joiner SPACE = Joiner.on(' ');

    private final ImmutableList<Token> tokens;
    private final ImmutableList<String> words;
    private final String key;

    private CandidatePhrase(ImmutableList<Token> tokens) {
        this.tokens = tokens;
        this.words = tokens.stream().map(Token::getNormalized).collect(ImmutableList.toImmutableList());
        this.key = SPACE.join(words);
    }

    /**
     * @param tokens
     *            one or more tokens, in document order.
     * @return a phrase made of the tokens provided.
     */
    public static CandidatePhrase of(List<Token> tokens) {
        Preconditions.checkArgument(!tokens.isEmpty(), "a candidate phrase needs at least one token");
        return new CandidatePhrase(ImmutableList.copyOf(tokens));
    }

    public static CandidatePhrase of(String... surfaceForms) {
        final ImmutableList.Builder<Token> builder = ImmutableList.builder();
        for (String s : surfaceForms) {
            builder.add(new Token(s));
        }
        return of(builder.build());
    }

    public ImmutableList<Token> getTokens() {
        return tokens;
    }

    /** @return the normalized words of this phrase, in order. */
    public ImmutableList<String> getWords() {
        return words;
    }

    /** @return the normalized words joined with single spaces; the identity of the phrase. */
    public String getKey() {
        return key;
    }

    /** @return the original tokens joined with single spaces. */
    public String getSurfaceForm() {
        return SPACE.join(tokens.stream().map(Token::getSurface).iterator());
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass())
            return false;
        CandidatePhrase that = (CandidatePhrase) o;
        return words.equals(that.words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
