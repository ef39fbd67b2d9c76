package kwe.util.keyword;

import java.util.Collection;
import java.util.Locale;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * An immutable set of case-normalized words that delimit candidate phrases. A stopword never appears inside a candidate phrase.
 */
public final class StopwordSet {
    private static final StopwordSet EMPTY = new StopwordSet(ImmutableSet.of());

    private final ImmutableSet<String> words;

    private StopwordSet(ImmutableSet<String> words) {
        this.words = words;
    }

    /**
     * Create a stopword set from the words provided. Words are trimmed and down-cased, blank entries are dropped.
     *
     * @param words
     *            the words to treat as stopwords.
     * @return an immutable stopword set.
     */
    public static StopwordSet of(Collection<String> words) {
        Preconditions.checkNotNull(words, "stopwords");
        final ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        for (String word : words) {
            if (word != null && !word.isBlank()) {
                builder.add(normalize(word.trim()));
            }
        }
        return new StopwordSet(builder.build());
    }

    public static StopwordSet of(String... words) {
        return of(ImmutableSet.copyOf(words));
    }

    public static StopwordSet empty() {
        return EMPTY;
    }

    /** Case folding applied to stopwords and to every word considered for a candidate phrase. */
    public static String normalize(String word) {
        return word.toLowerCase(Locale.ROOT);
    }

    /**
     * @param word
     *            a word in any case.
     * @return true if the normalized form of the word is a stopword.
     */
    public boolean contains(String word) {
        return words.contains(normalize(word));
    }

    public int size() {
        return words.size();
    }

    public boolean isEmpty() {
        return words.isEmpty();
    }

    public ImmutableSet<String> asSet() {
        return words;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass())
            return false;
        StopwordSet that = (StopwordSet) o;
        return Objects.equal(words, that.words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public String toString() {
        return "StopwordSet{size=" + words.size() + "}";
    }
}
