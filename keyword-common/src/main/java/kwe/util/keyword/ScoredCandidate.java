package kwe.util.keyword;

import java.util.Comparator;

import com.google.common.base.Objects;

/** A candidate phrase with its RAKE score and the index of its first occurrence among the document's candidate phrases. */
public final class ScoredCandidate {

    /** higher scores first, earlier phrases first among equal scores */
    public static final Comparator<ScoredCandidate> BY_SCORE = Comparator.comparingDouble(ScoredCandidate::getScore).reversed()
                    .thenComparingInt(ScoredCandidate::getFirstOccurrence);

    private final CandidatePhrase phrase;
    private final double score;
    private final int firstOccurrence;

    public ScoredCandidate(CandidatePhrase phrase, double score, int firstOccurrence) {
        this.phrase = phrase;
        this.score = score;
        this.firstOccurrence = firstOccurrence;
    }

    public CandidatePhrase getPhrase() {
        return phrase;
    }

    public double getScore() {
        return score;
    }

    public int getFirstOccurrence() {
        return firstOccurrence;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass())
            return false;
        ScoredCandidate that = (ScoredCandidate) o;
        return Double.compare(score, that.score) == 0 && firstOccurrence == that.firstOccurrence && Objects.equal(phrase, that.phrase);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(phrase, score, firstOccurrence);
    }

    @Override
    public String toString() {
        return "['" + phrase.getKey() + "', score=" + score + ", firstOccurrence=" + firstOccurrence + "]";
    }
}
