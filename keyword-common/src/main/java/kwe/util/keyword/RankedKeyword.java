package kwe.util.keyword;

import java.util.Comparator;

import com.google.common.base.Objects;

/**
 * A keyword in the final ranking. The score is the TF-IDF weight of the phrase against the corpus; the RAKE score, term frequency and document frequency it
 * was derived from are kept for inspection.
 */
public final class RankedKeyword {

    /** highest weight first, then highest RAKE score, then earliest in the document */
    public static final Comparator<RankedKeyword> BY_RANK = Comparator.comparingDouble(RankedKeyword::getScore).reversed()
                    .thenComparing(Comparator.comparingDouble(RankedKeyword::getRakeScore).reversed())
                    .thenComparingInt(RankedKeyword::getFirstOccurrence);

    private final String keyword;
    private final String normalizedKeyword;
    private final double score;
    private final double rakeScore;
    private final int termFrequency;
    private final int documentFrequency;
    private final int firstOccurrence;

    public RankedKeyword(ScoredCandidate candidate, double score, int termFrequency, int documentFrequency) {
        this.keyword = candidate.getPhrase().getSurfaceForm();
        this.normalizedKeyword = candidate.getPhrase().getKey();
        this.score = score;
        this.rakeScore = candidate.getScore();
        this.termFrequency = termFrequency;
        this.documentFrequency = documentFrequency;
        this.firstOccurrence = candidate.getFirstOccurrence();
    }

    /** @return the keyword as it first appeared in the target document */
    public String getKeyword() {
        return keyword;
    }

    public String getNormalizedKeyword() {
        return normalizedKeyword;
    }

    public double getScore() {
        return score;
    }

    public double getRakeScore() {
        return rakeScore;
    }

    public int getTermFrequency() {
        return termFrequency;
    }

    public int getDocumentFrequency() {
        return documentFrequency;
    }

    public int getFirstOccurrence() {
        return firstOccurrence;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass())
            return false;
        RankedKeyword that = (RankedKeyword) o;
        return Double.compare(score, that.score) == 0 && Double.compare(rakeScore, that.rakeScore) == 0 && termFrequency == that.termFrequency
                        && documentFrequency == that.documentFrequency && firstOccurrence == that.firstOccurrence && Objects.equal(keyword, that.keyword);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(keyword, score, rakeScore, termFrequency, documentFrequency, firstOccurrence);
    }

    @Override
    public String toString() {
        return "['" + keyword + "', score=" + score + ", rakeScore=" + rakeScore + ", tf=" + termFrequency + ", df=" + documentFrequency + "]";
    }
}
