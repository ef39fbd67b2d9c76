package kwe.util.keyword;

import com.google.common.base.Objects;

/** A word found in input text: the surface form as it appeared and the case-folded form used for all comparisons. */
public final class Token {
    private final String surface;

    // used so frequently that we cache it at creation time.
    private final String normalized;

    public Token(String surface) {
        this.surface = surface;
        this.normalized = StopwordSet.normalize(surface);
    }

    public String getSurface() {
        return surface;
    }

    public String getNormalized() {
        return normalized;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass())
            return false;
        Token that = (Token) o;
        return Objects.equal(surface, that.surface);
    }

    @Override
    public int hashCode() {
        return surface.hashCode();
    }

    @Override
    public String toString() {
        return "['" + surface + "', normalized=" + normalized + "]";
    }
}
