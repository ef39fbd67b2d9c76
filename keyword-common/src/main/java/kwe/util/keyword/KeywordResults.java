package kwe.util.keyword;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Objects;
import com.google.gson.Gson;

/** The keywords extracted from one document, with the source and language they were extracted for. Serializable to and from JSON. */
public class KeywordResults {

    static final Gson gson = new Gson();

    private final String source;
    private final String language;
    private final LinkedHashMap<String,Double> keywords;

    public KeywordResults() {
        this("", "", new LinkedHashMap<>());
    }

    public KeywordResults(String source, String language, Map<String,Double> keywords) {
        this.source = source == null ? "" : source;
        this.language = language == null ? "" : language;
        this.keywords = keywords == null ? new LinkedHashMap<>() : new LinkedHashMap<>(keywords);
    }

    public String getSource() {
        return source;
    }

    public String getLanguage() {
        return language;
    }

    /** @return a read-only view of the keywords and scores, best first */
    public Map<String,Double> getKeywords() {
        return Collections.unmodifiableMap(keywords);
    }

    public int getKeywordCount() {
        return keywords.size();
    }

    public String toJson() {
        return gson.toJson(this);
    }

    public static KeywordResults fromJson(String json) {
        return gson.fromJson(json, KeywordResults.class);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass())
            return false;
        KeywordResults that = (KeywordResults) o;
        return Objects.equal(source, that.source) && Objects.equal(language, that.language) && Objects.equal(keywords, that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(source, language, keywords);
    }

    @Override
    public String toString() {
        return "KeywordResults{source='" + source + "', language='" + language + "', keywords=" + keywords + '}';
    }
}
