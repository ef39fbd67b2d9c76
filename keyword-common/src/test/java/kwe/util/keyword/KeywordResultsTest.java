package kwe.util.keyword;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class KeywordResultsTest {

    static final String EXPECTED_SOURCE = "NEWS_SOURCE";
    static final String EXPECTED_LANGUAGE = "english";

    static final LinkedHashMap<String,Double> EXPECTED_NEWS_OUTPUT = new LinkedHashMap<>();
    static {
        LinkedHashMap<String,Double> m = EXPECTED_NEWS_OUTPUT;
        m.put("quantum annealing chip", 1.3862943611198906);
        m.put("researchers built", 0.6931471805599453);
        m.put("solar power grid", 0.0);
    }

    @Test
    public void testConstructEmpty() {
        KeywordResults results = new KeywordResults();
        assertTrue(results.getKeywords().isEmpty());
        assertEquals(0, results.getKeywordCount());
        assertTrue(results.getSource().isEmpty());
        assertTrue(results.getLanguage().isEmpty());
    }

    @Test
    public void testConstructFull() {
        KeywordResults results = new KeywordResults(EXPECTED_SOURCE, EXPECTED_LANGUAGE, EXPECTED_NEWS_OUTPUT);
        assertEquals(3, results.getKeywordCount());
        assertEquals(EXPECTED_NEWS_OUTPUT, results.getKeywords());
        assertEquals(EXPECTED_SOURCE, results.getSource());
        assertEquals(EXPECTED_LANGUAGE, results.getLanguage());
    }

    @Test
    public void testKeywordsAreReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> KeywordExtractor.EMPTY_RESULTS.getKeywords().put("solar power grid", 1.0));
        assertEquals(0, KeywordExtractor.EMPTY_RESULTS.getKeywordCount());

        LinkedHashMap<String,Double> keywords = new LinkedHashMap<>(EXPECTED_NEWS_OUTPUT);
        KeywordResults results = new KeywordResults(EXPECTED_SOURCE, EXPECTED_LANGUAGE, keywords);
        keywords.clear();
        assertEquals(EXPECTED_NEWS_OUTPUT, results.getKeywords());
        assertThrows(UnsupportedOperationException.class, () -> results.getKeywords().remove("researchers built"));
    }

    @Test
    public void testSerializeDeserializeJsonPopulated() {
        KeywordResults results = new KeywordResults(EXPECTED_SOURCE, EXPECTED_LANGUAGE, EXPECTED_NEWS_OUTPUT);
        String resultsJson = results.toJson();
        KeywordResults deserialized = KeywordResults.fromJson(resultsJson);
        assertEquals(results, deserialized);
        // rank order survives the round trip
        assertEquals(new ArrayList<>(results.getKeywords().keySet()), new ArrayList<>(deserialized.getKeywords().keySet()));
    }

    @Test
    public void testSerializeDeserializeJsonEmpty() {
        KeywordResults results = new KeywordResults();
        KeywordResults deserialized = KeywordResults.fromJson(results.toJson());
        assertEquals(results.getKeywordCount(), deserialized.getKeywordCount());
        assertEquals(results.getSource(), deserialized.getSource());
        assertEquals(results.getLanguage(), deserialized.getLanguage());
    }

    @Test
    public void testExtractorResultsRoundTrip() {
        KeywordResults results = new KeywordExtractor(EXPECTED_SOURCE, EXPECTED_LANGUAGE, Map.of()).extractKeywords(KeywordExtractorTest.TARGET,
                        KeywordExtractorTest.CORPUS);
        assertEquals(EXPECTED_NEWS_OUTPUT, results.getKeywords());
        assertEquals(results, KeywordResults.fromJson(results.toJson()));
    }
}
