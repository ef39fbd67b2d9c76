package kwe.util.keyword;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kwe.util.keyword.language.BaseKeywordLanguage;

/** Runs the english pipeline over the document fixtures and checks properties of the ranking. */
public class KeywordExtractionFixtureTest {
    private static final Logger log = LoggerFactory.getLogger(KeywordExtractionFixtureTest.class);

    private static final String DOCUMENTS = "/kwe/util/keyword/documents/";

    private static String target;
    private static List<String> corpus;

    @BeforeAll
    public static void loadDocuments() throws IOException {
        target = IOUtils.resourceToString(DOCUMENTS + "target.txt", StandardCharsets.UTF_8);
        corpus = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            corpus.add(IOUtils.resourceToString(DOCUMENTS + "corpus-" + i + ".txt", StandardCharsets.UTF_8));
        }
    }

    private static RakeTfIdfKeywordExtractor.Builder english() {
        return new RakeTfIdfKeywordExtractor.Builder().withLanguage(BaseKeywordLanguage.ENGLISH);
    }

    @Test
    public void testRanking() {
        List<RankedKeyword> keywords = english().build().extract(target, corpus, 3, 10);
        keywords.forEach(k -> log.debug(k.toString()));

        assertFalse(keywords.isEmpty());
        assertTrue(keywords.size() <= 10);

        StopwordSet stopwords = BaseKeywordLanguage.ENGLISH.getStopwords();
        for (int i = 0; i < keywords.size(); i++) {
            RankedKeyword keyword = keywords.get(i);
            String[] words = keyword.getNormalizedKeyword().split(" ");
            assertTrue(words.length <= 3, keyword.toString());
            for (String word : words) {
                assertFalse(stopwords.contains(word), keyword.toString());
            }
            assertTrue(keyword.getTermFrequency() >= 1, keyword.toString());
            assertEquals(CorpusComparator.weight(keyword.getTermFrequency(), keyword.getDocumentFrequency(), corpus.size()), keyword.getScore(), 1e-9);
            if (i > 0) {
                assertTrue(RankedKeyword.BY_RANK.compare(keywords.get(i - 1), keyword) < 0);
            }
        }
    }

    @Test
    public void testRepeatable() {
        RakeTfIdfKeywordExtractor extractor = english().build();
        List<RankedKeyword> first = extractor.extract(target, corpus, 3, 10);
        assertEquals(first, extractor.extract(target, corpus, 3, 10));
        assertEquals(first, english().withParallelCorpus(true).build().extract(target, corpus, 3, 10));
    }

    @Test
    public void testFacade() {
        KeywordResults results = new KeywordExtractor("fixtures", "english", Map.of()).extractKeywords(target, corpus);
        List<RankedKeyword> keywords = english().build().extract(target, corpus, 3, 10);
        assertEquals(keywords.size(), results.getKeywordCount());
        assertEquals(keywords.get(0).getKeyword(), results.getKeywords().keySet().iterator().next());
    }
}
