package kwe.util.keyword;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tests for the full extraction pipeline, from raw text to ranked keywords */
public class RakeTfIdfKeywordExtractorTest {
    public static final Logger log = LoggerFactory.getLogger(RakeTfIdfKeywordExtractorTest.class);

    static final String TARGET = CorpusComparatorTest.TARGET;
    static final List<String> CORPUS = List.of(CorpusComparatorTest.TARGET, CorpusComparatorTest.COMMON_DOC, CorpusComparatorTest.OTHER_COMMON_DOC);

    static RakeTfIdfKeywordExtractor.Builder builder() {
        return new RakeTfIdfKeywordExtractor.Builder().withStopwords(List.of("the"));
    }

    @Test
    public void testScenario() {
        //@formatter:off
        RakeTfIdfKeywordExtractor extractor = new RakeTfIdfKeywordExtractor.Builder()
                .withStopwords(BreakIteratorSegmenterTest.SCENARIO_STOPWORDS)
                .build();
        //@formatter:on

        List<RankedKeyword> keywords = extractor.extract(BreakIteratorSegmenterTest.SCENARIO_INPUT, List.of(), 3, 10);
        keywords.forEach(k -> log.info(k.toString()));

        assertEquals(1, keywords.size());
        RankedKeyword top = keywords.get(0);
        assertEquals("Fast keyword extraction", top.getKeyword());
        assertEquals("fast keyword extraction", top.getNormalizedKeyword());
        assertEquals(8.0, top.getRakeScore(), 1e-9);
        assertEquals(1, top.getTermFrequency());
        assertEquals(1.0, top.getScore(), 1e-9);
    }

    @Test
    public void testEmptyTarget() {
        RakeTfIdfKeywordExtractor extractor = builder().build();
        assertTrue(extractor.extract("", CORPUS, 3, 10).isEmpty());
        assertTrue(extractor.extract(" \n\t ", CORPUS, 3, 10).isEmpty());
        assertTrue(extractor.extract("the the the", CORPUS, 3, 10).isEmpty());
        assertTrue(extractor.extractKeywords("", CORPUS).isEmpty());
    }

    @Test
    public void testCommonPhraseRanksBelowRarePhrase() {
        List<RankedKeyword> keywords = builder().build().extract(TARGET, CORPUS, 3, 10);

        assertEquals(2, keywords.size());
        assertEquals("Quantum annealing chip", keywords.get(0).getKeyword());
        assertEquals("Solar power grid", keywords.get(1).getKeyword());
        assertTrue(keywords.get(1).getScore() < keywords.get(0).getScore());
        assertEquals(0.0, keywords.get(1).getScore(), 1e-9);
    }

    @Test
    public void testLimitLargerThanCandidates() {
        List<RankedKeyword> keywords = builder().build().extract(TARGET, CORPUS, 3, 100);
        assertEquals(2, keywords.size());
    }

    @Test
    public void testLimitTruncates() {
        List<RankedKeyword> keywords = builder().build().extract(TARGET, CORPUS, 3, 1);
        assertEquals(1, keywords.size());
        assertEquals("Quantum annealing chip", keywords.get(0).getKeyword());
    }

    @Test
    public void testEqualWeightsFallBackToRakeScore() {
        // with no corpus, every candidate's weight is its term frequency
        String target = "Deep sea mining. Mining. Kelp.";
        List<RankedKeyword> keywords = builder().build().extract(target, List.of(), 3, 10);

        // four distinct words: only "deep sea mining" (3 + 3 + 2) survives pruning
        assertEquals(1, keywords.size());
        assertEquals("Deep sea mining", keywords.get(0).getKeyword());

        String wider = "Deep sea mining. Kelp forests. Coral reefs. Tidal energy. Ocean floor. Kelp.";
        List<RankedKeyword> ranked = builder().build().extract(wider, List.of(), 3, 10);
        ranked.forEach(k -> log.info(k.toString()));
        for (int i = 1; i < ranked.size(); i++) {
            RankedKeyword previous = ranked.get(i - 1);
            RankedKeyword current = ranked.get(i);
            assertTrue(RankedKeyword.BY_RANK.compare(previous, current) < 0);
            if (previous.getScore() == current.getScore()) {
                assertTrue(previous.getRakeScore() >= current.getRakeScore());
            }
        }
        assertEquals("Deep sea mining", ranked.get(0).getKeyword());
    }

    @Test
    public void testDeterministic() {
        RakeTfIdfKeywordExtractor extractor = builder().build();
        List<RankedKeyword> first = extractor.extract(TARGET, CORPUS, 3, 10);
        List<RankedKeyword> second = extractor.extract(TARGET, CORPUS, 3, 10);
        assertEquals(first, second);
        assertEquals(first.toString(), second.toString());
    }

    @Test
    public void testParallelCorpus() {
        List<RankedKeyword> sequential = builder().build().extract(TARGET, CORPUS, 3, 10);
        List<RankedKeyword> parallel = builder().withParallelCorpus(true).build().extract(TARGET, CORPUS, 3, 10);
        assertEquals(sequential, parallel);
    }

    @Test
    public void testInvalidConfigurationFailsBeforeSegmentation() {
        Segmenter failing = new Segmenter() {
            @Override
            public List<String> breakSentences(String text) {
                throw new AssertionError("segmentation should not start");
            }

            @Override
            public List<Token> tokenizeSentence(String sentence) {
                throw new AssertionError("segmentation should not start");
            }

            @Override
            public List<CandidatePhrase> chunkPhrases(List<String> sentences) {
                throw new AssertionError("segmentation should not start");
            }
        };
        RakeTfIdfKeywordExtractor extractor = new RakeTfIdfKeywordExtractor.Builder().withSegmenter(failing).build();

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> extractor.extract(TARGET, CORPUS, 0, 10));
        assertTrue(e.getMessage().contains("maxKeywordSize"));
        e = assertThrows(InvalidConfigurationException.class, () -> extractor.extract(TARGET, CORPUS, 3, 0));
        assertTrue(e.getMessage().contains("limit"));
    }

    @Test
    public void testInvalidBuilderConfiguration() {
        assertThrows(InvalidConfigurationException.class, () -> builder().withMaxKeywordSize(0).build());
        assertThrows(InvalidConfigurationException.class, () -> builder().withKeywordCount(-1).build());
    }

    @Test
    public void testMaxKeywordSize() {
        String target = "Large scale distributed stream processing systems. Stream processing.";
        List<RankedKeyword> keywords = builder().build().extract(target, List.of(), 2, 10);
        assertEquals(1, keywords.size());
        assertEquals("Stream processing", keywords.get(0).getKeyword());
        assertEquals(8.0, keywords.get(0).getRakeScore(), 1e-9);
    }

    @Test
    public void testMaxContentLengthKeepsWholeWords() {
        // "Solar power grid. ..." cut at 10 characters would split "power"
        RakeTfIdfKeywordExtractor extractor = builder().withMaxContentLength(10).build();
        List<RankedKeyword> keywords = extractor.extract(TARGET, List.of(), 3, 10);
        assertEquals(1, keywords.size());
        assertEquals("Solar", keywords.get(0).getKeyword());

        assertEquals("Solar", extractor.trimContent("Solar power grid"));
        assertEquals("Solar power", builder().withMaxContentLength(11).build().trimContent("Solar power grid"));
        assertEquals("", extractor.trimContent("Photovoltaics"));
        assertEquals("Solar", extractor.trimContent("Solar"));
    }

    @Test
    public void testContentIsNotCappedByDefault() {
        assertEquals(0, builder().build().getMaxContentLength());

        String longDocument = "Wind turbines spin. ".repeat(2500) + "Quantum annealing chip.";
        assertTrue(longDocument.length() > 32768);

        List<RankedKeyword> keywords = builder().build().extract(TARGET, List.of(longDocument), 3, 10);
        RankedKeyword chip = keywords.stream().filter(k -> k.getKeyword().equals("Quantum annealing chip")).findFirst().orElseThrow();
        assertEquals(1, chip.getDocumentFrequency());
        assertEquals(0.0, chip.getScore(), 1e-9);
    }

    @Test
    public void testMaxContentLengthLeavesCorpusWhole() {
        String longDocument = "Wind turbines spin. ".repeat(10) + "Quantum annealing chip.";
        List<RankedKeyword> keywords = builder().withMaxContentLength(50).build().extract(TARGET, List.of(longDocument), 3, 10);
        RankedKeyword chip = keywords.stream().filter(k -> k.getKeyword().equals("Quantum annealing chip")).findFirst().orElseThrow();
        assertEquals(1, chip.getDocumentFrequency());
    }

    @Test
    public void testExtractKeywordsUsesConfiguredCount() {
        RakeTfIdfKeywordExtractor extractor = builder().withKeywordCount(1).build();
        LinkedHashMap<String,Double> keywords = extractor.extractKeywords(TARGET, CORPUS);
        assertEquals(1, keywords.size());
        assertEquals(Math.log(3), keywords.get("Quantum annealing chip"), 1e-9);
    }
}
