package kwe.util.keyword.language;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import com.ibm.icu.text.BreakIterator;

import kwe.util.keyword.StopwordSet;

/**
 * A language the extractor can segment: the stopwords that delimit candidate phrases and the rules that end sentences. Implementations add themselves to the
 * {@link Registry} so callers can pick one by name or code.
 */
public interface KeywordLanguage {

    Logger logger = LoggerFactory.getLogger(KeywordLanguage.class);

    /** @return the lower case english name of the language, e.g. {@code french}. */
    String getLanguageName();

    /** @return the ISO-639-1 code of the language, e.g. {@code fr}. */
    String getLanguageCode();

    /** @return the stopwords that close a candidate phrase. */
    StopwordSet getStopwords();

    /** @return a fresh sentence iterator; callers own it and may set text on it. */
    BreakIterator getSentenceBreakIterator();

    /** Lookup of languages by lower case name or code. */
    class Registry {
        static final Map<String,KeywordLanguage> languages = new ConcurrentHashMap<>();

        public static void add(KeywordLanguage language) {
            languages.put(language.getLanguageName(), language);
            languages.put(language.getLanguageCode(), language);
        }

        /**
         * @param nameOrCode
         *            a language name or code, in any case.
         * @return the registered language, or English when the argument is empty or unknown.
         */
        public static KeywordLanguage find(String nameOrCode) {
            // referencing the enum registers the base languages
            final KeywordLanguage fallback = BaseKeywordLanguage.ENGLISH;
            if (Strings.isNullOrEmpty(nameOrCode)) {
                return fallback;
            }

            final String key = nameOrCode.toLowerCase(Locale.ROOT);
            final KeywordLanguage language = languages.get(key);
            if (language == null) {
                logger.warn("No language registered for '{}', using {}", key, fallback.getLanguageName());
                return fallback;
            }
            return language;
        }
    }

    /**
     * Stopword lists bundled under {@code /kwe/util/keyword/stopwords/<language>.txt}, one word per line. Blank lines and lines starting with '#' are skipped.
     */
    class Stopwords {
        static final String RESOURCE_PATH = "/kwe/util/keyword/stopwords/";

        /**
         * @param language
         *            the language name, which is also the resource file name.
         * @return the stopwords listed in the resource.
         * @throws IllegalStateException
         *             if the resource is missing or can not be read.
         */
        public static StopwordSet load(String language) {
            final String resource = RESOURCE_PATH + language + ".txt";
            final URL url = KeywordLanguage.class.getResource(resource);
            try {
                if (url == null) {
                    throw new IOException("Missing stopword resource " + resource);
                }
                final List<String> lines = Resources.asCharSource(url, StandardCharsets.UTF_8).readLines();
                final ImmutableList<String> words = lines.stream().map(String::trim).filter(l -> !l.isEmpty() && !l.startsWith("#"))
                                .collect(ImmutableList.toImmutableList());
                logger.debug("Loaded {} stopwords from {}", words.size(), resource);
                return StopwordSet.of(words);
            } catch (IOException e) {
                throw new IllegalStateException("Unable to load stopwords for '" + language + "'", e);
            }
        }
    }
}
