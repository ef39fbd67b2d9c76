package kwe.util.keyword.language;

import java.util.Locale;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.ibm.icu.text.BreakIterator;

import kwe.util.keyword.StopwordSet;

/**
 * The languages that ship a stopword list with this library. UNKNOWN has no stopwords and breaks sentences with US rules, so every word run between sentence
 * ends becomes a single candidate.
 */
public enum BaseKeywordLanguage implements KeywordLanguage {
    ENGLISH("english", Locale.ENGLISH),
    FRENCH("french", Locale.FRENCH),
    GERMAN("german", Locale.GERMAN),
    ITALIAN("italian", Locale.ITALIAN),
    SPANISH("spanish", new Locale("es")),
    UNKNOWN("unknown", null);

    private final String name;
    private final Locale locale;

    /** loaded on first use, then shared */
    private final Supplier<StopwordSet> stopwords;

    BaseKeywordLanguage(String name, Locale locale) {
        this.name = name;
        this.locale = locale;
        this.stopwords = locale == null ? StopwordSet::empty : Suppliers.memoize(() -> Stopwords.load(name));
        Registry.add(this);
    }

    @Override
    public String getLanguageName() {
        return name;
    }

    @Override
    public String getLanguageCode() {
        return locale == null ? "zz" : locale.getLanguage();
    }

    @Override
    public StopwordSet getStopwords() {
        return stopwords.get();
    }

    @Override
    public BreakIterator getSentenceBreakIterator() {
        return BreakIterator.getSentenceInstance(locale == null ? Locale.US : locale);
    }
}
