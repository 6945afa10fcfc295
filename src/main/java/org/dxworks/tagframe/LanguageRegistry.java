package org.dxworks.tagframe;

import org.dxworks.tagframe.analyzer.HtmlAnalyzer;
import org.dxworks.tagframe.analyzer.MarkupAnalyzer;
import org.dxworks.tagframe.analyzer.markdown.MarkdownAnalyzer;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class LanguageRegistry {

    public static Map<Language, MarkupAnalyzer> buildAnalyzers(TagframeConfig config) {
        Map<Language, MarkupAnalyzer> analyzers = new EnumMap<>(Language.class);
        for (Language lang : Language.values()) {
            analyzers.put(lang, createAnalyzer(lang, config));
        }
        return Collections.unmodifiableMap(analyzers);
    }

    private static MarkupAnalyzer createAnalyzer(Language lang, TagframeConfig config) {
        return switch (lang) {
            case HTML, RAZOR -> new HtmlAnalyzer(lang, config);
            case MARKDOWN -> new MarkdownAnalyzer(config);
        };
    }
}
