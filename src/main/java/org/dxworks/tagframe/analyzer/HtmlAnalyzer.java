package org.dxworks.tagframe.analyzer;

import org.dxworks.tagframe.Language;
import org.dxworks.tagframe.TagframeConfig;
import org.dxworks.tagframe.model.Analysis;
import org.dxworks.tagframe.model.DiagnosticInfo;
import org.dxworks.tagframe.model.MarkupFileAnalysis;
import org.dxworks.tagframe.rewriter.MarkupElementRewriter;
import org.dxworks.tagframe.syntax.MarkupDiagnostic;
import org.dxworks.tagframe.syntax.MarkupSyntaxTree;
import org.dxworks.tagframe.syntax.ParserOptions;
import org.dxworks.tagframe.syntax.SourceDocument;

/**
 * Parses markup, folds it into elements and reports the resulting element outline.
 * Also used for the HTML fragments found in other languages (see MarkdownAnalyzer).
 */
public class HtmlAnalyzer implements MarkupAnalyzer {

    private final Language language;
    private final TagframeConfig config;
    private final ParserOptions parserOptions;

    public HtmlAnalyzer(Language language, TagframeConfig config) {
        this.language = language;
        this.config = config;
        this.parserOptions = ParserOptions.with(config.isRawTextElements());
    }

    @Override
    public Analysis analyze(String filePath, String sourceCode) {
        MarkupFileAnalysis analysis = newAnalysis(filePath);
        analyzeFragment(analysis, filePath, sourceCode);
        return analysis;
    }

    public MarkupFileAnalysis newAnalysis(String filePath) {
        MarkupFileAnalysis analysis = new MarkupFileAnalysis();
        analysis.filePath = filePath;
        analysis.language = language.getName();
        analysis.roundTripVerified = config.isVerifyRoundTrip() ? Boolean.TRUE : null;
        return analysis;
    }

    /**
     * Adds the elements of one markup fragment to {@code analysis}. Diagnostic offsets are
     * relative to the fragment.
     */
    public void analyzeFragment(MarkupFileAnalysis analysis, String filePath, String markup) {
        MarkupSyntaxTree parsed = MarkupSyntaxTree.parse(new SourceDocument(filePath, markup), parserOptions);
        MarkupSyntaxTree rewritten = MarkupElementRewriter.rewrite(parsed);

        for (MarkupDiagnostic diagnostic : rewritten.getDiagnostics()) {
            analysis.diagnostics.add(new DiagnosticInfo(diagnostic.getCode(), diagnostic.getMessage(), diagnostic.getOffset()));
        }

        ElementOutline outline = ElementOutline.build(rewritten.getRoot());
        analysis.elements.addAll(outline.getElements());
        analysis.elementCount += outline.getCount();
        analysis.maxDepth = Math.max(analysis.maxDepth, outline.getMaxDepth());
        outline.getShapes().forEach((shape, count) -> analysis.shapes.merge(shape, count, Integer::sum));

        if (analysis.roundTripVerified != null) {
            MarkupSyntaxTree flattened = MarkupElementRewriter.flatten(rewritten);
            boolean verified = flattened.getRoot().equals(parsed.getRoot());
            analysis.roundTripVerified = analysis.roundTripVerified && verified;
        }
    }
}
