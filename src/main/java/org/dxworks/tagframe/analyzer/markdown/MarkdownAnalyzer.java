package org.dxworks.tagframe.analyzer.markdown;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.Node;
import org.commonmark.parser.Parser;
import org.dxworks.tagframe.Language;
import org.dxworks.tagframe.TagframeConfig;
import org.dxworks.tagframe.analyzer.HtmlAnalyzer;
import org.dxworks.tagframe.analyzer.MarkupAnalyzer;
import org.dxworks.tagframe.model.Analysis;
import org.dxworks.tagframe.model.MarkupFileAnalysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the element pipeline over the raw HTML blocks of a Markdown document.
 * Each block is folded on its own; inline HTML inside paragraphs is ignored.
 */
public class MarkdownAnalyzer implements MarkupAnalyzer {

    private final Parser parser;
    private final HtmlAnalyzer htmlAnalyzer;

    public MarkdownAnalyzer(TagframeConfig config) {
        this.parser = Parser.builder().build();
        this.htmlAnalyzer = new HtmlAnalyzer(Language.MARKDOWN, config);
    }

    @Override
    public Analysis analyze(String filePath, String sourceCode) {
        MarkupFileAnalysis analysis = htmlAnalyzer.newAnalysis(filePath);

        Node document = parser.parse(sourceCode);
        HtmlBlockCollector collector = new HtmlBlockCollector();
        document.accept(collector);

        for (String block : collector.blocks) {
            htmlAnalyzer.analyzeFragment(analysis, filePath, block);
        }
        return analysis;
    }

    private static class HtmlBlockCollector extends AbstractVisitor {
        private final List<String> blocks = new ArrayList<>();

        @Override
        public void visit(HtmlBlock htmlBlock) {
            blocks.add(htmlBlock.getLiteral());
            super.visit(htmlBlock);
        }
    }
}
