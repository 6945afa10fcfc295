package org.dxworks.tagframe.syntax;

import org.dxworks.tagframe.parser.MarkupParser;

import java.util.List;
import java.util.Objects;

/**
 * A syntax tree together with the source it was parsed from, the parser diagnostics and
 * the options used. Rewriting produces a new tree sharing everything but the root.
 */
public final class MarkupSyntaxTree {

    private final SyntaxNode root;
    private final SourceDocument source;
    private final List<MarkupDiagnostic> diagnostics;
    private final ParserOptions options;

    private MarkupSyntaxTree(SyntaxNode root, SourceDocument source, List<MarkupDiagnostic> diagnostics, ParserOptions options) {
        this.root = Objects.requireNonNull(root, "root");
        this.source = Objects.requireNonNull(source, "source");
        this.diagnostics = List.copyOf(diagnostics);
        this.options = Objects.requireNonNull(options, "options");
    }

    public static MarkupSyntaxTree create(SyntaxNode root, SourceDocument source, List<MarkupDiagnostic> diagnostics, ParserOptions options) {
        return new MarkupSyntaxTree(root, source, diagnostics, options);
    }

    public static MarkupSyntaxTree parse(SourceDocument source) {
        return parse(source, ParserOptions.getDefault());
    }

    public static MarkupSyntaxTree parse(SourceDocument source, ParserOptions options) {
        return new MarkupParser(source, options).parse();
    }

    public SyntaxNode getRoot() {
        return root;
    }

    public SourceDocument getSource() {
        return source;
    }

    public List<MarkupDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public ParserOptions getOptions() {
        return options;
    }
}
