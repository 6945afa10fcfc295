package org.dxworks.tagframe.rewriter;

import org.dxworks.tagframe.syntax.MarkupSyntaxTree;
import org.dxworks.tagframe.syntax.SyntaxNode;

import java.util.Objects;

/**
 * Entry points for converting between flat tag-block trees and element trees.
 * Source, diagnostics and options are carried over unchanged; only the shape of the
 * tree differs.
 */
public final class MarkupElementRewriter {

    private MarkupElementRewriter() {
        // utility class
    }

    public static MarkupSyntaxTree rewrite(MarkupSyntaxTree syntaxTree) {
        Objects.requireNonNull(syntaxTree, "syntaxTree");
        SyntaxNode rewrittenRoot = new ElementBuilder().visit(syntaxTree.getRoot());
        return MarkupSyntaxTree.create(rewrittenRoot, syntaxTree.getSource(), syntaxTree.getDiagnostics(), syntaxTree.getOptions());
    }

    public static MarkupSyntaxTree flatten(MarkupSyntaxTree syntaxTree) {
        Objects.requireNonNull(syntaxTree, "syntaxTree");
        SyntaxNode rewrittenRoot = new ElementFlattener().visit(syntaxTree.getRoot());
        return MarkupSyntaxTree.create(rewrittenRoot, syntaxTree.getSource(), syntaxTree.getDiagnostics(), syntaxTree.getOptions());
    }
}
