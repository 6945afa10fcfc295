package org.dxworks.tagframe.syntax;

import java.util.List;

/**
 * Generic container node; a parsed document root has kind {@link SyntaxKind#DOCUMENT}.
 */
public final class MarkupBlock extends MarkupNode {

    public MarkupBlock(SyntaxKind kind, List<? extends SyntaxNode> children) {
        super(kind, children);
        if (kind != SyntaxKind.DOCUMENT && kind != SyntaxKind.MARKUP_BLOCK) {
            throw new IllegalArgumentException("Unsupported block kind: " + kind);
        }
    }

    public static MarkupBlock document(List<? extends SyntaxNode> children) {
        return new MarkupBlock(SyntaxKind.DOCUMENT, children);
    }

    @Override
    public MarkupBlock withChildren(List<? extends SyntaxNode> children) {
        return new MarkupBlock(getKind(), children);
    }
}
