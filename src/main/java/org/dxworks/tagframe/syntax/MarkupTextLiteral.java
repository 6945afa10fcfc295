package org.dxworks.tagframe.syntax;

import java.util.ArrayList;
import java.util.List;

public final class MarkupTextLiteral extends MarkupNode {

    private final List<SyntaxToken> literalTokens;

    public MarkupTextLiteral(List<? extends SyntaxNode> tokens) {
        super(SyntaxKind.MARKUP_TEXT_LITERAL, tokens);
        List<SyntaxToken> literal = new ArrayList<>(tokens.size());
        for (SyntaxNode node : tokens) {
            if (!(node instanceof SyntaxToken token)) {
                throw new IllegalArgumentException("Text literal can only hold tokens, got " + node.getKind());
            }
            literal.add(token);
        }
        this.literalTokens = List.copyOf(literal);
    }

    public List<SyntaxToken> getLiteralTokens() {
        return literalTokens;
    }

    @Override
    public MarkupTextLiteral withChildren(List<? extends SyntaxNode> children) {
        return new MarkupTextLiteral(children);
    }
}
