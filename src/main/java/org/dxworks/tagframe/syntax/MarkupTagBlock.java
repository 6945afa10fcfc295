package org.dxworks.tagframe.syntax;

import java.util.List;

/**
 * One {@code <...>} delimiter: start, end, void or self-closing tag.
 * The first child is the text literal holding the opening delimiter and the tag name.
 */
public final class MarkupTagBlock extends MarkupNode {

    public MarkupTagBlock(List<? extends SyntaxNode> children) {
        super(SyntaxKind.MARKUP_TAG_BLOCK, children);
    }

    /**
     * Name following {@code <} or {@code </}. Empty when the delimiter is not
     * directly followed by a name ({@code <>}, {@code </ div>}).
     */
    public String getTagName() {
        if (getChildren().isEmpty() || !(getChildren().get(0) instanceof MarkupTextLiteral nameLiteral)) {
            return "";
        }
        List<SyntaxToken> tokens = nameLiteral.getLiteralTokens();
        int i = 0;
        if (i < tokens.size() && tokens.get(i).getKind() == SyntaxKind.OPEN_ANGLE) i++;
        if (i < tokens.size() && tokens.get(i).getKind() == SyntaxKind.FORWARD_SLASH) i++;
        if (i < tokens.size() && tokens.get(i).getKind() == SyntaxKind.TEXT) {
            return tokens.get(i).getText();
        }
        return "";
    }

    @Override
    public MarkupTagBlock withChildren(List<? extends SyntaxNode> children) {
        return new MarkupTagBlock(children);
    }
}
