package org.dxworks.tagframe.rewriter;

import org.dxworks.tagframe.syntax.MarkupTagBlock;
import org.dxworks.tagframe.syntax.MarkupTextLiteral;
import org.dxworks.tagframe.syntax.SyntaxKind;
import org.dxworks.tagframe.syntax.SyntaxNode;
import org.dxworks.tagframe.syntax.SyntaxToken;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Predicates over a single tag block, shared by the builder and the outline.
 */
public final class TagClassifier {

    // HTML5 void elements, including the obsolete command and keygen
    private static final Set<String> VOID_ELEMENTS = Set.of(
            "area",
            "base",
            "br",
            "col",
            "command",
            "embed",
            "hr",
            "img",
            "input",
            "keygen",
            "link",
            "meta",
            "param",
            "source",
            "track",
            "wbr"
    );

    private TagClassifier() {
        // utility class
    }

    public static String getTagName(MarkupTagBlock tagBlock) {
        return tagBlock.getTagName();
    }

    public static boolean isMalformed(MarkupTagBlock tagBlock) {
        return getTagName(tagBlock).isBlank();
    }

    public static boolean isVoidElement(MarkupTagBlock tagBlock) {
        return VOID_ELEMENTS.contains(getTagName(tagBlock).toLowerCase(Locale.ROOT));
    }

    public static boolean isSelfClosing(MarkupTagBlock tagBlock) {
        List<SyntaxNode> children = tagBlock.getChildren();
        if (children.isEmpty()) return false;
        return children.get(children.size() - 1).getContent().endsWith("/>");
    }

    /**
     * A start tag's delimiter literal begins with {@code <} followed by the name, an end
     * tag's with {@code <} then {@code /}. So the slash is looked for at index 1, or at
     * index 0 when the literal holds a single token.
     */
    public static boolean isEndTag(MarkupTagBlock tagBlock) {
        List<SyntaxNode> children = tagBlock.getChildren();
        if (children.isEmpty() || !(children.get(0) instanceof MarkupTextLiteral childSpan)) {
            return false;
        }
        List<SyntaxToken> literalTokens = childSpan.getLiteralTokens();
        if (literalTokens.isEmpty()) {
            return false;
        }
        SyntaxToken relevantToken = literalTokens.get(literalTokens.size() == 1 ? 0 : 1);
        return relevantToken.getKind() == SyntaxKind.FORWARD_SLASH;
    }
}
