package org.dxworks.tagframe.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * A start tag, its body and its end tag. Either tag may be missing after recovery,
 * but never both. Children are {@code [startTag?] ++ body ++ [endTag?]}.
 */
public final class MarkupElement extends MarkupNode {

    private final MarkupTagBlock startTag;
    private final List<SyntaxNode> body;
    private final MarkupTagBlock endTag;

    private MarkupElement(MarkupTagBlock startTag, List<SyntaxNode> body, MarkupTagBlock endTag) {
        super(SyntaxKind.MARKUP_ELEMENT, concat(startTag, body, endTag));
        this.startTag = startTag;
        this.body = body;
        this.endTag = endTag;
    }

    public static MarkupElement create(MarkupTagBlock startTag, List<? extends SyntaxNode> body, MarkupTagBlock endTag) {
        if (startTag == null && endTag == null) {
            throw new IllegalArgumentException("An element needs a start tag or an end tag");
        }
        return new MarkupElement(startTag, List.copyOf(body), endTag);
    }

    public MarkupTagBlock getStartTag() {
        return startTag;
    }

    public List<SyntaxNode> getBody() {
        return body;
    }

    public MarkupTagBlock getEndTag() {
        return endTag;
    }

    /**
     * Tag name of the start tag, or of the end tag for a startless element.
     */
    public String getTagName() {
        return startTag != null ? startTag.getTagName() : endTag.getTagName();
    }

    /**
     * Maps a rewritten child list back onto the slots: the first child fills the start tag
     * and the last child the end tag, when this element has them.
     */
    @Override
    public MarkupElement withChildren(List<? extends SyntaxNode> children) {
        int bodyFrom = startTag != null ? 1 : 0;
        int bodyTo = endTag != null ? children.size() - 1 : children.size();
        if (bodyTo < bodyFrom) {
            throw new IllegalArgumentException("Not enough children to fill the tag slots of <" + getTagName() + ">");
        }
        MarkupTagBlock newStart = startTag != null ? asTagBlock(children.get(0)) : null;
        MarkupTagBlock newEnd = endTag != null ? asTagBlock(children.get(children.size() - 1)) : null;
        return create(newStart, children.subList(bodyFrom, bodyTo), newEnd);
    }

    private static MarkupTagBlock asTagBlock(SyntaxNode node) {
        if (node instanceof MarkupTagBlock tagBlock) {
            return tagBlock;
        }
        throw new IllegalArgumentException("Expected a tag block in a tag slot, got " + node.getKind());
    }

    private static List<SyntaxNode> concat(MarkupTagBlock startTag, List<SyntaxNode> body, MarkupTagBlock endTag) {
        List<SyntaxNode> children = new ArrayList<>(body.size() + 2);
        if (startTag != null) children.add(startTag);
        children.addAll(body);
        if (endTag != null) children.add(endTag);
        return children;
    }

    /**
     * A start-only element and an end-only element can hold the same children, so the
     * slots that are filled take part in equality.
     */
    @Override
    protected boolean hasSameSlots(MarkupNode other) {
        MarkupElement element = (MarkupElement) other;
        return (startTag == null) == (element.startTag == null)
                && (endTag == null) == (element.endTag == null);
    }
}
