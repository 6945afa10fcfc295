package org.dxworks.tagframe.rewriter;

import org.dxworks.tagframe.syntax.MarkupElement;
import org.dxworks.tagframe.syntax.MarkupNode;
import org.dxworks.tagframe.syntax.SyntaxNode;
import org.dxworks.tagframe.syntax.SyntaxRewriter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Inverse of {@link ElementBuilder}: every element is replaced in its parent by its start
 * tag, body and end tag, in that order. Elements nested in a body are spliced in turn, so
 * the parent ends up with no element among its children.
 */
public class ElementFlattener extends SyntaxRewriter {

    @Override
    protected SyntaxNode rewriteNode(SyntaxNode node, SyntaxNode parent) {
        if (node.isToken() || node.getChildren().stream().noneMatch(MarkupElement.class::isInstance)) {
            return node;
        }

        List<SyntaxNode> children = node.getChildren();
        List<SyntaxNode> flattened = new ArrayList<>(children.size());
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
        while (!pending.isEmpty()) {
            SyntaxNode child = pending.pop();
            if (child instanceof MarkupElement element) {
                List<SyntaxNode> elementChildren = element.getChildren();
                for (int i = elementChildren.size() - 1; i >= 0; i--) {
                    pending.push(elementChildren.get(i));
                }
            } else {
                flattened.add(child);
            }
        }
        return ((MarkupNode) node).withChildren(flattened);
    }
}
