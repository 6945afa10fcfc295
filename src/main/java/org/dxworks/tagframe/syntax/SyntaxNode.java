package org.dxworks.tagframe.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Base type of the immutable markup syntax tree.
 * A node is either a {@link SyntaxToken} (leaf) or a {@link MarkupNode} (composite).
 * Nodes do not know their parent; traversals pass it along explicitly.
 * <p>
 * Unclosed markup nests as deep as the document is long, so every walk over the tree
 * uses an explicit stack instead of recursion.
 */
public abstract class SyntaxNode {

    private final SyntaxKind kind;

    protected SyntaxNode(SyntaxKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public boolean isToken() {
        return kind.isToken();
    }

    public abstract List<SyntaxNode> getChildren();

    /**
     * Rendered text of this node: the concatenation of all leaf token texts.
     */
    public String getContent() {
        StringBuilder sb = new StringBuilder();
        for (SyntaxToken token : getTokens()) {
            sb.append(token.getText());
        }
        return sb.toString();
    }

    /**
     * All leaf tokens of this node in document order.
     */
    public List<SyntaxToken> getTokens() {
        List<SyntaxToken> tokens = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node instanceof SyntaxToken token) {
                tokens.add(token);
                continue;
            }
            List<SyntaxNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return tokens;
    }
}
