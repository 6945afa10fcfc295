package org.dxworks.tagframe.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Depth-first rewriter over the markup tree.
 * <p>
 * {@link #rewriteNode} runs on the way down and may replace a node before its children are
 * visited. The per-variant hooks run on the way up, after the children were rewritten. A
 * node is rebuilt only if one of its children changed, so untouched subtrees are shared
 * between input and output. Returning {@code null} from either step drops the node.
 * <p>
 * The walk keeps its own stack, so it handles documents nested arbitrarily deep.
 */
public abstract class SyntaxRewriter {

    public SyntaxNode visit(SyntaxNode node) {
        return visit(node, null);
    }

    /**
     * @param parent the node whose children are being visited, or {@code null} for the root
     */
    public SyntaxNode visit(SyntaxNode node, SyntaxNode parent) {
        if (node == null) {
            return null;
        }
        SyntaxNode root = rewriteNode(node, parent);
        if (root == null || root.isToken()) {
            return root == null ? null : dispatch(root, parent);
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame((MarkupNode) root, parent));
        SyntaxNode result = null;
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.hasNext()) {
                SyntaxNode child = rewriteNode(frame.current(), frame.node);
                if (child == null) {
                    frame.accept(null);
                } else if (child.isToken()) {
                    frame.accept(dispatch(child, frame.node));
                } else {
                    stack.push(new Frame((MarkupNode) child, frame.node));
                }
                continue;
            }

            stack.pop();
            SyntaxNode done = dispatch(frame.rebuild(), frame.parent);
            if (stack.isEmpty()) {
                result = done;
            } else {
                stack.peek().accept(done);
            }
        }
        return result;
    }

    /**
     * Called before the children of {@code node} are visited. The returned node is the one
     * whose children get visited.
     */
    protected SyntaxNode rewriteNode(SyntaxNode node, SyntaxNode parent) {
        return node;
    }

    private SyntaxNode dispatch(SyntaxNode node, SyntaxNode parent) {
        if (node instanceof SyntaxToken token) {
            return visitToken(token, parent);
        }
        if (node instanceof MarkupElement element) {
            return visitElement(element, parent);
        }
        if (node instanceof MarkupTagBlock tagBlock) {
            return visitTagBlock(tagBlock, parent);
        }
        if (node instanceof MarkupTextLiteral literal) {
            return visitTextLiteral(literal, parent);
        }
        return visitBlock((MarkupNode) node, parent);
    }

    protected SyntaxNode visitToken(SyntaxToken token, SyntaxNode parent) {
        return token;
    }

    protected SyntaxNode visitTextLiteral(MarkupTextLiteral literal, SyntaxNode parent) {
        return literal;
    }

    protected SyntaxNode visitTagBlock(MarkupTagBlock tagBlock, SyntaxNode parent) {
        return tagBlock;
    }

    protected SyntaxNode visitElement(MarkupElement element, SyntaxNode parent) {
        return element;
    }

    protected SyntaxNode visitBlock(MarkupNode block, SyntaxNode parent) {
        return block;
    }

    /**
     * A composite whose children are being visited.
     */
    private static final class Frame {
        private final MarkupNode node;
        private final SyntaxNode parent;
        private final List<SyntaxNode> children;
        private List<SyntaxNode> rewritten;
        private int index;

        Frame(MarkupNode node, SyntaxNode parent) {
            this.node = node;
            this.parent = parent;
            this.children = node.getChildren();
        }

        boolean hasNext() {
            return index < children.size();
        }

        SyntaxNode current() {
            return children.get(index);
        }

        void accept(SyntaxNode result) {
            SyntaxNode child = children.get(index);
            if (rewritten == null && result != child) {
                rewritten = new ArrayList<>(children.subList(0, index));
            }
            if (rewritten != null && result != null) {
                rewritten.add(result);
            }
            index++;
        }

        SyntaxNode rebuild() {
            return rewritten == null ? node : node.withChildren(rewritten);
        }
    }
}
