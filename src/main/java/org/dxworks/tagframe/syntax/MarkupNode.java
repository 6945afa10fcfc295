package org.dxworks.tagframe.syntax;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Composite node. Children are owned exclusively and never change after construction;
 * {@link #withChildren(List)} yields a new node of the same variant.
 * <p>
 * Equality is structural. The hash is computed once at construction from the already
 * computed hashes of the children.
 */
public abstract class MarkupNode extends SyntaxNode {

    private final List<SyntaxNode> children;
    private final int hash;

    protected MarkupNode(SyntaxKind kind, List<? extends SyntaxNode> children) {
        super(kind);
        if (kind.isToken()) {
            throw new IllegalArgumentException("Not a composite kind: " + kind);
        }
        this.children = List.copyOf(children);
        this.hash = 31 * kind.hashCode() + this.children.hashCode();
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return children;
    }

    public abstract MarkupNode withChildren(List<? extends SyntaxNode> children);

    /**
     * Variant-specific part of equality that the child list does not capture.
     * Only called on nodes of the same class, kind and children count.
     */
    protected boolean hasSameSlots(MarkupNode other) {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkupNode)) return false;

        Deque<SyntaxNode> left = new ArrayDeque<>();
        Deque<SyntaxNode> right = new ArrayDeque<>();
        left.push(this);
        right.push((MarkupNode) o);
        while (!left.isEmpty()) {
            SyntaxNode a = left.pop();
            SyntaxNode b = right.pop();
            if (a == b) continue;
            if (a.getClass() != b.getClass()) return false;
            if (a instanceof SyntaxToken) {
                if (!a.equals(b)) return false;
                continue;
            }
            MarkupNode x = (MarkupNode) a;
            MarkupNode y = (MarkupNode) b;
            if (x.hash != y.hash
                    || x.getKind() != y.getKind()
                    || x.children.size() != y.children.size()
                    || !x.hasSameSlots(y)) {
                return false;
            }
            for (int i = 0; i < x.children.size(); i++) {
                left.push(x.children.get(i));
                right.push(y.children.get(i));
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getContent() + ")";
    }
}
