package org.dxworks.tagframe.syntax;

import java.util.List;
import java.util.Objects;

public final class SyntaxToken extends SyntaxNode {

    private final String text;

    public SyntaxToken(SyntaxKind kind, String text) {
        super(kind);
        if (!kind.isToken()) {
            throw new IllegalArgumentException("Not a token kind: " + kind);
        }
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public List<SyntaxNode> getChildren() {
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxToken other)) return false;
        return getKind() == other.getKind() && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKind(), text);
    }

    @Override
    public String toString() {
        return getKind() + "(" + text + ")";
    }
}
