package org.dxworks.tagframe.syntax;

public enum SyntaxKind {
    // Tokens
    OPEN_ANGLE(true),
    CLOSE_ANGLE(true),
    FORWARD_SLASH(true),
    EQUALS(true),
    DOUBLE_QUOTE(true),
    SINGLE_QUOTE(true),
    TEXT(true),
    WHITESPACE(true),
    NEW_LINE(true),

    // Composite nodes
    DOCUMENT(false),
    MARKUP_BLOCK(false),
    MARKUP_TEXT_LITERAL(false),
    MARKUP_TAG_BLOCK(false),
    MARKUP_ELEMENT(false);

    private final boolean token;

    SyntaxKind(boolean token) {
        this.token = token;
    }

    public boolean isToken() {
        return token;
    }
}
