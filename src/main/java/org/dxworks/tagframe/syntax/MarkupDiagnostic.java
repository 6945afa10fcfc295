package org.dxworks.tagframe.syntax;

import java.util.Objects;

public final class MarkupDiagnostic {

    public static final String UNTERMINATED_TAG = "TF1001";
    public static final String UNTERMINATED_COMMENT = "TF1002";
    public static final String UNTERMINATED_RAW_TEXT = "TF1003";
    public static final String UNTERMINATED_ATTRIBUTE_VALUE = "TF1004";

    private final String code;
    private final String message;
    private final int offset;

    public MarkupDiagnostic(String code, String message, int offset) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = Objects.requireNonNull(message, "message");
        this.offset = offset;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /** Character offset into the source text. */
    public int getOffset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkupDiagnostic other)) return false;
        return offset == other.offset && code.equals(other.code) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, offset);
    }

    @Override
    public String toString() {
        return code + "@" + offset + ": " + message;
    }
}
