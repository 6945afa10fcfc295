package org.dxworks.tagframe.syntax;

import java.util.Objects;

public final class SourceDocument {

    private final String filePath;
    private final String text;

    public SourceDocument(String filePath, String text) {
        this.filePath = filePath;
        this.text = Objects.requireNonNull(text, "text");
    }

    public static SourceDocument of(String text) {
        return new SourceDocument(null, text);
    }

    /**
     * @return the originating file, or {@code null} for in-memory sources
     */
    public String getFilePath() {
        return filePath;
    }

    public String getText() {
        return text;
    }
}
