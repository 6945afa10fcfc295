package org.dxworks.tagframe.syntax;

public final class ParserOptions {

    private static final ParserOptions DEFAULT = new ParserOptions(true);

    private final boolean rawTextElements;

    private ParserOptions(boolean rawTextElements) {
        this.rawTextElements = rawTextElements;
    }

    public static ParserOptions getDefault() {
        return DEFAULT;
    }

    public static ParserOptions with(boolean rawTextElements) {
        return rawTextElements ? DEFAULT : new ParserOptions(false);
    }

    /**
     * When set, the content of {@code <script>} and {@code <style>} is read as plain text
     * up to the matching end tag.
     */
    public boolean isRawTextElements() {
        return rawTextElements;
    }
}
