package org.dxworks.tagframe.parser;

import org.dxworks.tagframe.syntax.MarkupBlock;
import org.dxworks.tagframe.syntax.MarkupDiagnostic;
import org.dxworks.tagframe.syntax.MarkupSyntaxTree;
import org.dxworks.tagframe.syntax.MarkupTagBlock;
import org.dxworks.tagframe.syntax.MarkupTextLiteral;
import org.dxworks.tagframe.syntax.ParserOptions;
import org.dxworks.tagframe.syntax.SourceDocument;
import org.dxworks.tagframe.syntax.SyntaxKind;
import org.dxworks.tagframe.syntax.SyntaxNode;
import org.dxworks.tagframe.syntax.SyntaxToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Splits markup source into a flat document of text literals and tag blocks.
 * Tags are not paired here; that is the job of the element rewriter.
 * <p>
 * Every character of the source ends up in exactly one token, so the content of the
 * resulting root is always equal to the source text. Problems are reported as
 * diagnostics, never thrown:
 * - TF1001 a tag or declaration cut off by the end of input
 * - TF1002 a comment without {@code -->}
 * - TF1003 a script/style element without its end tag
 * - TF1004 a quoted attribute value without its closing quote
 */
public final class MarkupParser {

    private static final Set<String> RAW_TEXT_ELEMENTS = Set.of("script", "style");

    private final SourceDocument source;
    private final ParserOptions options;
    private final String text;

    private final List<SyntaxNode> children = new ArrayList<>();
    private final List<SyntaxToken> pendingText = new ArrayList<>();
    private final List<MarkupDiagnostic> diagnostics = new ArrayList<>();
    private int pos;

    public MarkupParser(SourceDocument source, ParserOptions options) {
        this.source = Objects.requireNonNull(source, "source");
        this.options = Objects.requireNonNull(options, "options");
        this.text = source.getText();
    }

    public MarkupSyntaxTree parse() {
        children.clear();
        pendingText.clear();
        diagnostics.clear();
        pos = 0;

        while (pos < text.length()) {
            if (text.startsWith("<!--", pos)) {
                readComment();
            } else if (isDeclarationStart()) {
                readDeclaration();
            } else if (isTagStart()) {
                flushText();
                readTag();
            } else {
                readText();
            }
        }
        flushText();

        return MarkupSyntaxTree.create(MarkupBlock.document(children), source, diagnostics, options);
    }

    private boolean isDeclarationStart() {
        if (text.charAt(pos) != '<' || pos + 1 >= text.length()) return false;
        char next = text.charAt(pos + 1);
        return next == '!' || next == '?';
    }

    private boolean isTagStart() {
        if (text.charAt(pos) != '<' || pos + 1 >= text.length()) return false;
        char next = text.charAt(pos + 1);
        return Character.isLetter(next) || next == '/' || next == '>';
    }

    private void readText() {
        int end = text.indexOf('<', pos + 1);
        if (end < 0) end = text.length();
        lexText(pos, end, pendingText);
        pos = end;
    }

    private void readComment() {
        int end = text.indexOf("-->", pos + 4);
        if (end < 0) {
            diagnostics.add(new MarkupDiagnostic(MarkupDiagnostic.UNTERMINATED_COMMENT,
                    "Comment is not closed before the end of input", pos));
            end = text.length();
        } else {
            end += 3;
        }
        lexText(pos, end, pendingText);
        pos = end;
    }

    private void readDeclaration() {
        int end = text.indexOf('>', pos + 2);
        if (end < 0) {
            diagnostics.add(new MarkupDiagnostic(MarkupDiagnostic.UNTERMINATED_TAG,
                    "Declaration is not closed before the end of input", pos));
            end = text.length();
        } else {
            end += 1;
        }
        lexText(pos, end, pendingText);
        pos = end;
    }

    private void readTag() {
        int tagStart = pos;
        List<SyntaxNode> tagChildren = new ArrayList<>(3);

        // Name literal: '<' '/'? name?
        List<SyntaxToken> nameTokens = new ArrayList<>(3);
        nameTokens.add(new SyntaxToken(SyntaxKind.OPEN_ANGLE, "<"));
        pos++;
        boolean endTag = false;
        if (pos < text.length() && text.charAt(pos) == '/') {
            nameTokens.add(new SyntaxToken(SyntaxKind.FORWARD_SLASH, "/"));
            pos++;
            endTag = true;
        }
        int nameStart = pos;
        while (pos < text.length() && isNameChar(text.charAt(pos))) pos++;
        String name = text.substring(nameStart, pos);
        if (!name.isEmpty()) {
            nameTokens.add(new SyntaxToken(SyntaxKind.TEXT, name));
        }
        tagChildren.add(new MarkupTextLiteral(nameTokens));

        List<SyntaxToken> attributeTokens = readAttributes();
        if (!attributeTokens.isEmpty()) {
            tagChildren.add(new MarkupTextLiteral(attributeTokens));
        }

        boolean selfClosing = false;
        boolean closed = true;
        if (text.startsWith("/>", pos)) {
            tagChildren.add(new MarkupTextLiteral(List.of(
                    new SyntaxToken(SyntaxKind.FORWARD_SLASH, "/"),
                    new SyntaxToken(SyntaxKind.CLOSE_ANGLE, ">"))));
            pos += 2;
            selfClosing = true;
        } else if (pos < text.length() && text.charAt(pos) == '>') {
            tagChildren.add(new MarkupTextLiteral(List.of(new SyntaxToken(SyntaxKind.CLOSE_ANGLE, ">"))));
            pos++;
        } else {
            diagnostics.add(new MarkupDiagnostic(MarkupDiagnostic.UNTERMINATED_TAG,
                    "Tag <" + name + "> is not closed before the end of input", tagStart));
            closed = false;
        }

        children.add(new MarkupTagBlock(tagChildren));

        if (closed && !endTag && !selfClosing && options.isRawTextElements()
                && RAW_TEXT_ELEMENTS.contains(name.toLowerCase(Locale.ROOT))) {
            readRawText(name);
        }
    }

    private List<SyntaxToken> readAttributes() {
        List<SyntaxToken> tokens = new ArrayList<>();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '>' || text.startsWith("/>", pos)) {
                break;
            }
            if (c == '\r' || c == '\n') {
                pos = readNewLine(pos, text.length(), tokens);
            } else if (isInlineWhitespace(c)) {
                int start = pos;
                while (pos < text.length() && isInlineWhitespace(text.charAt(pos))) pos++;
                tokens.add(new SyntaxToken(SyntaxKind.WHITESPACE, text.substring(start, pos)));
            } else if (c == '=') {
                tokens.add(new SyntaxToken(SyntaxKind.EQUALS, "="));
                pos++;
            } else if (c == '"' || c == '\'') {
                readQuoted(c, tokens);
            } else if (c == '/') {
                tokens.add(new SyntaxToken(SyntaxKind.FORWARD_SLASH, "/"));
                pos++;
            } else {
                int start = pos;
                while (pos < text.length() && isAttributeTextChar(text.charAt(pos))) pos++;
                tokens.add(new SyntaxToken(SyntaxKind.TEXT, text.substring(start, pos)));
            }
        }
        return tokens;
    }

    private void readQuoted(char quote, List<SyntaxToken> tokens) {
        SyntaxKind quoteKind = quote == '"' ? SyntaxKind.DOUBLE_QUOTE : SyntaxKind.SINGLE_QUOTE;
        int open = pos;
        tokens.add(new SyntaxToken(quoteKind, String.valueOf(quote)));
        pos++;

        int close = text.indexOf(quote, pos);
        if (close < 0) {
            diagnostics.add(new MarkupDiagnostic(MarkupDiagnostic.UNTERMINATED_ATTRIBUTE_VALUE,
                    "Attribute value is not closed before the end of input", open));
            lexText(pos, text.length(), tokens);
            pos = text.length();
            return;
        }
        lexText(pos, close, tokens);
        tokens.add(new SyntaxToken(quoteKind, String.valueOf(quote)));
        pos = close + 1;
    }

    private void readRawText(String name) {
        int end = indexOfIgnoreCase("</" + name, pos);
        if (end < 0) {
            diagnostics.add(new MarkupDiagnostic(MarkupDiagnostic.UNTERMINATED_RAW_TEXT,
                    "Element <" + name + "> is not closed before the end of input", pos));
            end = text.length();
        }
        lexText(pos, end, pendingText);
        pos = end;
    }

    private int indexOfIgnoreCase(String needle, int from) {
        for (int i = from; i + needle.length() <= text.length(); i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    private void flushText() {
        if (!pendingText.isEmpty()) {
            children.add(new MarkupTextLiteral(pendingText));
            pendingText.clear();
        }
    }

    /**
     * Tokenizes {@code text[start, end)} into TEXT, WHITESPACE and NEW_LINE tokens.
     */
    private void lexText(int start, int end, List<SyntaxToken> out) {
        int i = start;
        while (i < end) {
            char c = text.charAt(i);
            if (c == '\r' || c == '\n') {
                i = readNewLine(i, end, out);
            } else if (isInlineWhitespace(c)) {
                int runStart = i;
                while (i < end && isInlineWhitespace(text.charAt(i))) i++;
                out.add(new SyntaxToken(SyntaxKind.WHITESPACE, text.substring(runStart, i)));
            } else {
                int runStart = i;
                while (i < end && !Character.isWhitespace(text.charAt(i))) i++;
                out.add(new SyntaxToken(SyntaxKind.TEXT, text.substring(runStart, i)));
            }
        }
    }

    private int readNewLine(int i, int end, List<SyntaxToken> out) {
        if (text.charAt(i) == '\r' && i + 1 < end && text.charAt(i + 1) == '\n') {
            out.add(new SyntaxToken(SyntaxKind.NEW_LINE, "\r\n"));
            return i + 2;
        }
        out.add(new SyntaxToken(SyntaxKind.NEW_LINE, String.valueOf(text.charAt(i))));
        return i + 1;
    }

    private static boolean isInlineWhitespace(char c) {
        return c != '\r' && c != '\n' && Character.isWhitespace(c);
    }

    private static boolean isNameChar(char c) {
        return !Character.isWhitespace(c) && c != '/' && c != '>' && c != '<'
                && c != '=' && c != '"' && c != '\'';
    }

    private static boolean isAttributeTextChar(char c) {
        return !Character.isWhitespace(c) && c != '/' && c != '>' && c != '='
                && c != '"' && c != '\'';
    }
}
