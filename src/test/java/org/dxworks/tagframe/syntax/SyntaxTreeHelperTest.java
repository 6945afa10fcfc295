package org.dxworks.tagframe.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreeHelperTest {

    private static SyntaxToken text(String s) {
        return new SyntaxToken(SyntaxKind.TEXT, s);
    }

    private static MarkupTextLiteral literal(String s) {
        return new MarkupTextLiteral(List.of(text(s)));
    }

    @Test
    void replaceRangeSubstitutesInclusiveRangeAndSharesTheRest() {
        MarkupTextLiteral a = literal("a");
        MarkupTextLiteral b = literal("b");
        MarkupTextLiteral c = literal("c");
        MarkupTextLiteral d = literal("d");
        MarkupBlock parent = MarkupBlock.document(List.of(a, b, c, d));
        MarkupTextLiteral replacement = literal("x");

        MarkupNode result = SyntaxTreeHelper.replaceRange(parent, 1, 2, replacement);

        assertEquals(3, result.getChildren().size());
        assertSame(a, result.getChildren().get(0));
        assertSame(replacement, result.getChildren().get(1));
        assertSame(d, result.getChildren().get(2));
        assertEquals(SyntaxKind.DOCUMENT, result.getKind());
        // the input is untouched
        assertEquals(4, parent.getChildren().size());
    }

    @Test
    void replaceRangeRejectsBadIndexes() {
        MarkupBlock parent = MarkupBlock.document(List.of(literal("a")));

        assertThrows(IndexOutOfBoundsException.class, () -> SyntaxTreeHelper.replaceRange(parent, 0, 1, literal("x")));
        assertThrows(IndexOutOfBoundsException.class, () -> SyntaxTreeHelper.replaceRange(parent, -1, 0, literal("x")));
        assertThrows(NullPointerException.class, () -> SyntaxTreeHelper.replaceRange(parent, 0, 0, null));
    }

    @Test
    void replaceWithChildrenSplicesOrRemoves() {
        MarkupTextLiteral a = literal("a");
        MarkupTextLiteral b = literal("b");
        MarkupBlock parent = MarkupBlock.document(List.of(a, b));

        MarkupNode spliced = SyntaxTreeHelper.replaceWithChildren(parent, 0, List.of(literal("x"), literal("y")));
        assertEquals("xyb", spliced.getContent());

        MarkupNode removed = SyntaxTreeHelper.replaceWithChildren(parent, 0, List.of());
        assertEquals(List.of(b), removed.getChildren());
    }

    @Test
    void findAllDescendantsIsInDocumentOrder() {
        MarkupTagBlock first = new MarkupTagBlock(List.of(literal("<a>")));
        MarkupTagBlock second = new MarkupTagBlock(List.of(literal("<b>")));
        MarkupBlock inner = new MarkupBlock(SyntaxKind.MARKUP_BLOCK, List.of(second));
        MarkupBlock root = MarkupBlock.document(List.of(first, inner));

        assertEquals(List.of(first, second), SyntaxTreeHelper.findAllDescendants(root, MarkupTagBlock.class));
        assertEquals(List.of("<a>", "<b>"),
                SyntaxTreeHelper.leafTokens(root).stream().map(SyntaxToken::getText).toList());
    }

    @Test
    void dumpShowsStructureWithEscapedContent() {
        MarkupSyntaxTree tree = MarkupSyntaxTree.parse(SourceDocument.of("<p title=\"q\">a\tb\n"));

        String expected = "DOCUMENT\n"
                + "  MARKUP_TAG_BLOCK \"<p title=\\\"q\\\">\"\n"
                + "  MARKUP_TEXT_LITERAL \"a\\tb\\n\"\n";
        assertEquals(expected, SyntaxTreeHelper.dump(tree.getRoot()));
    }

    @Test
    void dumpMarksMissingTags() {
        MarkupSyntaxTree tree = MarkupSyntaxTree.parse(SourceDocument.of("</x>"));
        MarkupTagBlock endTag = (MarkupTagBlock) tree.getRoot().getChildren().get(0);
        MarkupBlock root = MarkupBlock.document(List.of(MarkupElement.create(null, List.of(), endTag)));

        assertEquals("DOCUMENT\n  MARKUP_ELEMENT [x] no-start\n    MARKUP_TAG_BLOCK \"</x>\"\n",
                SyntaxTreeHelper.dump(root));
    }
}
