package org.dxworks.tagframe.rewriter;

import org.dxworks.tagframe.syntax.MarkupBlock;
import org.dxworks.tagframe.syntax.MarkupElement;
import org.dxworks.tagframe.syntax.MarkupSyntaxTree;
import org.dxworks.tagframe.syntax.MarkupTagBlock;
import org.dxworks.tagframe.syntax.MarkupTextLiteral;
import org.dxworks.tagframe.syntax.SourceDocument;
import org.dxworks.tagframe.syntax.SyntaxKind;
import org.dxworks.tagframe.syntax.SyntaxNode;
import org.dxworks.tagframe.syntax.SyntaxTreeHelper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ElementBuilderTest {

    @Test
    void properlyNestedTagsBecomeNestedElements() {
        List<SyntaxNode> children = rewrite("<div><span></span></div>");

        assertEquals(1, children.size());
        MarkupElement div = element(children.get(0));
        assertEquals("<div>", div.getStartTag().getContent());
        assertEquals("</div>", div.getEndTag().getContent());
        assertEquals(1, div.getBody().size());

        MarkupElement span = element(div.getBody().get(0));
        assertEquals("<span>", span.getStartTag().getContent());
        assertEquals("</span>", span.getEndTag().getContent());
        assertTrue(span.getBody().isEmpty());
    }

    @Test
    void overlappingTagsCloseInnerElementAndLeaveStartlessEndTag() {
        List<SyntaxNode> children = rewrite("<b><i></b></i>");
        List<SyntaxNode> flat = parse("<b><i></b></i>").getRoot().getChildren();
        MarkupTagBlock b = (MarkupTagBlock) flat.get(0);
        MarkupTagBlock i = (MarkupTagBlock) flat.get(1);
        MarkupTagBlock bEnd = (MarkupTagBlock) flat.get(2);
        MarkupTagBlock iEnd = (MarkupTagBlock) flat.get(3);

        MarkupElement expectedB = MarkupElement.create(b, List.of(MarkupElement.create(i, List.of(), null)), bEnd);
        MarkupElement expectedStartless = MarkupElement.create(null, List.of(), iEnd);
        assertEquals(List.of(expectedB, expectedStartless), children);
    }

    @Test
    void danglingEndTagBecomesStartlessElement() {
        List<SyntaxNode> children = rewrite("</div>");

        assertEquals(1, children.size());
        MarkupElement element = element(children.get(0));
        assertNull(element.getStartTag());
        assertTrue(element.getBody().isEmpty());
        assertEquals("</div>", element.getEndTag().getContent());
    }

    @Test
    void voidAndSelfClosingTagsStandAlone() {
        List<SyntaxNode> children = rewrite("<p><img><input/>text</p>");

        MarkupElement p = element(children.get(0));
        assertEquals(3, p.getBody().size());

        MarkupElement img = element(p.getBody().get(0));
        assertEquals("<img>", img.getStartTag().getContent());
        assertTrue(img.getBody().isEmpty());
        assertNull(img.getEndTag());

        MarkupElement input = element(p.getBody().get(1));
        assertEquals("<input/>", input.getStartTag().getContent());
        assertTrue(input.getBody().isEmpty());
        assertNull(input.getEndTag());

        assertInstanceOf(MarkupTextLiteral.class, p.getBody().get(2));
    }

    @Test
    void voidTagDoesNotSwallowFollowingSiblings() {
        List<SyntaxNode> children = rewrite("<br>after");

        assertEquals(2, children.size());
        assertTrue(element(children.get(0)).getBody().isEmpty());
        assertEquals("after", children.get(1).getContent());
    }

    @Test
    void unclosedStartTagTakesRemainingSiblings() {
        List<SyntaxNode> children = rewrite("<div>text");

        assertEquals(1, children.size());
        MarkupElement div = element(children.get(0));
        assertEquals("<div>", div.getStartTag().getContent());
        assertNull(div.getEndTag());
        assertEquals(1, div.getBody().size());
        assertEquals("text", div.getBody().get(0).getContent());
    }

    @Test
    void unclosedStartTagsAreClosedInnermostFirst() {
        List<SyntaxNode> children = rewrite("<div>a<p>b");

        assertEquals(1, children.size());
        MarkupElement div = element(children.get(0));
        assertEquals(2, div.getBody().size());
        assertEquals("a", div.getBody().get(0).getContent());

        MarkupElement p = element(div.getBody().get(1));
        assertEquals("<p>", p.getStartTag().getContent());
        assertNull(p.getEndTag());
        assertEquals("b", p.getBody().get(0).getContent());
    }

    @Test
    void matchingIgnoresCaseAndAttributes() {
        List<SyntaxNode> children = rewrite("<DIV id=\"x\"></div>");

        assertEquals(1, children.size());
        MarkupElement div = element(children.get(0));
        assertEquals("<DIV id=\"x\">", div.getStartTag().getContent());
        assertEquals("</div>", div.getEndTag().getContent());
    }

    @Test
    void recoveryClosesEveryTagOpenedAfterTheMatch() {
        List<SyntaxNode> children = rewrite("<ul><li>a<li>b</ul>");

        MarkupElement ul = element(children.get(0));
        assertEquals("</ul>", ul.getEndTag().getContent());
        // <li>, "a", <li>, "b": both list items closed without body
        assertEquals(4, ul.getBody().size());
        MarkupElement first = element(ul.getBody().get(0));
        MarkupElement second = element(ul.getBody().get(2));
        assertTrue(first.getBody().isEmpty());
        assertNull(first.getEndTag());
        assertTrue(second.getBody().isEmpty());
        assertNull(second.getEndTag());
    }

    @Test
    void endTagWithoutAnyOpenerInsideOpenElement() {
        List<SyntaxNode> children = rewrite("<div></span></div>");

        MarkupElement div = element(children.get(0));
        assertEquals("</div>", div.getEndTag().getContent());
        MarkupElement span = element(div.getBody().get(0));
        assertNull(span.getStartTag());
        assertEquals("</span>", span.getEndTag().getContent());
    }

    @Test
    void tagsWithoutNameBecomeStandaloneElements() {
        List<SyntaxNode> children = rewrite("<></>");

        assertEquals(2, children.size());
        for (SyntaxNode child : children) {
            MarkupElement element = element(child);
            assertNotNull(element.getStartTag());
            assertTrue(element.getBody().isEmpty());
            assertNull(element.getEndTag());
        }
    }

    @Test
    void voidEndTagIsTreatedAsVoidStartTag() {
        List<SyntaxNode> children = rewrite("</br>");

        MarkupElement br = element(children.get(0));
        assertEquals("</br>", br.getStartTag().getContent());
        assertNull(br.getEndTag());
    }

    @Test
    void textOnlyDocumentIsUnchanged() {
        MarkupSyntaxTree tree = parse("just text");
        assertSame(tree.getRoot(), MarkupElementRewriter.rewrite(tree).getRoot());
    }

    @Test
    void rewriteIsIdempotent() {
        MarkupSyntaxTree once = MarkupElementRewriter.rewrite(parse("<b><i>x</b></i><div>a<p>b<br>"));
        MarkupSyntaxTree twice = MarkupElementRewriter.rewrite(once);

        assertSame(once.getRoot(), twice.getRoot());
    }

    @Test
    void rewriteKeepsSourceDiagnosticsAndOptions() {
        MarkupSyntaxTree tree = parse("<div>text<span");
        MarkupSyntaxTree rewritten = MarkupElementRewriter.rewrite(tree);

        assertSame(tree.getSource(), rewritten.getSource());
        assertEquals(tree.getDiagnostics(), rewritten.getDiagnostics());
        assertEquals(1, rewritten.getDiagnostics().size());
        assertSame(tree.getOptions(), rewritten.getOptions());
        assertEquals(tree.getSource().getText(), rewritten.getRoot().getContent());
    }

    @Test
    void eachCompositeIsScannedWithItsOwnStack() {
        // <div> and </div> sit in sibling blocks, so they must not be paired.
        MarkupBlock opening = new MarkupBlock(SyntaxKind.MARKUP_BLOCK, parse("<div>").getRoot().getChildren());
        MarkupBlock closing = new MarkupBlock(SyntaxKind.MARKUP_BLOCK, parse("</div>").getRoot().getChildren());
        MarkupBlock document = MarkupBlock.document(List.of(opening, closing));

        SyntaxNode rewritten = new ElementBuilder().visit(document);

        MarkupElement unclosed = element(rewritten.getChildren().get(0).getChildren().get(0));
        assertNull(unclosed.getEndTag());
        MarkupElement startless = element(rewritten.getChildren().get(1).getChildren().get(0));
        assertNull(startless.getStartTag());
    }

    @Test
    void untouchedSubtreesAreShared() {
        MarkupSyntaxTree tree = parse("<div>text</div>");
        SyntaxNode text = tree.getRoot().getChildren().get(1);

        MarkupElement div = element(MarkupElementRewriter.rewrite(tree).getRoot().getChildren().get(0));

        assertSame(text, div.getBody().get(0));
    }

    @Test
    void tokensArePreserved() {
        MarkupSyntaxTree tree = parse("<ul>\n<li>one<li>two</ul></section><img src='a'/>");
        MarkupSyntaxTree rewritten = MarkupElementRewriter.rewrite(tree);

        assertEquals(SyntaxTreeHelper.leafTokens(tree.getRoot()), SyntaxTreeHelper.leafTokens(rewritten.getRoot()));
    }

    private static MarkupSyntaxTree parse(String markup) {
        return MarkupSyntaxTree.parse(SourceDocument.of(markup));
    }

    private static List<SyntaxNode> rewrite(String markup) {
        return MarkupElementRewriter.rewrite(parse(markup)).getRoot().getChildren();
    }

    private static MarkupElement element(SyntaxNode node) {
        return assertInstanceOf(MarkupElement.class, node);
    }
}
