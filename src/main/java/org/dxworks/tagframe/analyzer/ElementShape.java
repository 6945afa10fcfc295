package org.dxworks.tagframe.analyzer;

import org.dxworks.tagframe.rewriter.TagClassifier;
import org.dxworks.tagframe.syntax.MarkupElement;
import org.dxworks.tagframe.syntax.MarkupTagBlock;

/**
 * How an element came out of the rewriter, named the way it appears in the JSON output.
 */
public enum ElementShape {
    PAIRED("paired"),
    VOID("void"),
    SELF_CLOSING("self_closing"),
    MALFORMED("malformed"),
    UNCLOSED("unclosed"),
    STARTLESS("startless");

    private final String name;

    ElementShape(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static ElementShape of(MarkupElement element) {
        MarkupTagBlock startTag = element.getStartTag();
        if (startTag == null) {
            return STARTLESS;
        }
        if (element.getEndTag() != null) {
            return PAIRED;
        }
        // Same precedence as the builder: a blank name wins over void, void over self-closing.
        if (TagClassifier.isMalformed(startTag)) {
            return MALFORMED;
        }
        if (TagClassifier.isVoidElement(startTag)) {
            return VOID;
        }
        if (TagClassifier.isSelfClosing(startTag)) {
            return SELF_CLOSING;
        }
        return UNCLOSED;
    }
}
