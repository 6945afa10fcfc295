package org.dxworks.tagframe.rewriter;

import org.dxworks.tagframe.syntax.MarkupTagBlock;

/**
 * An open start tag waiting for its end tag, remembered with its position in the
 * rebuilt child list of the node being scanned.
 */
final class TagBlockTracker {

    private final MarkupTagBlock tagBlock;
    private final String tagName;
    private final int index;

    TagBlockTracker(MarkupTagBlock tagBlock, int index) {
        this.tagBlock = tagBlock;
        this.tagName = TagClassifier.getTagName(tagBlock);
        this.index = index;
    }

    MarkupTagBlock getTagBlock() {
        return tagBlock;
    }

    int getIndex() {
        return index;
    }

    boolean matches(String endTagName) {
        return tagName.equalsIgnoreCase(endTagName);
    }
}
