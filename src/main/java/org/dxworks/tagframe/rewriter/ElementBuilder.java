package org.dxworks.tagframe.rewriter;

import org.dxworks.tagframe.syntax.MarkupElement;
import org.dxworks.tagframe.syntax.MarkupNode;
import org.dxworks.tagframe.syntax.MarkupTagBlock;
import org.dxworks.tagframe.syntax.SyntaxNode;
import org.dxworks.tagframe.syntax.SyntaxRewriter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Folds the loose tag blocks among the children of every composite node into
 * {@link MarkupElement}s, recovering from mismatched, unclosed and orphaned tags the way
 * HTML5 parsers do.
 * <p>
 * Each composite is scanned on its own with a fresh stack of open start tags:
 * <ul>
 *   <li>malformed (blank name), void and self-closing tags become elements on their own;</li>
 *   <li>an end tag matching the innermost open tag closes it, and everything in between
 *       becomes the element body;</li>
 *   <li>an end tag matching a tag further down the stack first closes the tags above it
 *       as bodiless elements, innermost first;</li>
 *   <li>an end tag matching nothing becomes an element without a start tag;</li>
 *   <li>start tags still open at the end take all following siblings as their body.</li>
 * </ul>
 * Elements, tokens and the direct children of elements are left alone, which makes a
 * second pass a no-op.
 */
public class ElementBuilder extends SyntaxRewriter {

    @Override
    protected SyntaxNode rewriteNode(SyntaxNode node, SyntaxNode parent) {
        if (node.isToken() || node instanceof MarkupElement || parent instanceof MarkupElement) {
            // Either a token or something that was already rewritten.
            return node;
        }
        return new ChildScan((MarkupNode) node).run();
    }

    /**
     * One left-to-right pass over the direct children of a single node. Children are
     * copied to {@code output}; elements are only ever completed at its tail, so a scan
     * is linear in the number of children.
     */
    private static final class ChildScan {

        private final Deque<TagBlockTracker> startTagTrackers = new ArrayDeque<>();
        private final MarkupNode node;
        private final List<SyntaxNode> output;
        private boolean changed;

        ChildScan(MarkupNode node) {
            this.node = node;
            this.output = new ArrayList<>(node.getChildren().size());
        }

        MarkupNode run() {
            for (SyntaxNode child : node.getChildren()) {
                if (!(child instanceof MarkupTagBlock tagBlock)) {
                    output.add(child);
                    continue;
                }

                String tagName = TagClassifier.getTagName(tagBlock);
                if (tagName.isBlank()
                        || TagClassifier.isVoidElement(tagBlock)
                        || TagClassifier.isSelfClosing(tagBlock)) {
                    // Incomplete, void and self-closing tags are never tracked.
                    append(MarkupElement.create(tagBlock, List.of(), null));
                } else if (TagClassifier.isEndTag(tagBlock)) {
                    TagBlockTracker current = startTagTrackers.peek();
                    if (current != null && current.matches(tagName)) {
                        startTagTrackers.pop();
                        completeElement(current, tagBlock);
                    } else if (!tryRecoverStartTag(tagName, tagBlock)) {
                        // No start tag anywhere in scope.
                        append(MarkupElement.create(null, List.of(), tagBlock));
                    }
                } else {
                    startTagTrackers.push(new TagBlockTracker(tagBlock, output.size()));
                    output.add(tagBlock);
                }
            }

            // Unmatched start tags own everything after them. Innermost goes first so that
            // an outer body already contains the inner element.
            while (!startTagTrackers.isEmpty()) {
                completeElement(startTagTrackers.pop(), null);
            }

            return changed ? node.withChildren(output) : node;
        }

        /**
         * Looks down the stack for a start tag matching {@code tagName}. When found, the
         * start tags opened after it are closed as bodiless elements and the match is
         * completed with {@code endTag}.
         *
         * @return whether a matching start tag was found
         */
        private boolean tryRecoverStartTag(String tagName, MarkupTagBlock endTag) {
            int malformedTagCount = 0;
            boolean found = false;
            for (Iterator<TagBlockTracker> it = startTagTrackers.iterator(); it.hasNext(); ) {
                if (it.next().matches(tagName)) {
                    found = true;
                    break;
                }
                malformedTagCount++;
            }
            if (!found) {
                return false;
            }

            rewriteMalformedTags(malformedTagCount);
            completeElement(startTagTrackers.pop(), endTag);
            return true;
        }

        private void rewriteMalformedTags(int malformedTagCount) {
            for (int i = 0; i < malformedTagCount; i++) {
                TagBlockTracker tracker = startTagTrackers.pop();
                output.set(tracker.getIndex(), MarkupElement.create(tracker.getTagBlock(), List.of(), null));
            }
        }

        /**
         * Replaces the start tag and everything after it in {@code output} with one element.
         */
        private void completeElement(TagBlockTracker startTracker, MarkupTagBlock endTag) {
            int startTagIndex = startTracker.getIndex();
            List<SyntaxNode> tail = output.subList(startTagIndex, output.size());
            MarkupElement element = MarkupElement.create(startTracker.getTagBlock(), tail.subList(1, tail.size()), endTag);
            tail.clear();
            append(element);
        }

        private void append(MarkupElement element) {
            output.add(element);
            changed = true;
        }
    }
}
