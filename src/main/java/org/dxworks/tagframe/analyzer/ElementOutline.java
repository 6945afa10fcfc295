package org.dxworks.tagframe.analyzer;

import org.dxworks.tagframe.model.ElementInfo;
import org.dxworks.tagframe.syntax.MarkupElement;
import org.dxworks.tagframe.syntax.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Nested element outline of a rewritten tree. Anything that is not an element is looked
 * through, so an element's outline children are the elements found in its body.
 * <p>
 * Outline nesting stops at {@link #MAX_NESTING}: elements below that level are listed
 * next to each other at the last level, in document order. Counts and {@link #getMaxDepth()}
 * still reflect the real nesting.
 */
public final class ElementOutline {

    public static final int MAX_NESTING = 256;

    private final List<ElementInfo> elements = new ArrayList<>();
    private final Map<String, Integer> shapes = new TreeMap<>();
    private int count;
    private int maxDepth;

    private ElementOutline() {
    }

    public static ElementOutline build(SyntaxNode root) {
        ElementOutline outline = new ElementOutline();
        if (root != null) {
            outline.collect(root);
        }
        return outline;
    }

    private void collect(SyntaxNode root) {
        Deque<Entry> stack = new ArrayDeque<>();
        stack.push(new Entry(root, elements, 1, 1));
        while (!stack.isEmpty()) {
            Entry entry = stack.pop();
            List<SyntaxNode> children;
            List<ElementInfo> target = entry.target;
            int level = entry.level;
            int depth = entry.depth;

            if (entry.node instanceof MarkupElement element) {
                ElementShape shape = ElementShape.of(element);
                ElementInfo info = new ElementInfo(element.getTagName(), shape.getName());
                target.add(info);
                count++;
                shapes.merge(shape.getName(), 1, Integer::sum);
                maxDepth = Math.max(maxDepth, depth);

                children = element.getBody();
                depth++;
                if (level < MAX_NESTING) {
                    target = info.children;
                    level++;
                }
            } else {
                children = entry.node.getChildren();
            }

            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Entry(children.get(i), target, level, depth));
            }
        }
    }

    public List<ElementInfo> getElements() {
        return elements;
    }

    public Map<String, Integer> getShapes() {
        return shapes;
    }

    public int getCount() {
        return count;
    }

    /**
     * Deepest element nesting, 1 for top-level elements and 0 when there are none.
     */
    public int getMaxDepth() {
        return maxDepth;
    }

    private static final class Entry {
        private final SyntaxNode node;
        private final List<ElementInfo> target;
        private final int level;
        private final int depth;

        Entry(SyntaxNode node, List<ElementInfo> target, int level, int depth) {
            this.node = node;
            this.target = target;
            this.level = level;
            this.depth = depth;
        }
    }
}
