package org.dxworks.tagframe.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

public final class SyntaxTreeHelper {

    private SyntaxTreeHelper() {
        // utility class
    }

    /**
     * Returns a copy of {@code parent} in which the children {@code from..to} (inclusive)
     * are replaced by the single node {@code replacement}.
     */
    public static MarkupNode replaceRange(MarkupNode parent, int from, int to, SyntaxNode replacement) {
        Objects.requireNonNull(replacement, "replacement");
        List<SyntaxNode> children = parent.getChildren();
        Objects.checkFromToIndex(from, to + 1, children.size());
        List<SyntaxNode> result = new ArrayList<>(children.size() - (to - from));
        result.addAll(children.subList(0, from));
        result.add(replacement);
        result.addAll(children.subList(to + 1, children.size()));
        return parent.withChildren(result);
    }

    /**
     * Returns a copy of {@code parent} in which the child at {@code index} is replaced by
     * {@code replacements}, in order. An empty list removes the child.
     */
    public static MarkupNode replaceWithChildren(MarkupNode parent, int index, List<? extends SyntaxNode> replacements) {
        List<SyntaxNode> children = parent.getChildren();
        Objects.checkIndex(index, children.size());
        List<SyntaxNode> result = new ArrayList<>(children.size() - 1 + replacements.size());
        result.addAll(children.subList(0, index));
        result.addAll(replacements);
        result.addAll(children.subList(index + 1, children.size()));
        return parent.withChildren(result);
    }

    public static List<SyntaxToken> leafTokens(SyntaxNode root) {
        return root == null ? List.of() : root.getTokens();
    }

    public static <T extends SyntaxNode> List<T> findAllDescendants(SyntaxNode root, Class<T> type) {
        List<T> result = new ArrayList<>();
        if (root == null) return result;

        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
            List<SyntaxNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    public static boolean containsElements(SyntaxNode root) {
        return !findAllDescendants(root, MarkupElement.class).isEmpty();
    }

    /**
     * Renders the composite structure of a tree, one node per line, indented by depth.
     * Tag blocks and text literals are shown with their quoted content, elements with
     * their tag name. Tokens are not listed.
     */
    public static String dump(SyntaxNode root) {
        StringBuilder sb = new StringBuilder();
        if (root == null) return sb.toString();

        Deque<SyntaxNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);
        while (!nodes.isEmpty()) {
            SyntaxNode node = nodes.pop();
            int depth = depths.pop();
            if (node.isToken()) continue;

            sb.append("  ".repeat(depth)).append(node.getKind());
            if (node instanceof MarkupElement element) {
                sb.append(" [").append(element.getTagName()).append(']');
                if (element.getStartTag() == null) sb.append(" no-start");
                if (element.getEndTag() == null) sb.append(" no-end");
            } else if (node instanceof MarkupTagBlock || node instanceof MarkupTextLiteral) {
                sb.append(" \"").append(escape(node.getContent())).append('"');
            }
            sb.append('\n');

            if (node instanceof MarkupTagBlock || node instanceof MarkupTextLiteral) continue;
            List<SyntaxNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                nodes.push(children.get(i));
                depths.push(depth + 1);
            }
        }
        return sb.toString();
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
