package im.arun.contenttree.util;

import im.arun.contenttree.model.ContentNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Utility methods shared by the tree traversals and the copy-on-write helpers.
 * Traversals use an explicit stack so deep trees cannot exhaust the call stack.
 */
public final class TreeUtils {

    private TreeUtils() {}

    /**
     * Callback for {@link #walkPreOrder}. {@code parent} is null for the root,
     * and the root is at depth 0.
     */
    @FunctionalInterface
    public interface NodeVisitor {
        void visit(ContentNode node, ContentNode parent, int depth);
    }

    private static final class Frame {
        final ContentNode node;
        final ContentNode parent;
        final int depth;

        Frame(ContentNode node, ContentNode parent, int depth) {
            this.node = node;
            this.parent = parent;
            this.depth = depth;
        }
    }

    /**
     * Depth-first, pre-order walk visiting children in list order.
     */
    public static void walkPreOrder(ContentNode root, NodeVisitor visitor) {
        if (root == null) {
            return;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, null, 0));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            visitor.visit(frame.node, frame.parent, frame.depth);

            List<ContentNode> children = frame.node.getChildren();
            if (children != null) {
                // Reverse push keeps siblings in document order
                for (int i = children.size() - 1; i >= 0; i--) {
                    ContentNode child = children.get(i);
                    if (child != null) {
                        stack.push(new Frame(child, frame.node, frame.depth + 1));
                    }
                }
            }
        }
    }

    public static List<ContentNode> childrenOf(ContentNode node) {
        List<ContentNode> children = node.getChildren();
        return children == null ? Collections.emptyList() : children;
    }

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * Copy of {@code parent} whose child at {@code index} is {@code child};
     * every other child keeps its reference.
     */
    public static ContentNode replaceChild(ContentNode parent, int index, ContentNode child) {
        List<ContentNode> children = new ArrayList<>(childrenOf(parent));
        children.set(index, child);
        return parent.withChildren(children);
    }

    public static ContentNode insertChildAt(ContentNode parent, int index, ContentNode child) {
        List<ContentNode> children = new ArrayList<>(childrenOf(parent));
        children.add(index, child);
        return parent.withChildren(children);
    }

    public static ContentNode appendChild(ContentNode parent, ContentNode child) {
        return insertChildAt(parent, childrenOf(parent).size(), child);
    }

    public static ContentNode removeChildAt(ContentNode parent, int index) {
        List<ContentNode> children = new ArrayList<>(childrenOf(parent));
        children.remove(index);
        return parent.withChildren(children);
    }

    /**
     * Number of nodes in the subtree rooted at {@code root}.
     */
    public static int countNodes(ContentNode root) {
        int[] count = {0};
        walkPreOrder(root, (node, parent, depth) -> count[0]++);
        return count[0];
    }
}
