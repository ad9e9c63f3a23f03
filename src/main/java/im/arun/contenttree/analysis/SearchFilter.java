package im.arun.contenttree.analysis;

import im.arun.contenttree.model.ContentNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Prunes a tree to the nodes matching a text query while keeping the full
 * ancestor chain of every match.
 */
public class SearchFilter {

    private static final class Frame {
        final ContentNode node;
        final List<ContentNode> survivors = new ArrayList<>();
        int nextChild;

        Frame(ContentNode node) {
            this.node = node;
        }
    }

    /**
     * Returns the pruned tree, or empty when nothing under {@code node}
     * matches. An empty query returns {@code node} itself.
     */
    public Optional<ContentNode> filter(ContentNode node, String query) {
        if (node == null) {
            return Optional.empty();
        }
        if (query == null || query.isEmpty()) {
            return Optional.of(node);
        }

        String needle = query.toLowerCase(Locale.ROOT);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(node));
        ContentNode result = null;

        // Post-order: a node is decided once all its children are
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<ContentNode> children = frame.node.getChildren();
            if (children != null && frame.nextChild < children.size()) {
                ContentNode child = children.get(frame.nextChild++);
                if (child != null) {
                    stack.push(new Frame(child));
                }
                continue;
            }

            stack.pop();
            ContentNode survivor = null;
            if (isSelfMatch(frame.node, needle) || !frame.survivors.isEmpty()) {
                survivor = frame.node.withChildren(frame.survivors);
            }

            if (stack.isEmpty()) {
                result = survivor;
            } else if (survivor != null) {
                stack.peek().survivors.add(survivor);
            }
        }
        return Optional.ofNullable(result);
    }

    static boolean isSelfMatch(ContentNode node, String lowerQuery) {
        if (contains(node.getName(), lowerQuery) || contains(node.getValue(), lowerQuery)) {
            return true;
        }
        List<String> tags = node.getTags();
        if (tags != null) {
            for (String tag : tags) {
                if (contains(tag, lowerQuery)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean contains(String text, String lowerQuery) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerQuery);
    }
}
