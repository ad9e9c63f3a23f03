package im.arun.contenttree.tree;

import im.arun.contenttree.model.ContentNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates nodes by id and computes root-to-node ancestry chains.
 * Search is depth-first pre-order; when ids collide the first node in that
 * order wins.
 */
public class PathResolver {

    private static final class Frame {
        final ContentNode node;
        final Frame parent;
        final int indexInParent;

        Frame(ContentNode node, Frame parent, int indexInParent) {
            this.node = node;
            this.parent = parent;
            this.indexInParent = indexInParent;
        }
    }

    public Optional<ContentNode> findById(ContentNode root, String id) {
        return locate(root, id).map(NodeLocation::getTarget);
    }

    /**
     * Ordered chain from {@code root} to the node with {@code id}, both inclusive.
     */
    public Optional<List<ContentNode>> findPath(ContentNode root, String id) {
        return locate(root, id).map(NodeLocation::getPath);
    }

    public boolean containsId(ContentNode root, String id) {
        return locate(root, id).isPresent();
    }

    public Optional<NodeLocation> locate(ContentNode root, String id) {
        Objects.requireNonNull(root, "root");
        if (id == null) {
            return Optional.empty();
        }

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, null, -1));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            if (id.equals(frame.node.getId())) {
                return Optional.of(toLocation(frame));
            }

            List<ContentNode> children = frame.node.getChildren();
            if (children != null) {
                for (int i = children.size() - 1; i >= 0; i--) {
                    ContentNode child = children.get(i);
                    if (child != null) {
                        stack.push(new Frame(child, frame, i));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private NodeLocation toLocation(Frame frame) {
        List<ContentNode> path = new ArrayList<>();
        List<Integer> indexes = new ArrayList<>();
        for (Frame f = frame; f != null; f = f.parent) {
            path.add(f.node);
            if (f.parent != null) {
                indexes.add(f.indexInParent);
            }
        }
        Collections.reverse(path);
        Collections.reverse(indexes);
        return new NodeLocation(path, indexes);
    }
}
