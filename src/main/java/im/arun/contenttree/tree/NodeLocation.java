package im.arun.contenttree.tree;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.util.TreeUtils;

import java.util.Collections;
import java.util.List;

/**
 * Where a node sits in a tree: the root-to-node chain plus, for every step,
 * the index of the next node in its parent's children.
 * {@code childIndexes.size() == path.size() - 1}.
 */
public final class NodeLocation {
    private final List<ContentNode> path;
    private final List<Integer> childIndexes;

    NodeLocation(List<ContentNode> path, List<Integer> childIndexes) {
        this.path = Collections.unmodifiableList(path);
        this.childIndexes = Collections.unmodifiableList(childIndexes);
    }

    public List<ContentNode> getPath() {
        return path;
    }

    public List<Integer> getChildIndexes() {
        return childIndexes;
    }

    public ContentNode getTarget() {
        return path.get(path.size() - 1);
    }

    public boolean isRoot() {
        return path.size() == 1;
    }

    /**
     * Index of the target within its parent's children; -1 for the root.
     */
    public int indexInParent() {
        return childIndexes.isEmpty() ? -1 : childIndexes.get(childIndexes.size() - 1);
    }

    /**
     * Location of the target's parent. Must not be called on the root.
     */
    public NodeLocation parent() {
        if (isRoot()) {
            throw new IllegalStateException("The root has no parent");
        }
        return new NodeLocation(path.subList(0, path.size() - 1),
            childIndexes.subList(0, childIndexes.size() - 1));
    }

    /**
     * Rebuilds the chain bottom-up with {@code replacement} in place of the
     * target. Only the nodes on the path get new identity.
     */
    public ContentNode rebuildWith(ContentNode replacement) {
        ContentNode current = replacement;
        for (int i = path.size() - 2; i >= 0; i--) {
            current = TreeUtils.replaceChild(path.get(i), childIndexes.get(i), current);
        }
        return current;
    }
}
