package im.arun.contenttree.tree;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodePatch;
import im.arun.contenttree.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * The single mutation surface of the content tree.
 *
 * <p>Every operation is a pure function of its inputs and returns a new root
 * built with structural sharing: only the nodes on the path from the root to
 * the change (and, for insert/delete/move, the affected parents) are copied.
 * Every other subtree is the same object as in the input tree. When nothing
 * changes the input root reference itself is returned, together with an
 * outcome saying why.
 */
public class TreeStore {
    private static final Logger logger = LoggerFactory.getLogger(TreeStore.class);

    private final PathResolver pathResolver;
    private final boolean enforceUniqueIds;

    public TreeStore() {
        this(new PathResolver(), true);
    }

    public TreeStore(PathResolver pathResolver, boolean enforceUniqueIds) {
        this.pathResolver = pathResolver;
        this.enforceUniqueIds = enforceUniqueIds;
    }

    /**
     * Shallow-merges {@code patch} into the node with {@code id}.
     */
    public MutationResult patch(ContentNode root, String id, NodePatch patch) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(patch, "patch");

        Optional<NodeLocation> location = pathResolver.locate(root, id);
        if (location.isEmpty()) {
            logger.debug("Patch target {} not found", id);
            return MutationResult.notFound(root, id);
        }

        NodeLocation target = location.get();
        ContentNode updated = patch.applyTo(target.getTarget());
        logger.debug("Patched node {} at depth {}", id, target.getPath().size() - 1);
        return MutationResult.applied(target.rebuildWith(updated));
    }

    /**
     * Appends {@code newNode} to the children of the node with {@code parentId},
     * creating the children list if the parent is a leaf.
     */
    public MutationResult insertChild(ContentNode root, String parentId, ContentNode newNode) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(newNode, "newNode");

        Optional<NodeLocation> location = pathResolver.locate(root, parentId);
        if (location.isEmpty()) {
            logger.debug("Insert parent {} not found", parentId);
            return MutationResult.notFound(root, parentId);
        }

        if (enforceUniqueIds) {
            Optional<String> clash = findIdClash(root, newNode);
            if (clash.isPresent()) {
                logger.warn("Refusing to insert subtree: id {} is already in use", clash.get());
                return MutationResult.duplicateId(root, clash.get());
            }
        }

        NodeLocation parent = location.get();
        ContentNode updatedParent = TreeUtils.appendChild(parent.getTarget(), newNode);
        logger.debug("Inserted node {} under {}", newNode.getId(), parentId);
        return MutationResult.applied(parent.rebuildWith(updatedParent));
    }

    /**
     * Removes the node with {@code id} and its subtree. The root itself can
     * never be deleted through this call.
     */
    public MutationResult delete(ContentNode root, String id) {
        Objects.requireNonNull(root, "root");

        if (Objects.equals(root.getId(), id)) {
            logger.warn("Refusing to delete the root node {}", id);
            return MutationResult.refused(root, "The root node cannot be deleted");
        }

        Optional<NodeLocation> location = pathResolver.locate(root, id);
        if (location.isEmpty()) {
            logger.debug("Delete target {} not found", id);
            return MutationResult.notFound(root, id);
        }

        NodeLocation target = location.get();
        NodeLocation parent = target.parent();
        ContentNode updatedParent = TreeUtils.removeChildAt(parent.getTarget(), target.indexInParent());
        logger.debug("Deleted node {}", id);
        return MutationResult.applied(parent.rebuildWith(updatedParent));
    }

    /**
     * Moves the node with {@code sourceId} next to or into the node with
     * {@code targetId}.
     */
    public MutationResult move(ContentNode root, String sourceId, String targetId, MovePosition position) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(position, "position");

        if (Objects.equals(root.getId(), sourceId)) {
            return MutationResult.refused(root, "The root node cannot be moved");
        }
        if (Objects.equals(sourceId, targetId)) {
            return MutationResult.refused(root, "A node cannot be moved relative to itself");
        }

        Optional<NodeLocation> sourceLocation = pathResolver.locate(root, sourceId);
        if (sourceLocation.isEmpty()) {
            return MutationResult.notFound(root, sourceId);
        }
        Optional<NodeLocation> targetLocation = pathResolver.locate(root, targetId);
        if (targetLocation.isEmpty()) {
            return MutationResult.notFound(root, targetId);
        }

        ContentNode source = sourceLocation.get().getTarget();
        if (pathResolver.containsId(source, targetId)) {
            logger.warn("Refusing to move {} into its own subtree", sourceId);
            return MutationResult.refused(root, "A node cannot be moved into its own subtree");
        }
        if (position != MovePosition.INSIDE && targetLocation.get().isRoot()) {
            return MutationResult.refused(root, "Nodes cannot be placed beside the root");
        }

        NodeLocation sourceParent = sourceLocation.get().parent();
        ContentNode detached = sourceParent.rebuildWith(
            TreeUtils.removeChildAt(sourceParent.getTarget(), sourceLocation.get().indexInParent()));

        // Re-resolve: detaching may have shifted the target's index
        NodeLocation target = pathResolver.locate(detached, targetId)
            .orElseThrow(() -> new IllegalStateException("Move target vanished: " + targetId));

        ContentNode moved;
        if (position == MovePosition.INSIDE) {
            moved = target.rebuildWith(TreeUtils.appendChild(target.getTarget(), source));
        } else {
            NodeLocation targetParent = target.parent();
            int index = target.indexInParent() + (position == MovePosition.AFTER ? 1 : 0);
            moved = targetParent.rebuildWith(
                TreeUtils.insertChildAt(targetParent.getTarget(), index, source));
        }

        logger.debug("Moved node {} {} {}", sourceId, position, targetId);
        return MutationResult.applied(moved);
    }

    private Optional<String> findIdClash(ContentNode root, ContentNode newNode) {
        IdIndex existing = IdIndex.build(root);
        IdIndex incoming = IdIndex.build(newNode);
        if (incoming.hasDuplicates()) {
            return Optional.of(incoming.getDuplicateIds().iterator().next());
        }
        for (String id : incoming.getIds()) {
            if (existing.contains(id)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}
