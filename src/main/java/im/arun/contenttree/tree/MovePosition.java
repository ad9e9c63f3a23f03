package im.arun.contenttree.tree;

/**
 * Where a moved node lands relative to the target node.
 */
public enum MovePosition {
    INSIDE,
    BEFORE,
    AFTER
}
