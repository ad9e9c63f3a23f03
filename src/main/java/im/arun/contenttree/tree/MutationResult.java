package im.arun.contenttree.tree;

import im.arun.contenttree.model.ContentNode;
import lombok.Value;

/**
 * Outcome of a {@link TreeStore} call. Unless the outcome is
 * {@link Outcome#APPLIED}, {@link #getRoot()} is the exact input reference.
 */
@Value
public class MutationResult {

    public enum Outcome {
        APPLIED,
        NOT_FOUND,
        REFUSED,
        DUPLICATE_ID
    }

    ContentNode root;
    Outcome outcome;
    String message;

    public static MutationResult applied(ContentNode root) {
        return new MutationResult(root, Outcome.APPLIED, null);
    }

    public static MutationResult notFound(ContentNode root, String id) {
        return new MutationResult(root, Outcome.NOT_FOUND, "No node with id '" + id + "'");
    }

    public static MutationResult refused(ContentNode root, String reason) {
        return new MutationResult(root, Outcome.REFUSED, reason);
    }

    public static MutationResult duplicateId(ContentNode root, String id) {
        return new MutationResult(root, Outcome.DUPLICATE_ID, "Id '" + id + "' already exists in the tree");
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }
}
