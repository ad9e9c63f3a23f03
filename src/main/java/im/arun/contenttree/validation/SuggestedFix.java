package im.arun.contenttree.validation;

import im.arun.contenttree.model.NodePatch;
import lombok.Value;

/**
 * A patch that resolves an issue. Applying it is exactly
 * {@code TreeStore.patch(root, targetId, patch)}.
 */
@Value
public class SuggestedFix {
    String targetId;
    NodePatch patch;
    String description;
}
