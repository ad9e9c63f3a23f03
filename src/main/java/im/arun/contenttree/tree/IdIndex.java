package im.arun.contenttree.tree;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.util.TreeUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Id to node index built in one traversal. Ids seen more than once are
 * recorded as duplicates; the index keeps the first node in pre-order.
 */
public final class IdIndex {
    private final Map<String, ContentNode> nodesById;
    private final Set<String> duplicateIds;

    private IdIndex(Map<String, ContentNode> nodesById, Set<String> duplicateIds) {
        this.nodesById = nodesById;
        this.duplicateIds = duplicateIds;
    }

    public static IdIndex build(ContentNode root) {
        Map<String, ContentNode> nodes = new HashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        TreeUtils.walkPreOrder(root, (node, parent, depth) -> {
            String id = node.getId();
            if (id == null) {
                return;
            }
            if (nodes.putIfAbsent(id, node) != null) {
                duplicates.add(id);
            }
        });
        return new IdIndex(nodes, duplicates);
    }

    public Optional<ContentNode> get(String id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public boolean contains(String id) {
        return nodesById.containsKey(id);
    }

    public int size() {
        return nodesById.size();
    }

    public Set<String> getIds() {
        return Collections.unmodifiableSet(nodesById.keySet());
    }

    public Set<String> getDuplicateIds() {
        return Collections.unmodifiableSet(duplicateIds);
    }

    public boolean hasDuplicates() {
        return !duplicateIds.isEmpty();
    }
}
