package im.arun.contenttree.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodePatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Applies {@link TreeAction} records through {@link TreeStore}, in order,
 * each against the root produced by the previous one. There is no separate
 * path for assistant-proposed edits: they end up as the same patch, insert and
 * delete calls a human editor makes.
 */
public class ActionApplier {
    private static final Logger logger = LoggerFactory.getLogger(ActionApplier.class);
    static final String ROOT_ALIAS = "root";

    private final TreeStore treeStore;
    private final PathResolver pathResolver;
    private final NodeFactory nodeFactory;
    private final ObjectMapper objectMapper;

    public ActionApplier(TreeStore treeStore, PathResolver pathResolver, NodeFactory nodeFactory) {
        this.treeStore = treeStore;
        this.pathResolver = pathResolver;
        this.nodeFactory = nodeFactory;
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Result of a batch: the final root and one mutation result per action.
     */
    public static class BatchResult {
        public final ContentNode root;
        public final List<ActionOutcome> outcomes;

        public BatchResult(ContentNode root, List<ActionOutcome> outcomes) {
            this.root = root;
            this.outcomes = Collections.unmodifiableList(outcomes);
        }

        public long appliedCount() {
            return outcomes.stream().filter(o -> o.result.isApplied()).count();
        }
    }

    public static class ActionOutcome {
        public final TreeAction action;
        public final MutationResult result;

        public ActionOutcome(TreeAction action, MutationResult result) {
            this.action = action;
            this.result = result;
        }
    }

    public BatchResult applyAll(ContentNode root, List<TreeAction> actions) {
        Objects.requireNonNull(root, "root");
        List<ActionOutcome> outcomes = new ArrayList<>();
        ContentNode current = root;

        for (TreeAction action : actions) {
            MutationResult result = apply(current, action);
            outcomes.add(new ActionOutcome(action, result));
            if (!result.isApplied()) {
                logger.warn("Action {} on {} not applied: {} ({})",
                    action.getType(), action.getTargetId(), result.getOutcome(), result.getMessage());
            }
            current = result.getRoot();
        }

        logger.info("Applied {} of {} actions", outcomes.stream().filter(o -> o.result.isApplied()).count(),
            actions.size());
        return new BatchResult(current, outcomes);
    }

    public MutationResult apply(ContentNode root, TreeAction action) {
        Objects.requireNonNull(root, "root");
        if (action == null || action.getType() == null) {
            return MutationResult.refused(root, "Action has no type");
        }

        switch (action.getType()) {
            case ADD:
                return applyAdd(root, action);
            case UPDATE:
                return applyUpdate(root, action);
            case DELETE:
                return treeStore.delete(root, action.getTargetId());
            default:
                return MutationResult.refused(root, "Unsupported action type " + action.getType());
        }
    }

    private MutationResult applyAdd(ContentNode root, TreeAction action) {
        String parentId = ROOT_ALIAS.equals(action.getTargetId()) ? root.getId() : action.getTargetId();
        ContentNode parent = pathResolver.findById(root, parentId).orElse(null);
        if (parent == null) {
            return MutationResult.notFound(root, parentId);
        }

        ContentNode newNode;
        JsonNode data = action.getData();
        if (data == null || data.isNull()) {
            newNode = nodeFactory.newChild(parent, null);
        } else {
            try {
                newNode = nodeFactory.complete(objectMapper.treeToValue(data, ContentNode.class), parent);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                return MutationResult.refused(root, "Invalid node data: " + e.getMessage());
            }
        }
        return treeStore.insertChild(root, parentId, newNode);
    }

    private MutationResult applyUpdate(ContentNode root, TreeAction action) {
        JsonNode data = action.getData();
        if (data == null || data.isNull()) {
            return MutationResult.refused(root, "Update action has no data");
        }
        NodePatch patch;
        try {
            patch = objectMapper.treeToValue(data, NodePatch.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return MutationResult.refused(root, "Invalid patch data: " + e.getMessage());
        }
        return treeStore.patch(root, action.getTargetId(), patch);
    }
}
