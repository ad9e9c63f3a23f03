package im.arun.contenttree.tree;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import im.arun.contenttree.util.IdGenerator;

import java.time.Clock;

/**
 * Creates fresh nodes for insertion, picking a default kind from the parent
 * when the caller does not supply one.
 */
public class NodeFactory {
    static final String NEW_MENU_ITEM_NAME = "New Item";
    static final String NEW_NODE_NAME = "New Node";

    private final IdGenerator idGenerator;
    private final Clock clock;

    public NodeFactory() {
        this(IdGenerator.timestamped(), Clock.systemUTC());
    }

    public NodeFactory(IdGenerator idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public ContentNode newChild(ContentNode parent, String kind) {
        String finalKind = kind != null ? kind : NodeKind.defaultChildKind(parent == null ? null : parent.getKind());
        return ContentNode.builder()
            .id(idGenerator.nextId(idPrefix(finalKind)))
            .kind(finalKind)
            .name(NodeKind.MENU_ITEM.equals(finalKind) ? NEW_MENU_ITEM_NAME : NEW_NODE_NAME)
            .value("")
            .lastModified(clock.millis())
            .build();
    }

    /**
     * Fills in the id and kind of a caller-built node when they are missing.
     */
    public ContentNode complete(ContentNode node, ContentNode parent) {
        ContentNode.ContentNodeBuilder builder = node.toBuilder();
        String kind = node.getKind();
        if (kind == null || kind.isBlank()) {
            kind = NodeKind.defaultChildKind(parent == null ? null : parent.getKind());
            builder.kind(kind);
        }
        if (node.getId() == null || node.getId().isBlank()) {
            builder.id(idGenerator.nextId(idPrefix(kind)));
        }
        if (node.getLastModified() == null) {
            builder.lastModified(clock.millis());
        }
        return builder.build();
    }

    private static String idPrefix(String kind) {
        return kind.length() > 4 ? kind.substring(0, 4) : kind;
    }
}
