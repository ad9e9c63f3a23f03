package im.arun.contenttree.export;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.util.TreeUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a tree into pre-order {@link ExportEntry} records shared by all
 * serializers.
 */
public class TreeFlattener {
    private final String untitledLabel;

    public TreeFlattener(String untitledLabel) {
        this.untitledLabel = untitledLabel;
    }

    public List<ExportEntry> flatten(ContentNode root) {
        List<ExportEntry> entries = new ArrayList<>();
        Map<ContentNode, List<String>> breadcrumbs = new IdentityHashMap<>();

        TreeUtils.walkPreOrder(root, (node, parent, depth) -> {
            List<String> breadcrumb = new ArrayList<>();
            if (parent != null) {
                breadcrumb.addAll(breadcrumbs.get(parent));
            }
            breadcrumb.add(displayName(node));
            List<String> frozen = Collections.unmodifiableList(breadcrumb);
            breadcrumbs.put(node, frozen);
            entries.add(new ExportEntry(node, parent, frozen, depth));
        });
        return entries;
    }

    String displayName(ContentNode node) {
        return TreeUtils.isBlank(node.getName()) ? untitledLabel : node.getName();
    }
}
