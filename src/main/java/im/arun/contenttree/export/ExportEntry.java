package im.arun.contenttree.export;

import im.arun.contenttree.model.ContentNode;
import lombok.Value;

import java.util.List;

/**
 * One node of the flattened tree: the node, its parent (null for the root),
 * the breadcrumb of names from the root through the node, and its depth
 * (root is 0).
 */
@Value
public class ExportEntry {
    ContentNode node;
    ContentNode parent;
    List<String> breadcrumb;
    int depth;

    public List<String> parentBreadcrumb() {
        return breadcrumb.subList(0, breadcrumb.size() - 1);
    }
}
