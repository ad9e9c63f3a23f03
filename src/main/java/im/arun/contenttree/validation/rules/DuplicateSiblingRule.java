package im.arun.contenttree.validation.rules;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodePatch;
import im.arun.contenttree.validation.IssueCollector;
import im.arun.contenttree.validation.Severity;
import im.arun.contenttree.validation.ValidationRule;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Siblings whose trimmed, lower-cased names collide are all reported. Blank
 * names are left to {@link EmptyNameRule}.
 */
public class DuplicateSiblingRule implements ValidationRule {

    @Override
    public String getId() {
        return "duplicate-sibling";
    }

    @Override
    public void check(ContentNode node, ContentNode parent, int depth, IssueCollector issues) {
        List<ContentNode> children = node.getChildren();
        if (children == null || children.size() < 2) {
            return;
        }

        Map<String, Integer> counts = new HashMap<>();
        for (ContentNode child : children) {
            String key = normalize(child.getName());
            if (!key.isEmpty()) {
                counts.merge(key, 1, Integer::sum);
            }
        }

        for (ContentNode child : children) {
            String key = normalize(child.getName());
            if (counts.getOrDefault(key, 0) > 1) {
                issues.report(child, Severity.CRITICAL,
                    String.format("Duplicate name \"%s\" found in the same category.", child.getName()),
                    NodePatch.builder().name(child.getName() + " (Copy)").build(), "Rename");
            }
        }
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
