package im.arun.contenttree.validation.rules;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodePatch;
import im.arun.contenttree.util.TreeUtils;
import im.arun.contenttree.validation.IssueCollector;
import im.arun.contenttree.validation.Severity;
import im.arun.contenttree.validation.ValidationRule;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Missing names are critical; generic placeholder names only a warning.
 */
public class EmptyNameRule implements ValidationRule {
    private final Set<String> placeholderNames;

    public EmptyNameRule(List<String> placeholderNames) {
        this.placeholderNames = placeholderNames.stream()
            .map(name -> name.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }

    @Override
    public String getId() {
        return "empty-name";
    }

    @Override
    public void check(ContentNode node, ContentNode parent, int depth, IssueCollector issues) {
        String name = node.getName();
        if (TreeUtils.isBlank(name)) {
            issues.report(node, Severity.CRITICAL, "Node has no name.",
                NodePatch.builder().name("New Item").build(), "Set name");
        } else if (placeholderNames.contains(name.trim().toLowerCase(Locale.ROOT))) {
            issues.report(node, Severity.WARNING, "Node has a default placeholder name.");
        }
    }
}
