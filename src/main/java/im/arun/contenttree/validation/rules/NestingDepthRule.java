package im.arun.contenttree.validation.rules;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.validation.IssueCollector;
import im.arun.contenttree.validation.Severity;
import im.arun.contenttree.validation.ValidationRule;

/**
 * Flags nodes nested deeper than the threshold (root is depth 0).
 */
public class NestingDepthRule implements ValidationRule {
    private final int maxDepth;

    public NestingDepthRule(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    @Override
    public String getId() {
        return "nesting-depth";
    }

    @Override
    public void check(ContentNode node, ContentNode parent, int depth, IssueCollector issues) {
        if (depth > maxDepth) {
            issues.report(node, Severity.OPTIMIZATION,
                String.format("Nesting level (%d) is too deep; keep content within %d levels.", depth, maxDepth));
        }
    }
}
