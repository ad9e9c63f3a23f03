package im.arun.contenttree.validation.rules;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import im.arun.contenttree.model.NodePatch;
import im.arun.contenttree.util.TreeUtils;
import im.arun.contenttree.validation.IssueCollector;
import im.arun.contenttree.validation.Severity;
import im.arun.contenttree.validation.ValidationRule;

public class BlankValueRule implements ValidationRule {
    static final String PLACEHOLDER_VALUE = "TBD";

    @Override
    public String getId() {
        return "blank-value";
    }

    @Override
    public void check(ContentNode node, ContentNode parent, int depth, IssueCollector issues) {
        String kind = node.getKind();
        if (!NodeKind.ITEM.equals(kind) && !NodeKind.FIELD.equals(kind)) {
            return;
        }
        if (TreeUtils.isBlank(node.getValue())) {
            issues.report(node, Severity.WARNING, String.format("Field \"%s\" is empty.", node.getName()),
                NodePatch.builder().value(PLACEHOLDER_VALUE).build(), "Set placeholder value");
        }
    }
}
