package im.arun.contenttree.validation.rules;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import im.arun.contenttree.model.NodePatch;
import im.arun.contenttree.validation.IssueCollector;
import im.arun.contenttree.validation.Severity;
import im.arun.contenttree.validation.ValidationRule;

public class FieldWithChildrenRule implements ValidationRule {

    @Override
    public String getId() {
        return "field-with-children";
    }

    @Override
    public void check(ContentNode node, ContentNode parent, int depth, IssueCollector issues) {
        if (NodeKind.FIELD.equals(node.getKind()) && node.hasChildren()) {
            issues.report(node, Severity.WARNING,
                String.format("Node \"%s\" is a 'field' but has children. Should it be a 'category'?", node.getName()),
                NodePatch.builder().kind(NodeKind.CATEGORY).build(), "Convert to category");
        }
    }
}
