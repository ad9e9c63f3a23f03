package im.arun.contenttree.validation.rules;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import im.arun.contenttree.model.NodePatch;
import im.arun.contenttree.util.TreeUtils;
import im.arun.contenttree.validation.IssueCollector;
import im.arun.contenttree.validation.Severity;
import im.arun.contenttree.validation.ValidationRule;

public class MissingPriceRule implements ValidationRule {

    @Override
    public String getId() {
        return "missing-price";
    }

    @Override
    public void check(ContentNode node, ContentNode parent, int depth, IssueCollector issues) {
        if (NodeKind.MENU_ITEM.equals(node.getKind()) && TreeUtils.isBlank(node.getPrice())) {
            issues.report(node, Severity.WARNING, String.format("Menu item \"%s\" has no price.", node.getName()),
                NodePatch.builder().price("0").build(), "Set price");
        }
    }
}
