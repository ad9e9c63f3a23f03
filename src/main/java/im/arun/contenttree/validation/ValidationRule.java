package im.arun.contenttree.validation;

import im.arun.contenttree.model.ContentNode;

/**
 * One check of the validation battery. Called once per node in pre-order;
 * implementations must not keep state between calls.
 */
public interface ValidationRule {

    String getId();

    /**
     * @param depth root is 0
     */
    void check(ContentNode node, ContentNode parent, int depth, IssueCollector issues);
}
