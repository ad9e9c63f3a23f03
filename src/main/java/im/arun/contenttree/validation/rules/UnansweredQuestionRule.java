package im.arun.contenttree.validation.rules;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import im.arun.contenttree.model.NodePatch;
import im.arun.contenttree.util.TreeUtils;
import im.arun.contenttree.validation.IssueCollector;
import im.arun.contenttree.validation.Severity;
import im.arun.contenttree.validation.ValidationRule;

public class UnansweredQuestionRule implements ValidationRule {

    @Override
    public String getId() {
        return "unanswered-question";
    }

    @Override
    public void check(ContentNode node, ContentNode parent, int depth, IssueCollector issues) {
        if (!NodeKind.QA_PAIR.equals(node.getKind()) || !TreeUtils.isBlank(node.getAnswer())) {
            return;
        }
        String question = TreeUtils.isBlank(node.getQuestion()) ? "Unknown" : node.getQuestion();
        issues.report(node, Severity.CRITICAL, String.format("Question \"%s\" has no answer.", question),
            NodePatch.builder().answer("Answer pending.").build(), "Set answer");
    }
}
