package im.arun.contenttree.validation;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodePatch;
import im.arun.contenttree.util.TreeUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates issues for one validation run and assigns their ids.
 */
public class IssueCollector {
    static final String UNNAMED = "Unnamed Node";

    private final List<ValidationIssue> issues = new ArrayList<>();
    private String currentRuleId = "rule";

    void beginRule(String ruleId) {
        this.currentRuleId = ruleId;
    }

    public void report(ContentNode node, Severity severity, String message) {
        add(node, severity, message, null);
    }

    public void report(ContentNode node, Severity severity, String message, NodePatch fixPatch, String fixDescription) {
        add(node, severity, message, new SuggestedFix(node.getId(), fixPatch, fixDescription));
    }

    private void add(ContentNode node, Severity severity, String message, SuggestedFix fix) {
        String nodeName = TreeUtils.isBlank(node.getName()) ? UNNAMED : node.getName();
        issues.add(ValidationIssue.builder()
            .id(currentRuleId + "-" + node.getId() + "-" + (issues.size() + 1))
            .ruleId(currentRuleId)
            .nodeId(node.getId())
            .nodeName(nodeName)
            .severity(severity)
            .message(message)
            .suggestedFix(fix)
            .build());
    }

    public List<ValidationIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }
}
