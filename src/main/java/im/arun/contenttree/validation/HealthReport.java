package im.arun.contenttree.validation;

import im.arun.contenttree.analysis.TreeStats;
import lombok.Value;

import java.util.List;

/**
 * Issues plus an overall 0-100 score and a one-line summary.
 */
@Value
public class HealthReport {
    int score;
    String summary;
    List<ValidationIssue> issues;
    TreeStats stats;

    public long count(Severity severity) {
        return issues.stream().filter(issue -> issue.getSeverity() == severity).count();
    }
}
