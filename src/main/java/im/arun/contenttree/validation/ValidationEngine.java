package im.arun.contenttree.validation;

import im.arun.contenttree.analysis.StatsAnalyzer;
import im.arun.contenttree.analysis.TreeStats;
import im.arun.contenttree.config.ContentTreeConfig;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.util.TreeUtils;
import im.arun.contenttree.validation.rules.BlankValueRule;
import im.arun.contenttree.validation.rules.DuplicateSiblingRule;
import im.arun.contenttree.validation.rules.EmptyNameRule;
import im.arun.contenttree.validation.rules.FieldWithChildrenRule;
import im.arun.contenttree.validation.rules.MissingPriceRule;
import im.arun.contenttree.validation.rules.NestingDepthRule;
import im.arun.contenttree.validation.rules.UnansweredQuestionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the fixed rule battery over a tree. Each rule sweeps the whole tree
 * before the next one starts, so issues come out grouped by rule in the order
 * below. The engine only reports; it never touches the tree.
 */
public class ValidationEngine {
    private static final Logger logger = LoggerFactory.getLogger(ValidationEngine.class);

    private static final int CRITICAL_PENALTY = 10;
    private static final int WARNING_PENALTY = 3;
    private static final int OPTIMIZATION_PENALTY = 1;

    private final List<ValidationRule> rules;
    private final StatsAnalyzer statsAnalyzer;

    public ValidationEngine(ContentTreeConfig config) {
        this(List.of(
            new EmptyNameRule(config.getPlaceholderNames()),
            new BlankValueRule(),
            new MissingPriceRule(),
            new UnansweredQuestionRule(),
            new NestingDepthRule(config.getMaxNestingDepth()),
            new FieldWithChildrenRule(),
            new DuplicateSiblingRule()
        ));
    }

    public ValidationEngine(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
        this.statsAnalyzer = new StatsAnalyzer();
    }

    public List<ValidationIssue> runValidation(ContentNode root) {
        Objects.requireNonNull(root, "root");
        IssueCollector collector = new IssueCollector();

        for (ValidationRule rule : rules) {
            collector.beginRule(rule.getId());
            TreeUtils.walkPreOrder(root, (node, parent, depth) -> rule.check(node, parent, depth, collector));
        }

        List<ValidationIssue> issues = collector.getIssues();
        logger.debug("Validation produced {} issues across {} rules", issues.size(), rules.size());
        return issues;
    }

    public HealthReport report(ContentNode root) {
        List<ValidationIssue> issues = runValidation(root);
        TreeStats stats = statsAnalyzer.analyze(root);

        long critical = countBySeverity(issues, Severity.CRITICAL);
        long warnings = countBySeverity(issues, Severity.WARNING);
        long optimizations = countBySeverity(issues, Severity.OPTIMIZATION);

        long penalty = critical * CRITICAL_PENALTY + warnings * WARNING_PENALTY
            + optimizations * OPTIMIZATION_PENALTY;
        int score = (int) Math.max(0, 100 - penalty);

        String summary = issues.isEmpty()
            ? "No issues found."
            : String.format("%d critical, %d warning, %d optimization issue(s); %d%% of fillable nodes complete.",
                critical, warnings, optimizations, stats.getCompletionRate());

        logger.info("Health score {} ({} issues)", score, issues.size());
        return new HealthReport(score, summary, issues, stats);
    }

    private static long countBySeverity(List<ValidationIssue> issues, Severity severity) {
        return issues.stream().filter(issue -> issue.getSeverity() == severity).count();
    }
}
