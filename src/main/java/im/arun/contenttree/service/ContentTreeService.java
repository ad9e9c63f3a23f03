package im.arun.contenttree.service;

import im.arun.contenttree.analysis.SearchFilter;
import im.arun.contenttree.analysis.StatsAnalyzer;
import im.arun.contenttree.analysis.TreeStats;
import im.arun.contenttree.config.ConfigLoader;
import im.arun.contenttree.config.ContentTreeConfig;
import im.arun.contenttree.export.CancellationToken;
import im.arun.contenttree.export.ExportFormat;
import im.arun.contenttree.export.ExportPipeline;
import im.arun.contenttree.export.ExportProgressListener;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodePatch;
import im.arun.contenttree.tree.ActionApplier;
import im.arun.contenttree.tree.ActionProposal;
import im.arun.contenttree.tree.ActionProposalParser;
import im.arun.contenttree.tree.IdIndex;
import im.arun.contenttree.tree.MovePosition;
import im.arun.contenttree.tree.MutationResult;
import im.arun.contenttree.tree.NodeFactory;
import im.arun.contenttree.tree.PathResolver;
import im.arun.contenttree.tree.TreeAction;
import im.arun.contenttree.tree.TreeStore;
import im.arun.contenttree.validation.HealthReport;
import im.arun.contenttree.validation.SuggestedFix;
import im.arun.contenttree.validation.ValidationEngine;
import im.arun.contenttree.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Facade over the content tree core: the mutation surface, the read-only
 * query surface and the export surface. Holds no document state; every call
 * takes the current root and mutations return the next one.
 */
public class ContentTreeService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ContentTreeService.class);

    private final ContentTreeConfig config;
    private final PathResolver pathResolver;
    private final TreeStore treeStore;
    private final NodeFactory nodeFactory;
    private final ActionApplier actionApplier;
    private final ActionProposalParser proposalParser;
    private final StatsAnalyzer statsAnalyzer;
    private final SearchFilter searchFilter;
    private final ValidationEngine validationEngine;
    private final ExportPipeline exportPipeline;

    public ContentTreeService() {
        this(new ConfigLoader().load());
    }

    public ContentTreeService(ContentTreeConfig config) {
        this(config, new NodeFactory());
    }

    public ContentTreeService(ContentTreeConfig config, NodeFactory nodeFactory) {
        this.config = config;
        this.pathResolver = new PathResolver();
        this.treeStore = new TreeStore(pathResolver, config.isEnforceUniqueIds());
        this.nodeFactory = nodeFactory;
        this.actionApplier = new ActionApplier(treeStore, pathResolver, nodeFactory);
        this.proposalParser = new ActionProposalParser();
        this.statsAnalyzer = new StatsAnalyzer();
        this.searchFilter = new SearchFilter();
        this.validationEngine = new ValidationEngine(config);
        this.exportPipeline = new ExportPipeline(config);
    }

    public ContentTreeConfig getConfig() {
        return config;
    }

    // Mutation surface

    public MutationResult insertChild(ContentNode root, String parentId, ContentNode node) {
        return treeStore.insertChild(root, parentId, node);
    }

    /**
     * Inserts a fresh node of {@code kind} (or the parent's default child kind
     * when null) under {@code parentId}.
     */
    public MutationResult addChild(ContentNode root, String parentId, String kind) {
        Optional<ContentNode> parent = pathResolver.findById(root, parentId);
        if (parent.isEmpty()) {
            return MutationResult.notFound(root, parentId);
        }
        return treeStore.insertChild(root, parentId, nodeFactory.newChild(parent.get(), kind));
    }

    public MutationResult patch(ContentNode root, String id, NodePatch patch) {
        return treeStore.patch(root, id, patch);
    }

    public MutationResult delete(ContentNode root, String id) {
        return treeStore.delete(root, id);
    }

    public MutationResult move(ContentNode root, String sourceId, String targetId, MovePosition position) {
        return treeStore.move(root, sourceId, targetId, position);
    }

    public ActionApplier.BatchResult applyActions(ContentNode root, List<TreeAction> actions) {
        return actionApplier.applyAll(root, actions);
    }

    /**
     * Parses a raw assistant proposal and applies its actions.
     */
    public ActionApplier.BatchResult applyProposal(ContentNode root, String rawProposal) {
        ActionProposal proposal = proposalParser.parse(rawProposal);
        logger.info("Applying proposal with {} actions: {}", proposal.getActions().size(), proposal.getSummary());
        return actionApplier.applyAll(root, proposal.getActions());
    }

    public MutationResult applyFix(ContentNode root, ValidationIssue issue) {
        Optional<SuggestedFix> fix = issue.fix();
        if (fix.isEmpty()) {
            return MutationResult.refused(root, "Issue " + issue.getId() + " has no suggested fix");
        }
        return treeStore.patch(root, fix.get().getTargetId(), fix.get().getPatch());
    }

    // Query surface

    public Optional<ContentNode> findById(ContentNode root, String id) {
        return pathResolver.findById(root, id);
    }

    public Optional<List<ContentNode>> findPath(ContentNode root, String id) {
        return pathResolver.findPath(root, id);
    }

    public Optional<ContentNode> filter(ContentNode root, String query) {
        return searchFilter.filter(root, query);
    }

    public TreeStats analyzeStats(ContentNode root) {
        return statsAnalyzer.analyze(root);
    }

    public List<ValidationIssue> runValidation(ContentNode root) {
        return validationEngine.runValidation(root);
    }

    public HealthReport healthReport(ContentNode root) {
        return validationEngine.report(root);
    }

    /**
     * Ids used by more than one node. Lookups resolve such ids to the first
     * node in pre-order.
     */
    public Set<String> duplicateIds(ContentNode root) {
        IdIndex index = IdIndex.build(root);
        if (index.hasDuplicates()) {
            logger.warn("Tree contains duplicate ids: {}", index.getDuplicateIds());
        }
        return index.getDuplicateIds();
    }

    // Export surface

    public String exportCsv(ContentNode root, ExportProgressListener listener) {
        return exportPipeline.exportCsv(root, listener);
    }

    public String exportSemanticJson(ContentNode root, ExportProgressListener listener) {
        return exportPipeline.exportSemanticJson(root, listener);
    }

    public String exportLineText(ContentNode root, ExportProgressListener listener) {
        return exportPipeline.exportLineText(root, listener);
    }

    public String export(ExportFormat format, ContentNode root, ExportProgressListener listener,
                         CancellationToken token) {
        return exportPipeline.export(format, root, listener, token);
    }

    public CompletableFuture<String> exportAsync(ExportFormat format, ContentNode root,
                                                 ExportProgressListener listener, CancellationToken token) {
        return exportPipeline.exportAsync(format, root, listener, token);
    }

    /**
     * Shuts down the background export pool.
     */
    @Override
    public void close() {
        exportPipeline.close();
    }
}
