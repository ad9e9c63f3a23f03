package im.arun.contenttree.cli;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.contenttree.config.ConfigLoader;
import im.arun.contenttree.config.ContentTreeConfig;
import im.arun.contenttree.export.CancellationToken;
import im.arun.contenttree.export.ExportFormat;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.service.ContentTreeService;
import im.arun.contenttree.tree.ActionApplier;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command-line interface over {@link ContentTreeService}. Loads a tree from a
 * JSON file, optionally applies an edit proposal and narrows it with a search,
 * then prints stats, a health report, an export or the resulting tree.
 */
@Command(
    name = "content-tree",
    description = "Validate, search and export hierarchical content trees",
    mixinStandardHelpOptions = true,
    version = "ContentTree 1.0"
)
public class ContentTreeCLI implements Callable<Integer> {

    @Option(names = {"--input"}, description = "Path to the tree JSON file", required = true)
    private String inputPath;

    @Option(names = {"--config"}, description = "Path to a content-tree.yaml override")
    private String configPath;

    @Option(names = {"--apply"}, description = "JSON file with an edit proposal ({summary, actions}) to apply first")
    private String actionsPath;

    @Option(names = {"--search"}, description = "Keep only nodes matching this text (and their ancestors)")
    private String query;

    @Option(names = {"--stats"}, description = "Print completion statistics")
    private boolean stats;

    @Option(names = {"--validate"}, description = "Print the health report")
    private boolean validate;

    @Option(names = {"--export"}, description = "Export format: ${COMPLETION-CANDIDATES}")
    private ExportFormat exportFormat;

    @Option(names = {"--output"}, description = "Output file path (defaults to stdout)")
    private String outputPath;

    private final PrintWriter out;
    private final PrintWriter err;

    public ContentTreeCLI() {
        this(new PrintWriter(System.out, true, StandardCharsets.UTF_8),
            new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    ContentTreeCLI(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() throws Exception {
        Path treePath = Paths.get(inputPath);
        if (!Files.exists(treePath)) {
            err.println("Error: input file not found: " + inputPath);
            return 1;
        }

        ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

        ContentNode root;
        try {
            root = mapper.readValue(treePath.toFile(), ContentNode.class);
        } catch (IOException e) {
            err.println("Error: could not read tree JSON: " + e.getMessage());
            return 1;
        }

        ContentTreeConfig config = new ConfigLoader(configPath).load();
        try (ContentTreeService service = new ContentTreeService(config)) {
            return process(service, mapper, root);
        }
    }

    private Integer process(ContentTreeService service, ObjectMapper mapper, ContentNode root) throws IOException {
        Set<String> duplicates = service.duplicateIds(root);
        if (!duplicates.isEmpty()) {
            err.println("Warning: duplicate ids " + duplicates + "; lookups use the first occurrence");
        }

        if (actionsPath != null) {
            Path proposalPath = Paths.get(actionsPath);
            if (!Files.exists(proposalPath)) {
                err.println("Error: actions file not found: " + actionsPath);
                return 1;
            }
            ActionApplier.BatchResult batch = service.applyProposal(root, Files.readString(proposalPath));
            for (ActionApplier.ActionOutcome outcome : batch.outcomes) {
                err.printf("%-6s %-24s %s%n", outcome.action.getType(), outcome.action.getTargetId(),
                    outcome.result.getOutcome());
            }
            root = batch.root;
        }

        if (query != null) {
            Optional<ContentNode> filtered = service.filter(root, query);
            if (filtered.isEmpty()) {
                err.println("No nodes match \"" + query + "\"");
                return 0;
            }
            root = filtered.get();
        }

        String payload;
        if (exportFormat != null) {
            payload = service.export(exportFormat, root,
                percent -> err.print("\rExporting... " + percent + "%"), new CancellationToken());
            err.println();
        } else if (validate) {
            payload = mapper.writeValueAsString(service.healthReport(root));
        } else if (stats) {
            payload = mapper.writeValueAsString(service.analyzeStats(root));
        } else {
            payload = mapper.writeValueAsString(root);
        }

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), payload, StandardCharsets.UTF_8);
            err.println("Output written to: " + outputPath);
        } else {
            out.println(payload);
        }
        return 0;
    }

    static CommandLine commandLine(ContentTreeCLI cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new ContentTreeCLI()).execute(args);
        System.exit(exitCode);
    }
}
