package im.arun.contenttree.export;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.util.TreeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One self-contained line per node, so each line still makes sense when a
 * downstream embedder chunks the text:
 * {@code [Hotel > Dining > Steakhouse] ITEM: Steakhouse | Value: ... | Tags: ...}.
 */
public class LineTextExporter extends BatchedExporter {

    private final AvailabilityRuleFormatter ruleFormatter = new AvailabilityRuleFormatter();

    public LineTextExporter(TreeFlattener flattener, String breadcrumbSeparator, int batchSize) {
        super(flattener, breadcrumbSeparator, batchSize);
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.TEXT;
    }

    @Override
    protected ExportSession begin(int totalEntries) {
        List<String> lines = new ArrayList<>(totalEntries);
        return new ExportSession() {
            @Override
            public void accept(ExportEntry entry) {
                lines.add(toLine(entry));
            }

            @Override
            public String finish() {
                return String.join("\n", lines);
            }
        };
    }

    String toLine(ExportEntry entry) {
        ContentNode node = entry.getNode();
        String kind = TreeUtils.nullToEmpty(node.getKind()).toUpperCase(Locale.ROOT);
        String name = entry.getBreadcrumb().get(entry.getBreadcrumb().size() - 1);

        StringBuilder line = new StringBuilder()
            .append('[').append(breadcrumb(entry.getBreadcrumb())).append("] ")
            .append(kind).append(": ").append(name);

        appendSegment(line, "Value", node.getValue());
        appendSegment(line, "Answer", node.getAnswer());
        appendSegment(line, "Price", node.getPrice());
        appendSegment(line, "Rules", ruleFormatter.format(node.getSchemaData()));
        appendSegment(line, "Tags", ExportFields.joinTags(node, ", "));
        appendSegment(line, "Note", node.getDescription());

        // Line breaks inside a field would split the record
        return line.toString().replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
    }

    private static void appendSegment(StringBuilder line, String label, String value) {
        if (!TreeUtils.isBlank(value)) {
            line.append(" | ").append(label).append(": ").append(value.trim());
        }
    }
}
