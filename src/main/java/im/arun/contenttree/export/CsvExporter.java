package im.arun.contenttree.export;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.util.TreeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Tabular export: one row per node with a fixed column schema, RFC 4180
 * quoting and a leading byte-order mark so spreadsheet tools pick UTF-8.
 */
public class CsvExporter extends BatchedExporter {
    static final String BOM = "\uFEFF";
    static final List<String> HEADERS = List.of(
        "System_ID", "Semantic_Path", "Parent_Path", "Node_Type", "Name",
        "Primary_Content", "Availability_Rule", "Attributes", "Tags", "Description");

    private final AvailabilityRuleFormatter ruleFormatter = new AvailabilityRuleFormatter();

    public CsvExporter(TreeFlattener flattener, String breadcrumbSeparator, int batchSize) {
        super(flattener, breadcrumbSeparator, batchSize);
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.CSV;
    }

    @Override
    protected ExportSession begin(int totalEntries) {
        List<String> rows = new ArrayList<>(totalEntries + 1);
        rows.add(BOM + String.join(",", HEADERS));

        return new ExportSession() {
            @Override
            public void accept(ExportEntry entry) {
                rows.add(toRow(entry));
            }

            @Override
            public String finish() {
                return String.join("\n", rows);
            }
        };
    }

    private String toRow(ExportEntry entry) {
        ContentNode node = entry.getNode();
        List<String> cells = List.of(
            escape(node.getId()),
            escape(breadcrumb(entry.getBreadcrumb())),
            escape(breadcrumb(entry.parentBreadcrumb())),
            escape(node.getKind()),
            escape(node.getName()),
            escape(ExportFields.primaryContent(node)),
            escape(ruleFormatter.format(node.getSchemaData())),
            escape(ExportFields.attributeSummary(node)),
            escape(ExportFields.joinTags(node, ", ")),
            escape(node.getDescription()));
        return String.join(",", cells);
    }

    /**
     * Quotes a cell when it contains a comma, quote or line break, doubling
     * embedded quotes. Null becomes the empty cell.
     */
    static String escape(String value) {
        String text = TreeUtils.nullToEmpty(value);
        if (text.contains(",") || text.contains("\"") || text.contains("\n") || text.contains("\r")) {
            return "\"" + text.replace("\"", "\"\"") + "\"";
        }
        return text;
    }
}
