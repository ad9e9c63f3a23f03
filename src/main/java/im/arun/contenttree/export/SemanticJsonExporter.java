package im.arun.contenttree.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.contenttree.model.ContentNode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Nested JSON for a language-model consumer: internal fields stripped, empty
 * fields dropped, a {@code _path} breadcrumb on every node and children nested
 * under {@code contains}.
 */
public class SemanticJsonExporter extends BatchedExporter {
    static final String PATH_FIELD = "_path";
    static final String CHILDREN_FIELD = "contains";
    private static final List<String> INTERNAL_FIELDS = List.of("id", "lastModified", "children");

    private final ObjectMapper objectMapper;

    public SemanticJsonExporter(TreeFlattener flattener, String breadcrumbSeparator, int batchSize,
                                boolean prettyPrint) {
        super(flattener, breadcrumbSeparator, batchSize);
        this.objectMapper = new ObjectMapper();
        if (prettyPrint) {
            this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.JSON;
    }

    @Override
    protected ExportSession begin(int totalEntries) {
        Map<ContentNode, ObjectNode> converted = new IdentityHashMap<>();
        List<ObjectNode> roots = new ArrayList<>(1);

        return new ExportSession() {
            @Override
            public void accept(ExportEntry entry) {
                ObjectNode json = toSemanticNode(entry);
                converted.put(entry.getNode(), json);

                // Pre-order guarantees the parent was converted first
                ObjectNode parentJson = entry.getParent() == null ? null : converted.get(entry.getParent());
                if (parentJson == null) {
                    roots.add(json);
                } else {
                    ArrayNode contains = parentJson.has(CHILDREN_FIELD)
                        ? (ArrayNode) parentJson.get(CHILDREN_FIELD)
                        : parentJson.putArray(CHILDREN_FIELD);
                    contains.add(json);
                }
            }

            @Override
            public String finish() {
                if (roots.isEmpty()) {
                    return "{}";
                }
                try {
                    return objectMapper.writeValueAsString(roots.get(0));
                } catch (JsonProcessingException e) {
                    throw new ExportException("Failed to serialize semantic JSON", e);
                }
            }
        };
    }

    private ObjectNode toSemanticNode(ExportEntry entry) {
        ObjectNode fields = objectMapper.valueToTree(entry.getNode().withChildren(null));
        INTERNAL_FIELDS.forEach(fields::remove);

        JsonNode attributes = fields.get("attributes");
        if (attributes != null && attributes.isArray()) {
            for (JsonNode attribute : attributes) {
                if (attribute.isObject()) {
                    ((ObjectNode) attribute).remove("id");
                }
            }
        }
        dropEmpty(fields);

        ObjectNode json = objectMapper.createObjectNode();
        json.put(PATH_FIELD, breadcrumb(entry.getBreadcrumb()));
        json.setAll(fields);
        return json;
    }

    /**
     * Removes null, empty-string, empty-array and empty-object members,
     * innermost first.
     */
    static void dropEmpty(JsonNode node) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                dropEmpty(value);
                if (isEmpty(value)) {
                    fields.remove();
                }
            }
        } else if (node.isArray()) {
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                JsonNode value = elements.next();
                dropEmpty(value);
                if (isEmpty(value)) {
                    elements.remove();
                }
            }
        }
    }

    private static boolean isEmpty(JsonNode value) {
        return value.isNull()
            || (value.isTextual() && value.asText().isEmpty())
            || (value.isContainerNode() && value.size() == 0);
    }
}
