package im.arun.contenttree.export;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeAttribute;
import im.arun.contenttree.util.TreeUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Field derivations shared by the flat serializers.
 */
final class ExportFields {

    private ExportFields() {}

    /**
     * Value, else answer, else question.
     */
    static String primaryContent(ContentNode node) {
        if (!TreeUtils.isBlank(node.getValue())) {
            return node.getValue();
        }
        if (!TreeUtils.isBlank(node.getAnswer())) {
            return node.getAnswer();
        }
        return TreeUtils.nullToEmpty(node.getQuestion());
    }

    static String attributeSummary(ContentNode node) {
        List<String> parts = new ArrayList<>();
        if (!TreeUtils.isBlank(node.getPrice())) {
            parts.add("Price: " + node.getPrice());
        }
        if (node.getAttributes() != null) {
            for (NodeAttribute attribute : node.getAttributes()) {
                if (attribute == null || TreeUtils.isBlank(attribute.getKey())) {
                    continue;
                }
                parts.add(attribute.getKey() + ": " + TreeUtils.nullToEmpty(attribute.getValue()));
            }
        }
        return String.join("; ", parts);
    }

    /**
     * Tags in first-seen order with duplicates and blanks dropped.
     */
    static String joinTags(ContentNode node, String delimiter) {
        if (node.getTags() == null) {
            return "";
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String tag : node.getTags()) {
            if (!TreeUtils.isBlank(tag)) {
                unique.add(tag.trim());
            }
        }
        return String.join(delimiter, unique);
    }
}
