package im.arun.contenttree.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Represents a node in the hierarchical content tree.
 * Instances are immutable; every change goes through {@code TreeStore}, which
 * copies only the nodes on the path to the change.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContentNode {

    @JsonProperty("id")
    String id;

    @JsonProperty("type")
    String kind;

    @JsonProperty("name")
    String name;

    @JsonProperty("value")
    String value;

    @JsonProperty("question")
    String question;

    @JsonProperty("answer")
    String answer;

    @JsonProperty("description")
    String description;

    @JsonProperty("price")
    String price;

    @JsonProperty("attributes")
    List<NodeAttribute> attributes;

    @JsonProperty("tags")
    List<String> tags;

    @JsonProperty("children")
    List<ContentNode> children;

    @JsonProperty("schemaData")
    SchemaData schemaData;

    @JsonProperty("lastModified")
    Long lastModified;

    @JsonIgnore
    public boolean hasChildren() {
        return children != null && !children.isEmpty();
    }

    /**
     * Copy of this node with the given children list. The list is wrapped,
     * never mutated.
     */
    public ContentNode withChildren(List<ContentNode> newChildren) {
        return toBuilder()
            .children(newChildren == null ? null : List.copyOf(newChildren))
            .build();
    }
}
