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
 * Partial update for a single node. Non-null fields overwrite the target's
 * fields, null fields leave them untouched. The id and the children of a node
 * cannot be patched.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodePatch {

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

    @JsonProperty("schemaData")
    SchemaData schemaData;

    @JsonProperty("lastModified")
    Long lastModified;

    public static NodePatch empty() {
        return NodePatch.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return kind == null && name == null && value == null && question == null
            && answer == null && description == null && price == null
            && attributes == null && tags == null && schemaData == null
            && lastModified == null;
    }

    /**
     * Shallow merge onto {@code target}; the result shares the target's
     * children list.
     */
    public ContentNode applyTo(ContentNode target) {
        ContentNode.ContentNodeBuilder builder = target.toBuilder();
        if (kind != null) builder.kind(kind);
        if (name != null) builder.name(name);
        if (value != null) builder.value(value);
        if (question != null) builder.question(question);
        if (answer != null) builder.answer(answer);
        if (description != null) builder.description(description);
        if (price != null) builder.price(price);
        if (attributes != null) builder.attributes(List.copyOf(attributes));
        if (tags != null) builder.tags(List.copyOf(tags));
        if (schemaData != null) builder.schemaData(schemaData);
        if (lastModified != null) builder.lastModified(lastModified);
        return builder.build();
    }
}
