package im.arun.contenttree.tree;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A proposed edit, as produced by a human editor or a model-driven assistant.
 * For {@code add} the target is the parent and {@code data} the new node; for
 * {@code update} the target is the node and {@code data} the patch; for
 * {@code delete} {@code data} is ignored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TreeAction {

    public enum Type {
        @JsonProperty("add") ADD,
        @JsonProperty("update") UPDATE,
        @JsonProperty("delete") DELETE
    }

    @JsonProperty("type")
    private Type type;

    @JsonProperty("targetId")
    private String targetId;

    @JsonProperty("data")
    private JsonNode data;

    @JsonProperty("reason")
    private String reason;
}
