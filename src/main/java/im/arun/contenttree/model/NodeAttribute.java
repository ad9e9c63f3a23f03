package im.arun.contenttree.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Flexible key/value metadata on a node, e.g. "Working Hours" = "09:00 - 18:00".
 * Keys are not required to be unique.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeAttribute {
    String id;
    String key;
    String value;
    AttributeType type;

    // Only meaningful for SELECT
    List<String> options;
}
