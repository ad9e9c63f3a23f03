package im.arun.contenttree.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoomSchema implements SchemaData {
    Integer capacity;
    Integer sizeSqm;
    String bedType;
    String view;
    List<String> amenities;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitRoom(this);
    }
}
