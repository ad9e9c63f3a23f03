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
public class DiningSchema implements SchemaData {
    String cuisine;
    String concept;
    String openingHours;
    List<String> mealPeriods;
    Boolean requiresReservation;
    String dressCode;
    Boolean externalGuestsAllowed;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDining(this);
    }
}
