package im.arun.contenttree.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Scheduled activity: shows, kids club sessions, themed dinners.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventSchema implements SchemaData {

    public enum Recurrence {
        @JsonProperty("daily") DAILY,
        @JsonProperty("weekly") WEEKLY,
        @JsonProperty("biweekly") BIWEEKLY,
        @JsonProperty("monthly") MONTHLY,
        @JsonProperty("specific_date") SPECIFIC_DATE
    }

    public enum Status {
        @JsonProperty("active") ACTIVE,
        @JsonProperty("cancelled") CANCELLED,
        @JsonProperty("postponed") POSTPONED,
        @JsonProperty("full") FULL
    }

    Recurrence recurrence;
    List<String> days;
    String startTime;
    String endTime;
    String validFrom;
    String validUntil;
    Status status;
    String location;
    String targetAudience;
    Integer minAge;
    Integer maxAge;
    Boolean requiresReservation;

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEvent(this);
    }
}
