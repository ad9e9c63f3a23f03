package im.arun.contenttree.export;

import im.arun.contenttree.model.DiningSchema;
import im.arun.contenttree.model.EventSchema;
import im.arun.contenttree.model.RoomSchema;
import im.arun.contenttree.model.SchemaData;
import im.arun.contenttree.util.TreeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Encodes the schedule carried by a node's schema payload as one compact
 * string, e.g. {@code weekly; days: Mon/Wed; 20:00-22:00; status: active}.
 * Payloads without a schedule encode to null.
 */
public class AvailabilityRuleFormatter implements SchemaData.Visitor<String> {

    public String format(SchemaData schemaData) {
        return schemaData == null ? null : schemaData.accept(this);
    }

    @Override
    public String visitEvent(EventSchema event) {
        List<String> parts = new ArrayList<>();
        if (event.getRecurrence() != null) {
            parts.add(event.getRecurrence().name().toLowerCase(Locale.ROOT));
        }
        if (event.getDays() != null && !event.getDays().isEmpty()) {
            parts.add("days: " + String.join("/", event.getDays()));
        }
        String timeRange = timeRange(event.getStartTime(), event.getEndTime());
        if (timeRange != null) {
            parts.add(timeRange);
        }
        if (!TreeUtils.isBlank(event.getValidFrom())) {
            parts.add("from: " + event.getValidFrom());
        }
        if (!TreeUtils.isBlank(event.getValidUntil())) {
            parts.add("until: " + event.getValidUntil());
        }
        if (event.getStatus() != null) {
            parts.add("status: " + event.getStatus().name().toLowerCase(Locale.ROOT));
        }
        if (Boolean.TRUE.equals(event.getRequiresReservation())) {
            parts.add("reservation required");
        }
        return join(parts);
    }

    @Override
    public String visitDining(DiningSchema dining) {
        List<String> parts = new ArrayList<>();
        if (!TreeUtils.isBlank(dining.getOpeningHours())) {
            parts.add("hours: " + dining.getOpeningHours());
        }
        if (dining.getMealPeriods() != null && !dining.getMealPeriods().isEmpty()) {
            parts.add("meals: " + String.join("/", dining.getMealPeriods()));
        }
        if (Boolean.TRUE.equals(dining.getRequiresReservation())) {
            parts.add("reservation required");
        }
        return join(parts);
    }

    @Override
    public String visitRoom(RoomSchema room) {
        return null;
    }

    private static String timeRange(String start, String end) {
        if (TreeUtils.isBlank(start) && TreeUtils.isBlank(end)) {
            return null;
        }
        if (TreeUtils.isBlank(end)) {
            return "from " + start;
        }
        if (TreeUtils.isBlank(start)) {
            return "until " + end;
        }
        return start + "-" + end;
    }

    private static String join(List<String> parts) {
        return parts.isEmpty() ? null : String.join("; ", parts);
    }
}
