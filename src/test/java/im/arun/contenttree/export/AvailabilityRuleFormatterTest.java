package im.arun.contenttree.export;

import im.arun.contenttree.model.DiningSchema;
import im.arun.contenttree.model.EventSchema;
import im.arun.contenttree.model.RoomSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityRuleFormatterTest {

    private final AvailabilityRuleFormatter formatter = new AvailabilityRuleFormatter();

    @Test
    void formatsEventSchedule() {
        EventSchema event = EventSchema.builder()
            .recurrence(EventSchema.Recurrence.SPECIFIC_DATE)
            .validFrom("2024-06-01")
            .validUntil("2024-06-02")
            .endTime("23:00")
            .status(EventSchema.Status.POSTPONED)
            .build();

        assertThat(formatter.format(event))
            .isEqualTo("specific_date; until 23:00; from: 2024-06-01; until: 2024-06-02; status: postponed");
    }

    @Test
    void formatsDiningHours() {
        DiningSchema dining = DiningSchema.builder()
            .openingHours("07:00-10:30")
            .mealPeriods(List.of("breakfast", "brunch"))
            .requiresReservation(false)
            .build();

        assertThat(formatter.format(dining)).isEqualTo("hours: 07:00-10:30; meals: breakfast/brunch");
    }

    @Test
    void payloadsWithoutScheduleFormatToNull() {
        assertThat(formatter.format(null)).isNull();
        assertThat(formatter.format(RoomSchema.builder().capacity(2).build())).isNull();
        assertThat(formatter.format(EventSchema.builder().location("Beach").build())).isNull();
    }
}
