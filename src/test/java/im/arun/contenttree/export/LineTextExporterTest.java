package im.arun.contenttree.export;

import im.arun.contenttree.TestTrees;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.EventSchema;
import im.arun.contenttree.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineTextExporterTest {

    private final LineTextExporter exporter = new LineTextExporter(new TreeFlattener("Untitled"), " > ", 50);

    @Test
    void eachLineCarriesItsBreadcrumb() {
        List<String> lines = List.of(exporter.export(TestTrees.hotel()).split("\n"));

        assertThat(lines).hasSize(10);
        assertThat(lines.get(0)).isEqualTo("[Grand Hotel] ROOT: Grand Hotel");
        assertThat(lines.get(2)).isEqualTo("[Grand Hotel > General Information > Hotel Name] FIELD: Hotel Name"
            + " | Value: Grand React Hotel");
        assertThat(lines.get(6)).isEqualTo("[Grand Hotel > Dining > Lobby Bar Menu > Espresso] MENU_ITEM: Espresso"
            + " | Price: 3");
        assertThat(lines.get(9)).isEqualTo("[Grand Hotel > FAQ > Pets] QA_PAIR: Pets"
            + " | Answer: Small dogs only. | Tags: pets, policy");
    }

    @Test
    void includesScheduleAndNoteOnASingleLine() {
        ContentNode show = ContentNode.builder()
            .id("e1").kind(NodeKind.EVENT).name("Fire Show")
            .description("Bring a jacket.\nIt gets windy.")
            .schemaData(EventSchema.builder()
                .recurrence(EventSchema.Recurrence.WEEKLY)
                .days(List.of("Mon", "Wed"))
                .startTime("20:00").endTime("22:00")
                .status(EventSchema.Status.ACTIVE)
                .requiresReservation(true)
                .build())
            .build();

        String text = exporter.export(TestTrees.node("root", NodeKind.ROOT, "Hotel", show));

        assertThat(text.split("\n")).hasSize(2);
        assertThat(text.split("\n")[1]).isEqualTo("[Hotel > Fire Show] EVENT: Fire Show"
            + " | Rules: weekly; days: Mon/Wed; 20:00-22:00; status: active; reservation required"
            + " | Note: Bring a jacket. It gets windy.");
    }

    @Test
    void untitledNodesUseTheLabel() {
        ContentNode root = TestTrees.node("root", NodeKind.ROOT, "Hotel", TestTrees.item("x", null, "Free"));

        assertThat(exporter.export(root).split("\n")[1]).isEqualTo("[Hotel > Untitled] ITEM: Untitled | Value: Free");
    }
}
