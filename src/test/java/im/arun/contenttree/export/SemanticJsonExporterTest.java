package im.arun.contenttree.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.contenttree.TestTrees;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.EventSchema;
import im.arun.contenttree.model.NodeAttribute;
import im.arun.contenttree.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticJsonExporterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SemanticJsonExporter exporter =
        new SemanticJsonExporter(new TreeFlattener("Untitled"), " > ", 3, false);

    @Test
    void nestsChildrenUnderContainsWithPaths() throws Exception {
        JsonNode root = objectMapper.readTree(exporter.export(TestTrees.hotel()));

        assertThat(root.fieldNames().next()).isEqualTo("_path");
        assertThat(root.get("_path").asText()).isEqualTo("Grand Hotel");
        assertThat(root.get("contains").size()).isEqualTo(3);

        JsonNode espresso = root.get("contains").get(1).get("contains").get(0).get("contains").get(0);
        assertThat(espresso.get("_path").asText()).isEqualTo("Grand Hotel > Dining > Lobby Bar Menu > Espresso");
        assertThat(espresso.get("type").asText()).isEqualTo("menu_item");
        assertThat(espresso.get("price").asText()).isEqualTo("3");
        assertThat(espresso.has("contains")).isFalse();
    }

    @Test
    void stripsInternalFieldsAndEmptyValues() throws Exception {
        ContentNode node = ContentNode.builder()
            .id("x1").kind(NodeKind.ITEM).name("Spa").value("").description(null)
            .lastModified(1_700_000_000_000L)
            .tags(List.of())
            .attributes(List.of(NodeAttribute.builder().id("a1").key("Hours").value("10-18").build()))
            .build();
        ContentNode root = TestTrees.node("root", NodeKind.ROOT, "Hotel", node);

        JsonNode spa = objectMapper.readTree(exporter.export(root)).get("contains").get(0);

        assertThat(spa.has("id")).isFalse();
        assertThat(spa.has("lastModified")).isFalse();
        assertThat(spa.has("children")).isFalse();
        assertThat(spa.has("value")).isFalse();
        assertThat(spa.has("tags")).isFalse();
        assertThat(spa.get("attributes").get(0).has("id")).isFalse();
        assertThat(spa.get("attributes").get(0).get("key").asText()).isEqualTo("Hours");
    }

    @Test
    void keepsSchemaPayloadWithDiscriminator() throws Exception {
        ContentNode show = ContentNode.builder()
            .id("e1").kind(NodeKind.EVENT).name("Fire Show")
            .schemaData(EventSchema.builder()
                .recurrence(EventSchema.Recurrence.WEEKLY)
                .days(List.of("Fri"))
                .startTime("21:00")
                .build())
            .build();
        ContentNode root = TestTrees.node("root", NodeKind.ROOT, "Hotel", show);

        JsonNode schema = objectMapper.readTree(exporter.export(root)).get("contains").get(0).get("schemaData");

        assertThat(schema.get("schemaType").asText()).isEqualTo("event");
        assertThat(schema.get("recurrence").asText()).isEqualTo("weekly");
        assertThat(schema.get("startTime").asText()).isEqualTo("21:00");
    }

    @Test
    void dropEmptyWorksInnermostFirst() throws Exception {
        JsonNode json = objectMapper.readTree("{\"a\":{\"b\":[\"\",null,{}]},\"c\":\"keep\",\"d\":[]}");

        SemanticJsonExporter.dropEmpty(json);

        assertThat(json.toString()).isEqualTo("{\"c\":\"keep\"}");
    }

    @Test
    void prettyPrintingIsConfigurable() {
        SemanticJsonExporter pretty = new SemanticJsonExporter(new TreeFlattener("Untitled"), " > ", 50, true);

        assertThat(pretty.export(TestTrees.hotel())).contains("\n");
        assertThat(exporter.export(TestTrees.hotel())).doesNotContain("\n");
    }
}
