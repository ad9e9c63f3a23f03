package im.arun.contenttree.tree;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.contenttree.TestTrees;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ActionApplierTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PathResolver resolver = new PathResolver();
    private ActionApplier applier;

    @BeforeEach
    void setUp() {
        NodeFactory factory = new NodeFactory(prefix -> prefix + "-new",
            Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        applier = new ActionApplier(new TreeStore(), resolver, factory);
    }

    @Test
    void appliesActionsInOrder() {
        ObjectNode spa = mapper.createObjectNode().put("id", "spa").put("type", "category").put("name", "Spa");
        ObjectNode sauna = mapper.createObjectNode().put("name", "Sauna").put("value", "Open 10-22");
        ObjectNode rename = mapper.createObjectNode().put("name", "Grand Hotel & Spa");

        List<TreeAction> actions = List.of(
            new TreeAction(TreeAction.Type.ADD, "root", spa, "Guests ask about wellness"),
            new TreeAction(TreeAction.Type.ADD, "spa", sauna, null),
            new TreeAction(TreeAction.Type.UPDATE, "root", rename, null),
            new TreeAction(TreeAction.Type.DELETE, "faq", null, null));

        ActionApplier.BatchResult result = applier.applyAll(TestTrees.hotel(), actions);

        assertThat(result.appliedCount()).isEqualTo(4);
        ContentNode root = result.root;
        assertThat(root.getName()).isEqualTo("Grand Hotel & Spa");
        assertThat(resolver.findById(root, "faq")).isEmpty();

        ContentNode saunaNode = resolver.findById(root, "spa").orElseThrow().getChildren().get(0);
        assertThat(saunaNode.getId()).isEqualTo("item-new");
        assertThat(saunaNode.getKind()).isEqualTo(NodeKind.ITEM);
        assertThat(saunaNode.getValue()).isEqualTo("Open 10-22");
    }

    @Test
    void failedActionDoesNotStopTheBatch() {
        ContentNode original = TestTrees.hotel();
        List<TreeAction> actions = List.of(
            new TreeAction(TreeAction.Type.DELETE, "missing", null, null),
            new TreeAction(TreeAction.Type.DELETE, "root", null, null),
            new TreeAction(TreeAction.Type.UPDATE, "g1", null, null),
            new TreeAction(TreeAction.Type.UPDATE, "g2", mapper.createObjectNode().put("value", "15:00"), null));

        ActionApplier.BatchResult result = applier.applyAll(original, actions);

        assertThat(result.outcomes).extracting(outcome -> outcome.result.getOutcome()).containsExactly(
            MutationResult.Outcome.NOT_FOUND,
            MutationResult.Outcome.REFUSED,
            MutationResult.Outcome.REFUSED,
            MutationResult.Outcome.APPLIED);
        assertThat(resolver.findById(result.root, "g2").orElseThrow().getValue()).isEqualTo("15:00");
    }

    @Test
    void addWithoutDataCreatesDefaultChild() {
        MutationResult result = applier.apply(TestTrees.hotel(), new TreeAction(TreeAction.Type.ADD, "menu", null, null));

        ContentNode added = resolver.findById(result.getRoot(), "menu").orElseThrow().getChildren().get(2);
        assertThat(added.getKind()).isEqualTo(NodeKind.MENU_ITEM);
        assertThat(added.getName()).isEqualTo("New Item");
    }

    @Test
    void updateCannotChangeIdOrChildren() {
        ObjectNode data = mapper.createObjectNode().put("id", "hijacked").put("name", "Info");
        data.putArray("children");

        ContentNode root = applier.apply(TestTrees.hotel(), new TreeAction(TreeAction.Type.UPDATE, "general", data, null))
            .getRoot();

        ContentNode general = resolver.findById(root, "general").orElseThrow();
        assertThat(general.getName()).isEqualTo("Info");
        assertThat(general.getChildren()).hasSize(2);
        assertThat(resolver.findById(root, "hijacked")).isEmpty();
    }
}
