package im.arun.contenttree.tree;

import im.arun.contenttree.TestTrees;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class PathResolverTest {

    private final PathResolver resolver = new PathResolver();

    @Test
    void findsNodeAnywhereInTheTree() {
        ContentNode root = TestTrees.hotel();

        assertThat(resolver.findById(root, "root")).containsSame(root);
        assertThat(resolver.findById(root, "m2").orElseThrow().getName()).isEqualTo("Club Sandwich");
        assertThat(resolver.findById(root, "missing")).isEmpty();
        assertThat(resolver.findById(root, null)).isEmpty();
    }

    @Test
    void pathRunsFromRootToTargetInclusive() {
        ContentNode root = TestTrees.hotel();

        List<ContentNode> path = resolver.findPath(root, "m1").orElseThrow();

        assertThat(path.get(0)).isSameAs(root);
        assertThat(path.get(path.size() - 1).getId()).isEqualTo("m1");
        assertThat(path.stream().map(ContentNode::getId).collect(Collectors.toList()))
            .containsExactly("root", "dining", "menu", "m1");
    }

    @Test
    void pathOfRootIsRootAlone() {
        ContentNode root = TestTrees.hotel();

        assertThat(resolver.findPath(root, "root")).hasValueSatisfying(path ->
            assertThat(path).containsExactly(root));
    }

    @Test
    void pathIsEmptyForUnknownId() {
        assertThat(resolver.findPath(TestTrees.hotel(), "nope")).isEmpty();
    }

    @Test
    void locationRecordsChildIndexes() {
        NodeLocation location = resolver.locate(TestTrees.hotel(), "g2").orElseThrow();

        assertThat(location.getChildIndexes()).containsExactly(0, 1);
        assertThat(location.indexInParent()).isEqualTo(1);
        assertThat(location.parent().getTarget().getId()).isEqualTo("general");
    }

    @Test
    void firstPreOrderMatchWinsForDuplicateIds() {
        ContentNode root = TestTrees.node("root", NodeKind.ROOT, "Root",
            TestTrees.node("a", NodeKind.CATEGORY, "A", TestTrees.item("dup", "Deep", "1")),
            TestTrees.item("dup", "Shallow", "2"));

        Optional<ContentNode> found = resolver.findById(root, "dup");

        assertThat(found.orElseThrow().getName()).isEqualTo("Deep");
    }

    @Test
    void handlesVeryDeepTreesWithoutRecursion() {
        ContentNode root = TestTrees.chain(20_000);

        List<ContentNode> path = resolver.findPath(root, "n20000").orElseThrow();

        assertThat(path).hasSize(20_001);
        assertThat(path.get(path.size() - 1).getName()).isEqualTo("Leaf");
    }
}
