package im.arun.contenttree.tree;

import im.arun.contenttree.TestTrees;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdIndexTest {

    @Test
    void indexesEveryNode() {
        IdIndex index = IdIndex.build(TestTrees.hotel());

        assertThat(index.size()).isEqualTo(10);
        assertThat(index.contains("q1")).isTrue();
        assertThat(index.get("menu").orElseThrow().getKind()).isEqualTo(NodeKind.MENU);
        assertThat(index.hasDuplicates()).isFalse();
    }

    @Test
    void reportsDuplicatesAndKeepsFirstOccurrence() {
        ContentNode root = TestTrees.node("root", NodeKind.ROOT, "Root",
            TestTrees.item("x", "First", "1"),
            TestTrees.node("c", NodeKind.CATEGORY, "C", TestTrees.item("x", "Second", "2")));

        IdIndex index = IdIndex.build(root);

        assertThat(index.getDuplicateIds()).containsExactly("x");
        assertThat(index.get("x").orElseThrow().getName()).isEqualTo("First");
    }
}
