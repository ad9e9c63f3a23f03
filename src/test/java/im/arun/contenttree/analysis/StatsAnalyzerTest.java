package im.arun.contenttree.analysis;

import im.arun.contenttree.TestTrees;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatsAnalyzerTest {

    private final StatsAnalyzer analyzer = new StatsAnalyzer();

    @Test
    void countsContainersFillablesAndEmpties() {
        TreeStats stats = analyzer.analyze(TestTrees.hotel());

        assertThat(stats.getTotalNodes()).isEqualTo(10);
        assertThat(stats.getContainerCount()).isEqualTo(5);
        assertThat(stats.getFillableCount()).isEqualTo(5);
        // Only the unpriced menu item is empty
        assertThat(stats.getEmptyCount()).isEqualTo(1);
        assertThat(stats.getMaxDepth()).isEqualTo(4);
        assertThat(stats.getCompletionRate()).isEqualTo(80);
    }

    @Test
    void treeWithoutFillableNodesIsFullyComplete() {
        ContentNode root = TestTrees.node("root", NodeKind.ROOT, "Hotel",
            TestTrees.node("c", NodeKind.CATEGORY, "Empty category"));

        TreeStats stats = analyzer.analyze(root);

        assertThat(stats.getFillableCount()).isZero();
        assertThat(stats.getCompletionRate()).isEqualTo(100);
        assertThat(stats.getMaxDepth()).isEqualTo(2);
    }

    @Test
    void emptinessDependsOnKind() {
        ContentNode unanswered = ContentNode.builder().id("q").kind(NodeKind.QA_PAIR).name("Q")
            .value("has a value but no answer").build();
        ContentNode priced = ContentNode.builder().id("p").kind(NodeKind.MENU_ITEM).name("Tea").price("2").build();
        ContentNode blankNote = ContentNode.builder().id("n").kind(NodeKind.NOTE).name("Note").value("   ").build();
        ContentNode unknownKind = ContentNode.builder().id("u").kind("spa_service").name("Massage").value("60 min").build();

        assertThat(StatsAnalyzer.isEmpty(unanswered)).isTrue();
        assertThat(StatsAnalyzer.isEmpty(priced)).isFalse();
        assertThat(StatsAnalyzer.isEmpty(blankNote)).isTrue();
        assertThat(StatsAnalyzer.isEmpty(unknownKind)).isFalse();
    }

    @Test
    void completionRateIsRounded() {
        ContentNode root = TestTrees.node("root", NodeKind.ROOT, "Hotel",
            TestTrees.item("a", "A", "x"),
            TestTrees.item("b", "B", "x"),
            TestTrees.item("c", "C", ""));

        assertThat(analyzer.analyze(root).getCompletionRate()).isEqualTo(67);
    }
}
