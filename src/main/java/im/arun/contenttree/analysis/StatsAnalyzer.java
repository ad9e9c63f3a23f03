package im.arun.contenttree.analysis;

import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import im.arun.contenttree.util.TreeUtils;

import java.util.Objects;

/**
 * Single pre-order pass producing {@link TreeStats}.
 */
public class StatsAnalyzer {

    public TreeStats analyze(ContentNode root) {
        Objects.requireNonNull(root, "root");
        int[] counters = new int[5]; // total, containers, fillable, empty, maxDepth

        TreeUtils.walkPreOrder(root, (node, parent, depth) -> {
            counters[0]++;
            counters[4] = Math.max(counters[4], depth + 1);
            if (NodeKind.isContainer(node.getKind())) {
                counters[1]++;
            } else {
                counters[2]++;
                if (isEmpty(node)) {
                    counters[3]++;
                }
            }
        });

        int fillable = counters[2];
        int empty = counters[3];
        int completionRate = fillable == 0
            ? 100
            : (int) Math.round((fillable - empty) * 100.0 / fillable);

        return new TreeStats(counters[0], counters[1], fillable, empty, counters[4], completionRate);
    }

    /**
     * Kind-specific emptiness: Q&A pairs need an answer, menu items a price,
     * everything else a value.
     */
    static boolean isEmpty(ContentNode node) {
        String kind = node.getKind();
        if (NodeKind.QA_PAIR.equals(kind)) {
            return TreeUtils.isBlank(node.getAnswer());
        }
        if (NodeKind.MENU_ITEM.equals(kind)) {
            return TreeUtils.isBlank(node.getPrice());
        }
        return TreeUtils.isBlank(node.getValue());
    }
}
