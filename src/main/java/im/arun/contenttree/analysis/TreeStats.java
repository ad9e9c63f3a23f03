package im.arun.contenttree.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Completion and health counters for a tree.
 */
@Value
public class TreeStats {

    @JsonProperty("total_nodes")
    int totalNodes;

    @JsonProperty("container_count")
    int containerCount;

    @JsonProperty("fillable_count")
    int fillableCount;

    @JsonProperty("empty_count")
    int emptyCount;

    /** Root counts as depth 1. */
    @JsonProperty("max_depth")
    int maxDepth;

    @JsonProperty("completion_rate")
    int completionRate;
}
