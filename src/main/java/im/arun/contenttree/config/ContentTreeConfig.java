package im.arun.contenttree.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ContentTreeConfig {
    private int maxNestingDepth = 5;
    private int exportBatchSize = 50;
    private String breadcrumbSeparator = " > ";
    private String untitledLabel = "Untitled";
    private List<String> placeholderNames = new ArrayList<>(List.of("untitled", "new item", "new node"));
    private boolean enforceUniqueIds = true;
    private boolean prettyJson = false;
}
