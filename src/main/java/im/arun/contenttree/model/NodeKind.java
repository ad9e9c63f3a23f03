package im.arun.contenttree.model;

import java.util.Set;

/**
 * Conventional node kind tags. The set is open: any other tag is accepted and
 * treated as a fillable kind.
 */
public final class NodeKind {
    public static final String ROOT = "root";
    public static final String CATEGORY = "category";
    public static final String LIST = "list";
    public static final String MENU = "menu";

    public static final String ITEM = "item";
    public static final String FIELD = "field";
    public static final String MENU_ITEM = "menu_item";
    public static final String EVENT = "event";

    public static final String QA_PAIR = "qa_pair";
    public static final String NOTE = "note";
    public static final String POLICY = "policy";

    private static final Set<String> CONTAINERS = Set.of(ROOT, CATEGORY, LIST, MENU);

    private NodeKind() {}

    public static boolean isContainer(String kind) {
        return kind != null && CONTAINERS.contains(kind);
    }

    public static boolean isFillable(String kind) {
        return !isContainer(kind);
    }

    /**
     * Kind a new child gets when the caller does not pick one.
     */
    public static String defaultChildKind(String parentKind) {
        if (parentKind == null) {
            return ITEM;
        }
        switch (parentKind) {
            case ROOT:
                return CATEGORY;
            case MENU:
                return MENU_ITEM;
            default:
                return ITEM;
        }
    }
}
