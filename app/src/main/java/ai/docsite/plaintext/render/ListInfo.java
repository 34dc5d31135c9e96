package ai.docsite.plaintext.render;

/**
 * State of the innermost open list. Saved and restored around every list subtree.
 */
final class ListInfo {

    private static final String BULLETS = "*-+";
    private static final String[] COUNTER_SUFFIXES = {".", ".)", ".]"};

    private final ListType type;
    private final int depth;
    private int counter;
    private boolean sawTerm;

    ListInfo(ListType type, int depth) {
        this.type = type;
        this.depth = depth;
    }

    static ListInfo root() {
        return new ListInfo(ListType.NONE, 0);
    }

    ListInfo nested(ListType nestedType) {
        return new ListInfo(nestedType, depth + 1);
    }

    ListType type() {
        return type;
    }

    int depth() {
        return depth;
    }

    boolean sawTerm() {
        return sawTerm;
    }

    void sawTerm(boolean value) {
        sawTerm = value;
    }

    /**
     * Label for the next item: a bullet chosen by depth, or for ordered lists the incremented
     * counter with a suffix chosen by depth.
     */
    String nextItemLabel() {
        int cycle = depth % 3;
        if (type == ListType.ORDERED) {
            counter++;
            return counter + COUNTER_SUFFIXES[cycle];
        }
        return String.valueOf(BULLETS.charAt(cycle));
    }
}
