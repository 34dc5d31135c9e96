package ai.docsite.plaintext.format;

/**
 * Page geometry used by {@link LineFormatter}.
 */
public record LayoutOptions(int columns, int tabWidth, boolean noWrap) {

    public static final int DEFAULT_COLUMNS = 75;
    public static final int DEFAULT_TAB_WIDTH = 2;
    /** Minimum usable width that indentation may never eat into. */
    public static final int MIN_TEXT_WIDTH = 20;

    public LayoutOptions {
        if (columns <= MIN_TEXT_WIDTH) {
            throw new IllegalArgumentException("columns must be greater than " + MIN_TEXT_WIDTH);
        }
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be at least 1");
        }
    }

    public static LayoutOptions defaults() {
        return new LayoutOptions(DEFAULT_COLUMNS, DEFAULT_TAB_WIDTH, false);
    }
}
