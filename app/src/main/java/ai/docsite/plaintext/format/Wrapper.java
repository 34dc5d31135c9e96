package ai.docsite.plaintext.format;

/**
 * Turns one buffered logical line into its final, possibly multi-line, output form
 * (without the trailing line terminator).
 */
@FunctionalInterface
public interface Wrapper {

    String wrap(String text);

    static Wrapper create(LayoutOptions options, int indent, boolean labelled) {
        if (options.noWrap()) {
            return new FlatWrapper(labelled ? indent - options.tabWidth() : indent);
        }
        int start = Math.min(indent, options.columns() - LayoutOptions.MIN_TEXT_WIDTH);
        if (labelled) {
            return new ColumnWrapper(options.columns(), start - options.tabWidth(), options.tabWidth());
        }
        return new ColumnWrapper(options.columns(), start, 0);
    }
}
