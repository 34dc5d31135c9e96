package ai.docsite.plaintext.format;

/**
 * Line-oriented destination for rendered text.
 *
 * <p>The document visitor writes exclusively through this interface so that a subtree can be
 * laid out on the page ({@link LineFormatter}) or flattened into a single string
 * ({@link InlineCollector}) with the same traversal code.
 */
public interface TextSink {

    void write(String text);

    void lineBreak();

    void paragraphBreak();

    /**
     * Opens a nested indentation scope, optionally prefixed by a hanging label such as a list bullet.
     */
    void indent(String label);

    default void indent() {
        indent(null);
    }

    void dedent();

    default void writeHeading(int level, String heading) {
        paragraphBreak();
        write(heading.trim());
        paragraphBreak();
    }
}
