package ai.docsite.plaintext.format;

import ai.docsite.plaintext.text.TextNormalizer;

/**
 * Flattens everything written to it into a single line of text.
 *
 * <p>Breaks become single spaces and indentation is ignored apart from any label, which is kept
 * verbatim. Used for headings, sub/superscripts and description terms.
 */
public class InlineCollector implements TextSink {

    private final StringBuilder buffer = new StringBuilder();
    private boolean atLineStart = true;
    private boolean atParagraphStart = true;

    @Override
    public void write(String text) {
        atLineStart = false;
        atParagraphStart = false;
        buffer.append(text);
    }

    @Override
    public void lineBreak() {
        if (!atLineStart) {
            buffer.append(' ');
            atLineStart = true;
        }
    }

    @Override
    public void paragraphBreak() {
        if (!atParagraphStart) {
            lineBreak();
            atParagraphStart = true;
        }
    }

    @Override
    public void indent(String label) {
        lineBreak();
        if (label != null && !label.isEmpty()) {
            buffer.append(label).append(' ');
        }
    }

    @Override
    public void dedent() {
        lineBreak();
    }

    /**
     * The collected text with every whitespace run folded into one space.
     */
    public String text() {
        return TextNormalizer.collapseWhitespace(buffer.toString());
    }
}
