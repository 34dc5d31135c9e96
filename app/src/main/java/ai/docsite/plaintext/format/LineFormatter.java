package ai.docsite.plaintext.format;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Incremental line-layout engine writing word-wrapped text to a {@link Writer}.
 *
 * <p>Text accumulates in a line buffer until a line or paragraph break, at which point the buffer
 * is wrapped at the current indentation and emitted. Repeated breaks collapse: the formatter
 * never emits two blank lines in a row, and leading whitespace at the start of a line is dropped.
 */
public class LineFormatter implements TextSink {

    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^\\s+");

    private final Writer out;
    private final LayoutOptions options;
    private final Deque<FormatterState> stateStack = new ArrayDeque<>();
    private final StringBuilder buffer = new StringBuilder();
    private FormatterState state;
    private boolean atLineStart = true;
    private boolean atParagraphStart = true;

    public LineFormatter(Writer out, LayoutOptions options) {
        this.out = Objects.requireNonNull(out, "out");
        this.options = Objects.requireNonNull(options, "options");
        this.state = new FormatterState(0, Wrapper.create(options, 0, false));
    }

    @Override
    public void write(String text) {
        if (text == null) {
            return;
        }
        String value = text;
        if (atLineStart || atParagraphStart) {
            value = LEADING_WHITESPACE.matcher(value).replaceFirst("");
            if (value.isEmpty()) {
                return;
            }
            atLineStart = false;
            atParagraphStart = false;
        }
        buffer.append(value);
    }

    @Override
    public void lineBreak() {
        if (atLineStart) {
            return;
        }
        emit(state.wrapper().wrap(buffer.toString()));
        emit("\n");
        buffer.setLength(0);
        atLineStart = true;
    }

    @Override
    public void paragraphBreak() {
        if (atParagraphStart) {
            return;
        }
        if (!atLineStart) {
            lineBreak();
        }
        emit("\n");
        atParagraphStart = true;
    }

    @Override
    public void indent(String label) {
        lineBreak();
        boolean labelled = label != null && !label.isEmpty();
        stateStack.push(state);
        int indent = state.indent() + options.tabWidth();
        state = new FormatterState(indent, Wrapper.create(options, indent, labelled));
        if (labelled) {
            write(label);
            write(" ");
        }
    }

    @Override
    public void dedent() {
        lineBreak();
        if (stateStack.isEmpty()) {
            throw new IllegalStateException("dedent without matching indent");
        }
        state = stateStack.pop();
    }

    public void writeTitle(String title, String subtitle) {
        write(title.trim());
        lineBreak();
        if (subtitle != null && !subtitle.isBlank()) {
            write(subtitle.trim());
            lineBreak();
        }
        paragraphBreak();
    }

    public void writeSummary(String summary) {
        paragraphBreak();
        indent();
        write(summary.trim());
        dedent();
        paragraphBreak();
    }

    /**
     * Completes the pending line and pushes everything written so far to the underlying writer.
     * Called between top-level items so a whole collection is never held in memory.
     */
    public void flush() {
        lineBreak();
        try {
            out.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to flush rendered text", ex);
        }
    }

    /**
     * Number of currently open indentation scopes.
     */
    public int depth() {
        return stateStack.size();
    }

    private void emit(String text) {
        try {
            out.write(text);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write rendered text", ex);
        }
    }
}
