package ai.docsite.plaintext.format;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Greedy word wrap between a start column and a stop column.
 *
 * <p>Whitespace runs collapse to one space and lines break only at whitespace; a word longer than
 * the available width is placed on a line of its own. Continuation lines are indented by
 * {@code hangingIndent} columns beyond the start column.
 */
final class ColumnWrapper implements Wrapper {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int columns;
    private final int start;
    private final int hangingIndent;

    ColumnWrapper(int columns, int start, int hangingIndent) {
        this.columns = columns;
        this.start = Math.max(0, start);
        this.hangingIndent = Math.max(0, hangingIndent);
    }

    @Override
    public String wrap(String text) {
        String collapsed = text.strip();
        if (collapsed.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder(columns);
        int lineStart = start;
        line.append(" ".repeat(lineStart));
        boolean empty = true;
        for (String word : WHITESPACE.split(collapsed)) {
            if (!empty && line.length() + 1 + word.length() > columns) {
                lines.add(line.toString());
                line.setLength(0);
                lineStart = start + hangingIndent;
                line.append(" ".repeat(lineStart));
                empty = true;
            }
            if (!empty) {
                line.append(' ');
            }
            line.append(word);
            empty = false;
        }
        lines.add(line.toString());
        return String.join("\n", lines);
    }
}
