package ai.docsite.plaintext.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import org.junit.jupiter.api.Test;

class LineFormatterTest {

    private final StringWriter out = new StringWriter();

    @Test
    void writesParagraphsSeparatedByOneBlankLine() {
        LineFormatter formatter = new LineFormatter(out, LayoutOptions.defaults());

        formatter.paragraphBreak();
        formatter.write("  First");
        formatter.paragraphBreak();
        formatter.paragraphBreak();
        formatter.lineBreak();
        formatter.write("Second");
        formatter.flush();

        assertThat(out.toString()).isEqualTo("First\n\nSecond\n");
    }

    @Test
    void wrapsAtColumnLimit() {
        LineFormatter formatter = new LineFormatter(out, new LayoutOptions(30, 2, false));

        formatter.write("aaa bbb ccc ddd eee fff ggg hhh iii");
        formatter.lineBreak();

        assertThat(out.toString()).isEqualTo("aaa bbb ccc ddd eee fff ggg\nhhh iii\n");
    }

    @Test
    void labelledIndentHangsContinuationLines() {
        LineFormatter formatter = new LineFormatter(out, new LayoutOptions(30, 2, false));

        formatter.indent("*");
        formatter.write("aaa bbb ccc ddd eee fff ggg hhh");
        formatter.dedent();

        assertThat(out.toString()).isEqualTo("* aaa bbb ccc ddd eee fff ggg\n  hhh\n");
    }

    @Test
    void nestedIndentationShiftsText() {
        LineFormatter formatter = new LineFormatter(out, LayoutOptions.defaults());

        formatter.indent();
        formatter.write("outer");
        formatter.indent("-");
        formatter.write("inner");
        formatter.dedent();
        formatter.dedent();

        assertThat(out.toString()).isEqualTo("  outer\n  - inner\n");
        assertThat(formatter.depth()).isZero();
    }

    @Test
    void longWordsSitOnTheirOwnLine() {
        LineFormatter formatter = new LineFormatter(out, new LayoutOptions(21, 2, false));

        formatter.write("a abcdefghijklmnopqrstuvwxyz b");
        formatter.lineBreak();

        assertThat(out.toString()).isEqualTo("a\nabcdefghijklmnopqrstuvwxyz\nb\n");
    }

    @Test
    void noWrapKeepsLogicalLinesWhole() {
        LineFormatter formatter = new LineFormatter(out, new LayoutOptions(21, 2, true));

        formatter.indent("1.");
        formatter.write("one   two three four five six seven");
        formatter.dedent();

        assertThat(out.toString()).isEqualTo("1. one two three four five six seven\n");
    }

    @Test
    void writesTitleAndSummary() {
        LineFormatter formatter = new LineFormatter(out, LayoutOptions.defaults());

        formatter.writeTitle("Title", "Subtitle");
        formatter.writeSummary("Summary text");
        formatter.writeHeading(1, " Heading ");
        formatter.flush();

        assertThat(out.toString()).isEqualTo("Title\nSubtitle\n\n  Summary text\n\nHeading\n\n");
    }

    @Test
    void rejectsUnbalancedDedent() {
        LineFormatter formatter = new LineFormatter(out, LayoutOptions.defaults());

        assertThatThrownBy(formatter::dedent).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void surfacesWriterFailures() {
        LineFormatter formatter = new LineFormatter(new FailingWriter(), LayoutOptions.defaults());
        formatter.write("text");

        assertThatThrownBy(formatter::flush).isInstanceOf(UncheckedIOException.class);
    }

    private static final class FailingWriter extends Writer {

        @Override
        public void write(char[] buffer, int offset, int length) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public void flush() throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public void close() {
        }
    }
}
