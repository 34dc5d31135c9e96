package ai.docsite.plaintext.format;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InlineCollectorTest {

    @Test
    void flattensBreaksAndKeepsLabels() {
        InlineCollector collector = new InlineCollector();

        collector.write("a");
        collector.lineBreak();
        collector.write("b");
        collector.paragraphBreak();
        collector.paragraphBreak();
        collector.indent("1.");
        collector.write("c");
        collector.dedent();

        assertThat(collector.text()).isEqualTo("a b 1. c ");
    }

    @Test
    void foldsWhitespaceInWrittenText() {
        InlineCollector collector = new InlineCollector();

        collector.write("Section\n  title");

        assertThat(collector.text()).isEqualTo("Section title");
    }

    @Test
    void headingsCollapseToText() {
        InlineCollector collector = new InlineCollector();

        collector.writeHeading(2, "  Heading ");

        assertThat(collector.text()).isEqualTo("Heading ");
    }
}
