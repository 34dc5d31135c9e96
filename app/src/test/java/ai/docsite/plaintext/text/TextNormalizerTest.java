package ai.docsite.plaintext.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextNormalizerTest {

    @Test
    void foldsLineEndingsAndBlankLines() {
        assertThat(TextNormalizer.normalize("\r\n\none\r\rtwo\n\n\nthree\n"))
                .isEqualTo("one\ntwo\nthree");
    }

    @Test
    void replacesTypographicQuotes() {
        assertThat(TextNormalizer.normalize("“quoted” and ‘single’"))
                .isEqualTo("\"quoted\" and 'single'");
    }

    @Test
    void isIdempotent() {
        String once = TextNormalizer.normalize("\n\n  a\r\n\r\nb “c”\n");

        assertThat(TextNormalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    void collapseFoldsWhitespaceRuns() {
        assertThat(TextNormalizer.collapse("  a\t\tb\n\nc  ")).isEqualTo(" a b c ");
    }

    @Test
    void keepsNonBreakingSpaces() {
        assertThat(TextNormalizer.collapseWhitespace("10 km  away")).isEqualTo("10 km away");
    }

    @Test
    void handlesNullAndEmpty() {
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize("")).isEmpty();
    }
}
