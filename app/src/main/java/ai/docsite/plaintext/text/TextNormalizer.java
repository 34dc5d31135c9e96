package ai.docsite.plaintext.text;

import java.util.regex.Pattern;

/**
 * Simplifies raw document text (HTML whitespace semantics) into a form suitable for line layout.
 */
public final class TextNormalizer {

    private static final Pattern CARRIAGE_RETURN = Pattern.compile("\\r\\n?");
    private static final Pattern REPEATED_NEWLINES = Pattern.compile("\\n\\n+");
    private static final Pattern LEADING_NEWLINES = Pattern.compile("^\\n+");
    private static final Pattern TRAILING_NEWLINE = Pattern.compile("\\n$");
    private static final Pattern DOUBLE_QUOTES = Pattern.compile("[\\u201C\\u201D]");
    private static final Pattern SINGLE_QUOTES = Pattern.compile("[\\u2018\\u2019]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String text = CARRIAGE_RETURN.matcher(raw).replaceAll("\n");
        text = REPEATED_NEWLINES.matcher(text).replaceAll("\n");
        text = LEADING_NEWLINES.matcher(text).replaceFirst("");
        text = TRAILING_NEWLINE.matcher(text).replaceFirst("");
        text = DOUBLE_QUOTES.matcher(text).replaceAll("\"");
        return SINGLE_QUOTES.matcher(text).replaceAll("'");
    }

    /**
     * Normalizes and then folds every whitespace run into a single space.
     */
    public static String collapse(String raw) {
        return collapseWhitespace(normalize(raw));
    }

    public static String collapseWhitespace(String text) {
        return WHITESPACE_RUN.matcher(text).replaceAll(" ");
    }
}
