package ai.docsite.plaintext.math;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Macro source ready for interpretation, with any enclosing block environment removed.
 */
public record MathExpression(String body, boolean display) {

    private static final Pattern ENVIRONMENT = Pattern.compile(
            "^\\s*\\\\begin\\s*\\{\\s*(eqnarray|equation|align|gather|falign|multiline|multline|alignat)[*]?\\s*\\}"
                    + "(.*)\\\\end\\s*\\{[^}*]+[*]?\\s*\\}\\s*$",
            Pattern.DOTALL);
    private static final Pattern TABULAR_ENVIRONMENTS = Pattern.compile("array|align|eqnarray");

    public MathExpression {
        Objects.requireNonNull(body, "body");
    }

    /**
     * Unwraps a recognized block environment. Such expressions always render in display mode;
     * otherwise {@code display} is kept as requested by the caller.
     */
    public static MathExpression parse(String source, boolean display) {
        String text = source == null ? "" : source;
        Matcher matcher = ENVIRONMENT.matcher(text);
        if (!matcher.matches()) {
            return new MathExpression(text, display);
        }
        String environment = matcher.group(1).toLowerCase(Locale.ROOT);
        String body = matcher.group(2);
        if (TABULAR_ENVIRONMENTS.matcher(environment).matches()) {
            body = collapseTable(body);
        }
        return new MathExpression(body, true);
    }

    /**
     * Flattens a two-row tabular fragment: the first macro line break becomes a newline and
     * column separators become spaces.
     */
    static String collapseTable(String body) {
        int lineBreak = body.indexOf("\\\\");
        String collapsed = lineBreak < 0
                ? body
                : body.substring(0, lineBreak) + "\n" + body.substring(lineBreak + 2);
        return collapsed.replace('&', ' ');
    }
}
