package ai.docsite.plaintext.math;

/**
 * An interpreted macro argument; {@code optional} marks a bracket-delimited argument such as the
 * index in {@code \sqrt[3]{x}}.
 */
public record MacroArgument(String text, boolean optional) {

    public MacroArgument {
        text = text == null ? "" : text;
    }
}
