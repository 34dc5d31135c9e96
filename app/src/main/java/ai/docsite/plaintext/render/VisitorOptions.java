package ai.docsite.plaintext.render;

import java.util.Objects;

/**
 * Per-article rendering switches.
 *
 * @param noRefs      suppress footnote markers and footnote lists
 * @param singleItem  the collection holds a single article, whose own title level is taken
 * @param hasChapters the collection is organized in chapters, so article headings keep their level
 * @param language    language of the surrounding collection
 * @param direction   text direction of the surrounding collection
 */
public record VisitorOptions(boolean noRefs, boolean singleItem, boolean hasChapters,
                             String language, Direction direction) {

    public VisitorOptions {
        language = language == null || language.isBlank() ? "en" : language;
        direction = Objects.requireNonNull(direction, "direction");
    }

    public static VisitorOptions forLanguage(String language) {
        return new VisitorOptions(false, false, false, language, LanguageDirectionality.lookup(language));
    }
}
