package ai.docsite.plaintext.convert;

import ai.docsite.plaintext.format.LayoutOptions;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings applied to every article of a collection.
 *
 * @param layout   page geometry
 * @param noRefs   suppress footnote markers and footnote lists
 * @param language collection language overriding the one declared by the bundle
 */
public record RenderOptions(LayoutOptions layout, boolean noRefs, Optional<String> language) {

    public RenderOptions {
        layout = Objects.requireNonNull(layout, "layout");
        language = language == null ? Optional.empty() : language.filter(value -> !value.isBlank());
    }

    public static RenderOptions defaults() {
        return new RenderOptions(LayoutOptions.defaults(), false, Optional.empty());
    }
}
