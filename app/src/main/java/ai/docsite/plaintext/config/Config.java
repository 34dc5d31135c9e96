package ai.docsite.plaintext.config;

import ai.docsite.plaintext.convert.RenderOptions;
import ai.docsite.plaintext.format.LayoutOptions;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path bundle,
        Optional<Path> output,
        Optional<String> language,
        int columns,
        int tabWidth,
        boolean noWrap,
        boolean noRefs,
        Optional<Path> tmpdir,
        boolean debug,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(bundle, "bundle");
        output = output == null ? Optional.empty() : output;
        language = language == null ? Optional.empty() : language.filter(value -> !value.isBlank());
        if (columns <= LayoutOptions.MIN_TEXT_WIDTH) {
            throw new IllegalArgumentException("columns must be greater than " + LayoutOptions.MIN_TEXT_WIDTH);
        }
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tab width must be at least 1");
        }
        tmpdir = tmpdir == null ? Optional.empty() : tmpdir;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    public LayoutOptions layoutOptions() {
        return new LayoutOptions(columns, tabWidth, noWrap);
    }

    public RenderOptions renderOptions() {
        return new RenderOptions(layoutOptions(), noRefs, language);
    }
}
