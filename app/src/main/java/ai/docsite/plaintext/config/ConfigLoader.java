package ai.docsite.plaintext.config;

import ai.docsite.plaintext.cli.CliArguments;
import ai.docsite.plaintext.format.LayoutOptions;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * Command-line values win over the environment.
 */
public class ConfigLoader {

    static final String ENV_BUNDLE = "PLAINTEXT_BUNDLE";
    static final String ENV_LANG = "PLAINTEXT_LANG";
    static final String ENV_COLUMNS = "PLAINTEXT_COLUMNS";
    static final String ENV_TAB_WIDTH = "PLAINTEXT_TAB_WIDTH";
    static final String ENV_NO_WRAP = "PLAINTEXT_NO_WRAP";
    static final String ENV_NO_REFS = "PLAINTEXT_NO_REFS";
    static final String ENV_TMPDIR = "TMPDIR";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path bundle = Optional.ofNullable(arguments.bundle())
                .or(() -> environment(ENV_BUNDLE).map(Path::of))
                .orElseThrow(() -> new IllegalArgumentException("bundle must be provided"));
        Optional<String> language = Optional.ofNullable(arguments.language())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environment(ENV_LANG));
        int columns = resolveInteger(arguments.columns(), ENV_COLUMNS, LayoutOptions.DEFAULT_COLUMNS);
        int tabWidth = resolveInteger(arguments.tabWidth(), ENV_TAB_WIDTH, LayoutOptions.DEFAULT_TAB_WIDTH);
        boolean noWrap = resolveFlag(arguments.noWrap(), ENV_NO_WRAP);
        boolean noRefs = resolveFlag(arguments.noRefs(), ENV_NO_REFS);
        Optional<Path> tmpdir = Optional.ofNullable(arguments.tmpdir())
                .or(() -> environment(ENV_TMPDIR).map(Path::of));

        return new Config(bundle, Optional.ofNullable(arguments.output()), language, columns, tabWidth,
                noWrap, noRefs, tmpdir, arguments.debug(), resolveLogFormat(arguments));
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environment(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveInteger(Integer cliValue, String envKey, int defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environment(envKey)
                .map(String::trim)
                .map(raw -> parseInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private boolean resolveFlag(boolean cliValue, String envKey) {
        if (cliValue) {
            return true;
        }
        return environment(envKey)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private Optional<String> environment(String key) {
        return environmentReader.get(key).filter(ConfigLoader::isNotBlank);
    }

    private static int parseInteger(String raw, String envKey) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
