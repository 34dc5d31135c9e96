package ai.docsite.plaintext.cli;

import ai.docsite.plaintext.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "docsite-plaintext", mixinStandardHelpOptions = true,
        description = "Renders a wiki collection bundle as fixed-width plain text")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "BUNDLE",
            description = "Bundle zip file or unpacked bundle directory")
    private Path bundle;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output file (standard output when omitted)", paramLabel = "FILE")
    private Path output;

    @CommandLine.Option(names = {"-l", "--lang"}, description = "Collection language overriding the bundle's", paramLabel = "LANG")
    private String language;

    @CommandLine.Option(names = "--columns", description = "Output width in columns", paramLabel = "COLUMNS")
    private Integer columns;

    @CommandLine.Option(names = "--tab-width", description = "Columns per indentation level", paramLabel = "WIDTH")
    private Integer tabWidth;

    @CommandLine.Option(names = "--no-wrap", description = "Write every paragraph on a single line")
    private boolean noWrap;

    @CommandLine.Option(names = "--no-refs", description = "Omit footnote markers and reference lists")
    private boolean noRefs;

    @CommandLine.Option(names = "--tmpdir", description = "Directory for the temporary work space", paramLabel = "DIR")
    private Path tmpdir;

    @CommandLine.Option(names = {"-D", "--debug"}, description = "Verbose logging; keep the work space")
    private boolean debug;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path bundle() {
        return bundle;
    }

    public Path output() {
        return output;
    }

    public String language() {
        return language;
    }

    public Integer columns() {
        return columns;
    }

    public Integer tabWidth() {
        return tabWidth;
    }

    public boolean noWrap() {
        return noWrap;
    }

    public boolean noRefs() {
        return noRefs;
    }

    public Path tmpdir() {
        return tmpdir;
    }

    public boolean debug() {
        return debug;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
