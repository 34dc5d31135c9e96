package ai.docsite.plaintext.convert;

import ai.docsite.plaintext.bundle.BundleArticleSource;
import ai.docsite.plaintext.bundle.BundleWorkspace;
import ai.docsite.plaintext.bundle.Metabook;
import ai.docsite.plaintext.bundle.SqliteRecordStore;
import ai.docsite.plaintext.config.Config;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a bundle to plain text: prepares a work space, opens the bundle stores and renders the
 * collection to the configured output.
 */
public class BundleConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(BundleConverter.class);
    static final String METABOOK = "metabook.json";
    static final String DOCUMENTS = "parsoid.db";
    static final String SITE_INFO = "siteinfo.db";

    private final OutputStream standardOutput;

    public BundleConverter() {
        this(System.out);
    }

    BundleConverter(OutputStream standardOutput) {
        this.standardOutput = standardOutput;
    }

    public void convert(Config config) {
        StatusReporter status = new StatusReporter(3);
        status.createStage(1, "Preparing");
        try (BundleWorkspace workspace = BundleWorkspace.create(config.bundle(), config.tmpdir().orElse(null), config.debug())) {
            Path bundleDirectory = workspace.bundleDirectory();
            Metabook metabook = Metabook.read(bundleDirectory.resolve(METABOOK));
            LOGGER.debug("Collection '{}' holds {} item(s)", metabook.effectiveTitle(), metabook.countItems() - 1);
            try (SqliteRecordStore documents = SqliteRecordStore.open(bundleDirectory.resolve(DOCUMENTS));
                 SqliteRecordStore siteInfo = SqliteRecordStore.open(bundleDirectory.resolve(SITE_INFO));
                 Writer out = openOutput(config)) {
                Set<String> languages = new CollectionRenderer(config.renderOptions(), status)
                        .render(metabook, new BundleArticleSource(metabook, documents, siteInfo), out);
                LOGGER.debug("Languages used: {}", languages);
            } catch (IOException ex) {
                throw new ConversionException(FailureKind.OUTPUT, "Failed to write output: " + ex.getMessage(), ex);
            }
        }
        status.createStage(0, "Done");
    }

    private Writer openOutput(Config config) {
        if (config.output().isPresent()) {
            Path output = config.output().get();
            try {
                return Files.newBufferedWriter(output, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new ConversionException(FailureKind.OUTPUT, "Cannot open output file " + output, ex);
            }
        }
        // closing the writer must leave the process stream open
        OutputStream unclosable = new FilterOutputStream(standardOutput) {
            @Override
            public void write(byte[] bytes, int offset, int length) throws IOException {
                out.write(bytes, offset, length);
            }

            @Override
            public void close() throws IOException {
                flush();
            }
        };
        return new OutputStreamWriter(unclosable, StandardCharsets.UTF_8);
    }
}
