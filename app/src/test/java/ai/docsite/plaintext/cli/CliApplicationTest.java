package ai.docsite.plaintext.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.plaintext.config.Config;
import ai.docsite.plaintext.config.ConfigLoader;
import ai.docsite.plaintext.config.LogFormat;
import ai.docsite.plaintext.convert.BundleConverter;
import ai.docsite.plaintext.convert.ConversionException;
import ai.docsite.plaintext.convert.FailureKind;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CliApplicationTest {

    private static final Config CONFIG = new Config(Path.of("bundle.zip"), Optional.empty(), Optional.empty(),
            75, 2, false, false, Optional.empty(), false, LogFormat.TEXT);

    @Test
    void runCompletesWithSuccessWhenConversionSucceeds() {
        RecordingBundleConverter converter = new RecordingBundleConverter(null);
        CliApplication application = new CliApplication(new FixedConfigLoader(), converter);

        int exitCode = application.run(new String[] {"bundle.zip"});

        assertThat(exitCode).isZero();
        assertThat(converter.invocationCount).isEqualTo(1);
    }

    @Test
    void mapsConversionFailuresToExitCodes() {
        for (FailureKind kind : FailureKind.values()) {
            CliApplication application = new CliApplication(new FixedConfigLoader(),
                    new RecordingBundleConverter(new ConversionException(kind, "boom")));

            assertThat(application.run(new String[] {"bundle.zip"})).isEqualTo(kind.exitCode());
        }
    }

    @Test
    void unexpectedFailuresExitWithOne() {
        CliApplication application = new CliApplication(new FixedConfigLoader(),
                new RecordingBundleConverter(new IllegalStateException("bug")));

        assertThat(application.run(new String[] {"bundle.zip"})).isEqualTo(1);
    }

    @Test
    void invalidArgumentsDoNotStartConversion() {
        RecordingBundleConverter converter = new RecordingBundleConverter(null);
        CliApplication application = new CliApplication(new FixedConfigLoader(), converter);

        int exitCode = application.run(new String[] {"--columns", "many"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(converter.invocationCount).isZero();
    }

    @Test
    void missingBundleIsReportedAsUsageError() {
        RecordingBundleConverter converter = new RecordingBundleConverter(null);
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()), converter);

        assertThat(application.run(new String[0])).isEqualTo(2);
        assertThat(converter.invocationCount).isZero();
    }

    @Test
    void helpExitsWithoutConversion() {
        RecordingBundleConverter converter = new RecordingBundleConverter(null);

        int exitCode = new CliApplication(new FixedConfigLoader(), converter).run(new String[] {"--help"});

        assertThat(exitCode).isZero();
        assertThat(converter.invocationCount).isZero();
    }

    private static final class RecordingBundleConverter extends BundleConverter {
        private final RuntimeException failure;
        private int invocationCount;

        RecordingBundleConverter(RuntimeException failure) {
            this.failure = failure;
        }

        @Override
        public void convert(Config config) {
            invocationCount++;
            if (failure != null) {
                throw failure;
            }
        }
    }

    private static final class FixedConfigLoader extends ConfigLoader {

        FixedConfigLoader() {
            super(key -> Optional.empty());
        }

        @Override
        public Config load(CliArguments arguments) {
            return CONFIG;
        }
    }
}
