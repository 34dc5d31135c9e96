package ai.docsite.plaintext.convert;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class StatusReporterTest {

    @Test
    void reportsPercentageAcrossStages() {
        Logger logger = (Logger) LoggerFactory.getLogger(StatusReporter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        StatusReporter reporter = new StatusReporter(2);
        try {
            reporter.createStage(4, "Formatting");
            reporter.report("Formatting article", "Alpha");
            reporter.report("Formatting article", "Beta");
            reporter.createStage(0, "Done");
        } finally {
            logger.detachAppender(appender);
        }

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly(
                        "[0%] Formatting",
                        "[13%] Formatting article: Alpha",
                        "[25%] Formatting article: Beta",
                        "[50%] Done");
        assertThat(reporter.percent()).isEqualTo(50.0);
    }
}
