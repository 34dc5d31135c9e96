package ai.docsite.plaintext.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    private final LoggerContext context = new LoggerContext();

    @Test
    void formatsEventAsJson() {
        String json = layout().doLayout(event("hello \"world\"\n"));

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"hello \\\"world\\\"\\n\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"WARN\"");
        assertThat(json).doesNotContain("exception");
        assertThat(json).endsWith("}" + System.lineSeparator());
    }

    @Test
    void promotesMdcEntriesToFields() {
        LoggingEvent event = event("rendering");
        event.setMDCPropertyMap(Map.of("article", "Ada Lovelace", "level", "spoofed"));

        String json = layout().doLayout(event);

        assertThat(json).contains("\"article\":\"Ada Lovelace\"");
        assertThat(json).contains("\"level\":\"WARN\"").doesNotContain("spoofed");
    }

    @Test
    void includesExceptionSummary() {
        LoggingEvent event = event("failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("broken store")));

        String json = layout().doLayout(event);

        assertThat(json).contains("\"exception\":\"java.lang.IllegalStateException: broken store\"");
    }

    private SimpleJsonLayout layout() {
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.WARN);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
