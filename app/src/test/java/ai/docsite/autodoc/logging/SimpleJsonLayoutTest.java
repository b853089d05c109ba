package ai.docsite.autodoc.logging;

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
        String json = layout().doLayout(event("hello \"world\""));

        assertThat(json).contains("\"message\":\"hello \\\"world\\\"\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void promotesTaskCorrelationKeys() {
        LoggingEvent event = event("phase started");
        event.setMDCPropertyMap(Map.of(
                TaskLogger.MDC_TASK_ID, "task-7",
                TaskLogger.MDC_ACTION, "update",
                TaskLogger.MDC_PHASE, "publish",
                "requestId", "r-1"));

        String json = layout().doLayout(event);

        assertThat(json).contains("\"taskId\":\"task-7\",\"action\":\"update\",\"phase\":\"publish\"");
        assertThat(json).contains("\"mdc\":{\"requestId\":\"r-1\"}");
    }

    @Test
    void includesExceptionSummary() {
        LoggingEvent event = event("failed");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("engine down")));

        assertThat(layout().doLayout(event)).contains("\"exception\":\"java.lang.IllegalStateException: engine down\"");
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
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
