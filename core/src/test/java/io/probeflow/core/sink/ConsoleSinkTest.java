package io.probeflow.core.sink;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.probeflow.core.model.ProbeRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ConsoleSinkTest {

    private Logger consoleLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        consoleLogger = (Logger) LoggerFactory.getLogger(ConsoleSink.DEFAULT_LOGGER);
        appender = new ListAppender<>();
        appender.start();
        consoleLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        consoleLogger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void writesOneJsonLinePerRecord() {
        ConsoleSink sink = new ConsoleSink();

        sink.accept(ProbeRecord.builder().tags("b", "a").put("msg", "hello").build());

        assertThat(appender.list).singleElement().satisfies(e -> {
            assertThat(e.getLevel()).isEqualTo(Level.INFO);
            assertThat(e.getFormattedMessage()).isEqualTo("{\"tags\":[\"a\",\"b\"],\"msg\":\"hello\"}");
        });
        assertThat(sink.loggerName()).isEqualTo(ConsoleSink.DEFAULT_LOGGER);
    }

    @Test
    void messageWithBracesIsNotTreatedAsPattern() {
        new ConsoleSink().accept(ProbeRecord.builder().tags("a").put("msg", "{} {}").build());

        assertThat(appender.list.get(0).getFormattedMessage()).contains("\"{} {}\"");
    }
}
