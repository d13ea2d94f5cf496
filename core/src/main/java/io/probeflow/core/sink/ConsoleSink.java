package io.probeflow.core.sink;

import io.probeflow.core.engine.RecordJson;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.spi.SinkAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders each record as a single JSON line through an SLF4J logger at INFO.
 * Where the line ends up (console, file) is up to the logging backend.
 */
public final class ConsoleSink implements SinkAdapter {

    /** Logger name used when none is given. */
    public static final String DEFAULT_LOGGER = "probeflow.console";

    private final Logger logger;

    public ConsoleSink() {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER));
    }

    public ConsoleSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public void accept(ProbeRecord record) {
        if (logger.isInfoEnabled()) {
            logger.info(RecordJson.toJsonString(record));
        }
    }

    public String loggerName() {
        return logger.getName();
    }
}
