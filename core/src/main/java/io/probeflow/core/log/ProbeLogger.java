package io.probeflow.core.log;

import io.probeflow.core.engine.ProbeRouter;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.TagSet;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.event.Level;

/**
 * Leveled logging façade that emits log calls as probes instead of writing
 * them anywhere. Each record is tagged {@code log}, the lowercase level name
 * and the logger namespace, and carries {@code ns}, {@code level},
 * {@code msg} and, for calls with a throwable, {@code error}.
 *
 * <p>
 * A level is enabled iff some subscription could select its records, so
 * routing configuration doubles as log level configuration.
 */
public final class ProbeLogger {

    /** Tag carried by every log record. */
    public static final String LOG_TAG = "log";

    public static final String LEVEL = "level";
    public static final String MSG = "msg";
    public static final String ERROR = "error";

    private final ProbeRouter router;
    private final String ns;
    private final Map<Level, TagSet> tagsByLevel = new EnumMap<>(Level.class);

    public ProbeLogger(ProbeRouter router, String ns) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.ns = Objects.requireNonNull(ns, "ns must not be null");
        for (Level level : Level.values()) {
            tagsByLevel.put(level, TagSet.of(LOG_TAG, levelTag(level), ns));
        }
    }

    public ProbeLogger(ProbeRouter router, Class<?> owner) {
        this(router, owner.getName());
    }

    /** The tag used for {@code level}, e.g. {@code "warn"}. */
    public static String levelTag(Level level) {
        return level.name().toLowerCase(Locale.ROOT);
    }

    public boolean isEnabled(Level level) {
        return router.couldMatch(tagsByLevel.get(level));
    }

    /**
     * Emits a log record.
     *
     * @return {@code true} if the record reached at least one sink
     */
    public boolean log(Level level, String message, Map<String, ?> fields, Throwable error) {
        Objects.requireNonNull(level, "level must not be null");
        TagSet tags = tagsByLevel.get(level);
        return router.emit(tags, () -> {
            ProbeRecord.Builder builder = ProbeRecord.builder()
                    .tags(tags)
                    .ns(ns)
                    .put(LEVEL, levelTag(level))
                    .put(MSG, message)
                    .stamp();
            if (fields != null) {
                builder.putAll(fields);
            }
            if (error != null) {
                builder.put(ERROR, error.toString());
            }
            return builder.build();
        });
    }

    public boolean trace(String message) {
        return log(Level.TRACE, message, null, null);
    }

    public boolean debug(String message) {
        return log(Level.DEBUG, message, null, null);
    }

    public boolean debug(String message, Map<String, ?> fields) {
        return log(Level.DEBUG, message, fields, null);
    }

    public boolean info(String message) {
        return log(Level.INFO, message, null, null);
    }

    public boolean info(String message, Map<String, ?> fields) {
        return log(Level.INFO, message, fields, null);
    }

    public boolean warn(String message) {
        return log(Level.WARN, message, null, null);
    }

    public boolean warn(String message, Throwable error) {
        return log(Level.WARN, message, null, error);
    }

    public boolean error(String message) {
        return log(Level.ERROR, message, null, null);
    }

    public boolean error(String message, Throwable error) {
        return log(Level.ERROR, message, null, error);
    }

    public String ns() {
        return ns;
    }
}
