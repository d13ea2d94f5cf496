package io.probeflow.core.instrument;

/** Tags and field keys shared by the instrumentation adapters. */
public final class ProbeEvents {

    /** Tag carried by every record of an instrumented function. */
    public static final String FN = "fn";
    /** Phase tag: function entered. */
    public static final String ENTRY = "entry";
    /** Phase tag: function returned normally. */
    public static final String EXIT = "exit";
    /** Phase tag: function threw. */
    public static final String EXCEPTION = "exception";

    /** Tag carried by every record of a watched cell. */
    public static final String WATCH = "watch";

    public static final String NAME = "name";
    public static final String ARGS = "args";
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    public static final String ELAPSED_NANOS = "elapsedNanos";
    public static final String OLD = "old";
    public static final String NEW = "new";

    private ProbeEvents() {}
}
