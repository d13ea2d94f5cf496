package io.probeflow.core.instrument;

import io.probeflow.core.engine.ProbeRouter;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.TagSet;
import java.util.Objects;
import java.util.function.Function;

/**
 * Wraps a function so that every call emits probes: one tagged
 * {@code entry} with the argument, then one tagged {@code exit} with the
 * result and elapsed time, or {@code exception} with the error. Every record
 * also carries the tags {@code fn} and the function name, plus any extra tags
 * given at construction.
 *
 * <p>
 * Records are only built when a subscription could select them, so an
 * unobserved function pays one index lookup per phase. Exceptions from the
 * delegate are rethrown unchanged.
 */
public final class InstrumentedFunction<T, R> implements Function<T, R> {

    private final ProbeRouter router;
    private final String name;
    private final Function<T, R> delegate;
    private final TagSet entryTags;
    private final TagSet exitTags;
    private final TagSet exceptionTags;

    public InstrumentedFunction(ProbeRouter router, String name, Function<T, R> delegate, String... extraTags) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        TagSet base = TagSet.of(extraTags).plus(ProbeEvents.FN, name);
        this.entryTags = base.plus(ProbeEvents.ENTRY);
        this.exitTags = base.plus(ProbeEvents.EXIT);
        this.exceptionTags = base.plus(ProbeEvents.EXCEPTION);
    }

    public static <T, R> InstrumentedFunction<T, R> of(ProbeRouter router, String name, Function<T, R> delegate) {
        return new InstrumentedFunction<>(router, name, delegate);
    }

    @Override
    public R apply(T argument) {
        router.emit(entryTags, () -> base(entryTags).put(ProbeEvents.ARGS, argument).build());
        long start = System.nanoTime();
        R result;
        try {
            result = delegate.apply(argument);
        } catch (RuntimeException | Error e) {
            long elapsed = System.nanoTime() - start;
            router.emit(exceptionTags, () -> base(exceptionTags)
                    .put(ProbeEvents.ARGS, argument)
                    .put(ProbeEvents.ERROR, e.toString())
                    .put(ProbeEvents.ELAPSED_NANOS, elapsed)
                    .build());
            throw e;
        }
        long elapsed = System.nanoTime() - start;
        router.emit(exitTags, () -> base(exitTags)
                .put(ProbeEvents.ARGS, argument)
                .put(ProbeEvents.RESULT, result)
                .put(ProbeEvents.ELAPSED_NANOS, elapsed)
                .build());
        return result;
    }

    private ProbeRecord.Builder base(TagSet tags) {
        return ProbeRecord.builder().tags(tags).put(ProbeEvents.NAME, name).stamp();
    }

    public String name() {
        return name;
    }
}
