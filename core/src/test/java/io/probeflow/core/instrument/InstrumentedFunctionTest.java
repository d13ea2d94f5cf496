package io.probeflow.core.instrument;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.probeflow.core.engine.ProbeRouter;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.Selector;
import io.probeflow.core.testkit.CollectingSink;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InstrumentedFunctionTest")
class InstrumentedFunctionTest {

    private ProbeRouter router;
    private CollectingSink sink;

    @BeforeEach
    void setUp() {
        router = new ProbeRouter();
        sink = new CollectingSink();
        router.addSink("s", sink);
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    @Test
    @DisplayName("Entry and exit records carry argument, result and elapsed time")
    void entryAndExit() throws InterruptedException {
        router.subscribe(Selector.of("fn", "square"), "s");
        InstrumentedFunction<Integer, Integer> square = InstrumentedFunction.of(router, "square", x -> x * x);

        int result = square.apply(7);
        router.awaitDrained(Duration.ofSeconds(5));

        assertThat(result).isEqualTo(49);
        assertThat(sink.records()).hasSize(2);
        ProbeRecord entry = sink.records().get(0);
        ProbeRecord exit = sink.records().get(1);
        assertThat(entry.tags().contains(ProbeEvents.ENTRY)).isTrue();
        assertThat(entry.get(ProbeEvents.ARGS)).isEqualTo(7);
        assertThat(exit.tags().contains(ProbeEvents.EXIT)).isTrue();
        assertThat(exit.get(ProbeEvents.RESULT)).isEqualTo(49);
        assertThat((Long) exit.get(ProbeEvents.ELAPSED_NANOS)).isGreaterThanOrEqualTo(0L);
        assertThat(exit.get(ProbeEvents.NAME)).isEqualTo("square");
        assertThat(exit.has(ProbeRecord.TS)).isTrue();
    }

    @Test
    void exceptionIsRecordedAndRethrown() throws InterruptedException {
        router.subscribe(Selector.of("fn", "exception"), "s");
        InstrumentedFunction<String, Integer> parse = InstrumentedFunction.of(router, "parse", Integer::parseInt);

        assertThatThrownBy(() -> parse.apply("x")).isInstanceOf(NumberFormatException.class);
        router.awaitDrained(Duration.ofSeconds(5));

        assertThat(sink.records()).singleElement().satisfies(r -> {
            assertThat(r.get(ProbeEvents.NAME)).isEqualTo("parse");
            assertThat((String) r.get(ProbeEvents.ERROR)).contains("NumberFormatException");
        });
    }

    @Test
    @DisplayName("Extra tags are added and unobserved phases emit nothing")
    void extraTagsAndSelectivePhases() throws InterruptedException {
        router.subscribe(Selector.of("billing", "exit"), "s");
        InstrumentedFunction<Integer, Integer> inc =
                new InstrumentedFunction<>(router, "inc", x -> x + 1, "billing");

        inc.apply(1);
        router.awaitDrained(Duration.ofSeconds(5));

        assertThat(sink.records()).singleElement().satisfies(r -> assertThat(r.tags().contains("entry"))
                .isFalse());
    }

    @Test
    void delegateRunsEvenWithoutSubscribers() {
        AtomicInteger calls = new AtomicInteger();
        InstrumentedFunction<Integer, Integer> fn = InstrumentedFunction.of(router, "quiet", x -> {
            calls.incrementAndGet();
            return x;
        });

        assertThat(fn.apply(3)).isEqualTo(3);
        assertThat(calls).hasValue(1);
        assertThat(router.metrics().getShortCircuitCount()).isEqualTo(2);
    }
}
