package io.probeflow.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.probeflow.core.config.RouterConfig;
import io.probeflow.core.model.PolicyExpression;
import io.probeflow.core.model.Selector;
import io.probeflow.core.model.TagSet;
import io.probeflow.core.spi.ProbeListener;
import io.probeflow.core.spi.ProbeListener.RecordDispatchedEvent;
import io.probeflow.core.spi.ProbeListener.SinkAddedEvent;
import io.probeflow.core.testkit.CapturingProbeListener;
import io.probeflow.core.testkit.CollectingSink;
import io.probeflow.core.testkit.TestRecords;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Verifies that a registered {@link ProbeListener} receives routing lifecycle
 * events, and that a misbehaving listener cannot disturb routing.
 */
@DisplayName("ProbeListenerTest")
class ProbeListenerTest {

    @Test
    @DisplayName("Sink add/remove and dispatch produce events")
    void lifecycleEvents() throws InterruptedException {
        CapturingProbeListener listener = new CapturingProbeListener();
        try (ProbeRouter router = new ProbeRouter(RouterConfig.DEFAULT, listener)) {
            router.addSink("s", new CollectingSink(), PolicyExpression.first());
            router.subscribe(Selector.of("a"), "s");
            router.subscribe(Selector.of("b"), "s");

            router.emit(TestRecords.tagged("a", "b"));
            router.awaitDrained(Duration.ofSeconds(5));
            router.removeSink("s");

            assertThat(listener.added).singleElement().satisfies(e -> {
                assertThat(e.sinkName()).isEqualTo("s");
                assertThat(e.policy()).isEqualTo("first");
                assertThat(e.generation()).isPositive();
            });
            assertThat(listener.dispatched)
                    .containsExactly(new RecordDispatchedEvent(TagSet.of("a", "b"), 2, 1));
            assertThat(listener.removed).singleElement().satisfies(e -> assertThat(e.removedSubscriptions())
                    .isEqualTo(2));
        }
    }

    @Test
    void noDispatchEventWithoutMatch() {
        CapturingProbeListener listener = new CapturingProbeListener();
        try (ProbeRouter router = new ProbeRouter(RouterConfig.DEFAULT, listener)) {
            router.addSink("s", new CollectingSink());
            router.subscribe(Selector.of("a"), "s");

            router.emit(TestRecords.tagged("z"));

            assertThat(listener.dispatched).isEmpty();
        }
    }

    @Test
    @DisplayName("A throwing listener does not affect routing")
    void throwingListenerIsContained() throws InterruptedException {
        ProbeListener listener = mock(ProbeListener.class);
        doThrow(new RuntimeException("listener bug")).when(listener).onSinkAdded(any());
        doThrow(new RuntimeException("listener bug")).when(listener).onRecordDispatched(any());
        CollectingSink sink = new CollectingSink();

        try (ProbeRouter router = new ProbeRouter(RouterConfig.DEFAULT, listener)) {
            router.addSink("s", sink);
            router.subscribe(Selector.of("a"), "s");

            assertThat(router.emit(TestRecords.tagged("a"))).isTrue();
            assertThat(router.awaitDrained(Duration.ofSeconds(5))).isTrue();
        }

        assertThat(sink.size()).isEqualTo(1);
        verify(listener).onSinkAdded(any(SinkAddedEvent.class));
        verify(listener).onRecordDispatched(any(RecordDispatchedEvent.class));
        verify(listener, never()).onTransformFailed(any());
    }
}
