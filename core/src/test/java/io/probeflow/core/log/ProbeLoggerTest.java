package io.probeflow.core.log;

import static org.assertj.core.api.Assertions.assertThat;

import io.probeflow.core.engine.ProbeRouter;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.Selector;
import io.probeflow.core.model.TagSet;
import io.probeflow.core.testkit.CollectingSink;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

@DisplayName("ProbeLoggerTest")
class ProbeLoggerTest {

    private ProbeRouter router;
    private CollectingSink sink;
    private ProbeLogger log;

    @BeforeEach
    void setUp() {
        router = new ProbeRouter();
        sink = new CollectingSink();
        router.addSink("s", sink);
        log = new ProbeLogger(router, ProbeLoggerTest.class);
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    @Test
    @DisplayName("Subscriptions act as level configuration")
    void levelEnabledBySubscription() {
        router.subscribe(Selector.of("log", "warn"), "s");

        assertThat(log.isEnabled(Level.WARN)).isTrue();
        assertThat(log.isEnabled(Level.INFO)).isFalse();
        assertThat(log.info("ignored")).isFalse();
    }

    @Test
    void recordCarriesLevelMessageAndNamespace() throws InterruptedException {
        router.subscribe(Selector.of("log", "warn"), "s");

        assertThat(log.warn("disk low", new IllegalStateException("97%"))).isTrue();
        router.awaitDrained(Duration.ofSeconds(5));

        ProbeRecord record = sink.records().get(0);
        assertThat(record.tags()).isEqualTo(TagSet.of("log", "warn", ProbeLoggerTest.class.getName()));
        assertThat(record.get(ProbeRecord.NS)).isEqualTo(ProbeLoggerTest.class.getName());
        assertThat(record.get(ProbeLogger.LEVEL)).isEqualTo("warn");
        assertThat(record.get(ProbeLogger.MSG)).isEqualTo("disk low");
        assertThat((String) record.get(ProbeLogger.ERROR)).contains("97%");
    }

    @Test
    void namespaceSubscription() throws InterruptedException {
        router.subscribe(Selector.of(ProbeLoggerTest.class.getName()), "s");

        log.debug("step", Map.of("step", 3));
        log.error("failed");
        router.awaitDrained(Duration.ofSeconds(5));

        assertThat(sink.records()).extracting(r -> r.get(ProbeLogger.LEVEL)).containsExactly("debug", "error");
        assertThat(sink.records().get(0).get("step")).isEqualTo(3);
    }
}
