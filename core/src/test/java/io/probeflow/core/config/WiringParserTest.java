package io.probeflow.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.probeflow.core.engine.ProbeRouter;
import io.probeflow.core.error.ExpressionCompileException;
import io.probeflow.core.error.UnknownPolicyException;
import io.probeflow.core.model.BackpressureMode;
import io.probeflow.core.model.PolicyExpression;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.Selector;
import io.probeflow.core.model.SinkInfo;
import io.probeflow.core.model.SubscriptionKey;
import io.probeflow.core.model.TagSet;
import io.probeflow.core.sink.ConsoleSink;
import io.probeflow.core.sink.MemorySink;
import io.probeflow.core.testkit.CollectingSink;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("WiringParserTest")
class WiringParserTest {

    @TempDir
    Path tempDir;

    private ProbeRouter router;
    private WiringParser parser;

    @BeforeEach
    void setUp() {
        router = new ProbeRouter();
        parser = new WiringParser();
    }

    @AfterEach
    void tearDown() {
        router.close();
    }

    private Path write(String yaml) throws IOException {
        Path path = tempDir.resolve("wiring.yaml");
        Files.writeString(path, yaml);
        return path;
    }

    @Test
    @DisplayName("Wiring with a JSLT transform delivers transformed records")
    void jsltTransformDelivers() throws Exception {
        Path path = write("""
                sinks:
                  - name: errors
                    type: memory
                    capacity: 10
                    policy: unique
                subscriptions:
                  - selector: [http, error]
                    sink: errors
                    transform:
                      lang: jslt
                      expr: '{"status": .status, "via": $sink}'
                """);

        WiringParser.Wiring wiring = parser.apply(path, router);
        router.emit(ProbeRecord.builder().tags("http", "error").put("status", 503).put("body", "...").build());
        router.emit(ProbeRecord.builder().tags("http").put("status", 200).build());
        router.awaitDrained(Duration.ofSeconds(5));

        MemorySink errors = wiring.adapter("errors", MemorySink.class);
        assertThat(errors.snapshot()).singleElement().satisfies(r -> {
            assertThat(r.tags()).isEqualTo(TagSet.of("http", "error"));
            assertThat(r.get("status")).isEqualTo(503);
            assertThat(r.get("via")).isEqualTo("errors");
            assertThat(r.has("body")).isFalse();
        });
        assertThat(router.getSink("errors").orElseThrow().policy()).isEqualTo(PolicyExpression.unique());
    }

    @Test
    void sinkOptionsApplied() throws IOException {
        Path path = write("""
                sinks:
                  - name: console
                    type: console
                    logger: probeflow.test.console
                    backpressure: drop-newest
                    queue-capacity: 8
                subscriptions:
                  - selector: [a]
                    sink: console
                """);

        WiringParser.Wiring wiring = parser.apply(path, router);

        assertThat(wiring.sinks()).singleElement().satisfies(info -> {
            assertThat(info.backpressure()).isEqualTo(BackpressureMode.DROP_NEWEST);
            assertThat(info.policy()).isEqualTo(PolicyExpression.all());
        });
        assertThat(wiring.adapter("console", ConsoleSink.class).loggerName()).isEqualTo("probeflow.test.console");
        assertThat(router.getSubscription(Selector.of("a"), "console")).isPresent();
    }

    @Test
    void subscriptionsMayTargetExistingSinks() throws IOException {
        CollectingSink existing = new CollectingSink();
        router.addSink("existing", existing);
        Path path = write("""
                subscriptions:
                  - selector: [a]
                    sink: existing
                """);

        assertThat(parser.apply(path, router).subscriptions()).hasSize(1);
        assertThatThrownBy(() -> parser.apply(write("""
                        subscriptions:
                          - selector: [a]
                            sink: ghost
                        """), router))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("'ghost'");
    }

    @Test
    @DisplayName("A subscription to an undeclared sink is rejected before any sink is added")
    void undeclaredSinkLeavesRouterUnchanged() throws IOException {
        Path path = write("""
                sinks:
                  - name: recent
                    type: memory
                subscriptions:
                  - selector: [a]
                    sink: typo
                """);

        assertThatThrownBy(() -> parser.apply(path, router))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("subscriptions[0]")
                .hasMessageContaining("'typo'");
        assertThat(router.listSinks()).isEmpty();
        assertThat(router.listSubscriptions()).isEmpty();
    }

    @Test
    @DisplayName("Sink names already registered or declared twice are rejected before any sink is added")
    void duplicateSinkNamesRejectedUpFront() throws IOException {
        router.addSink("taken", new CollectingSink());
        Path clash = write("""
                sinks:
                  - name: fresh
                    type: memory
                  - name: taken
                    type: memory
                """);

        assertThatThrownBy(() -> parser.apply(clash, router))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("sinks[1]")
                .hasMessageContaining("already registered");
        assertThat(router.getSink("fresh")).isEmpty();

        Path twice = write("""
                sinks:
                  - name: dup
                    type: memory
                  - name: dup
                    type: console
                """);

        assertThatThrownBy(() -> parser.apply(twice, router))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("more than once");
        assertThat(router.listSinks()).extracting(SinkInfo::name).containsExactly("taken");
    }

    @Test
    @DisplayName("Sinks added before the router rejects a later one are removed again")
    void routerRejectionRollsBackAddedSinks() throws IOException {
        router.addSink("existing", new CollectingSink());
        router.subscribe(Selector.of("x"), "existing");
        Path path = write("""
                sinks:
                  - name: first
                    type: memory
                  - name: second
                    type: memory
                    policy: not-registered
                subscriptions:
                  - selector: [a]
                    sink: existing
                """);

        assertThatThrownBy(() -> parser.apply(path, router)).isInstanceOf(UnknownPolicyException.class);

        assertThat(router.listSinks()).extracting(SinkInfo::name).containsExactly("existing");
        assertThat(router.listSubscriptions()).containsExactly(new SubscriptionKey(Selector.of("x"), "existing"));
    }

    @Test
    void registeredSinkType() throws IOException {
        CollectingSink custom = new CollectingSink();
        parser.registerSinkType("collect", node -> custom);
        Path path = write("""
                sinks:
                  - name: c
                    type: collect
                """);

        assertThat(parser.apply(path, router).adapters()).containsEntry("c", custom);
    }

    @Test
    @DisplayName("A transform that does not compile leaves the router untouched")
    void compileErrorLeavesRouterUnchanged() throws IOException {
        Path path = write("""
                sinks:
                  - name: s
                    type: memory
                subscriptions:
                  - selector: [a]
                    sink: s
                    transform:
                      expr: '{"a": '
                """);

        assertThatThrownBy(() -> parser.apply(path, router))
                .isInstanceOf(ExpressionCompileException.class)
                .hasMessageContaining("subscriptions[0]")
                .satisfies(e -> assertThat(((ExpressionCompileException) e).sinkName()).isEqualTo("s"));
        assertThat(router.listSinks()).isEmpty();
    }

    @Test
    void structuralErrors() throws IOException {
        Path unknownType = write("""
                sinks:
                  - name: s
                    type: kafka
                """);
        assertThatThrownBy(() -> parser.apply(unknownType, router))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("unknown sink type 'kafka'");

        Path emptySelector = write("""
                subscriptions:
                  - selector: []
                    sink: s
                """);
        assertThatThrownBy(() -> parser.apply(emptySelector, router))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("at least one tag");

        Path unknownLang = write("""
                subscriptions:
                  - selector: [a]
                    sink: s
                    transform:
                      lang: jq
                      expr: .
                """);
        assertThatThrownBy(() -> parser.apply(unknownLang, router))
                .isInstanceOf(ExpressionCompileException.class)
                .hasMessageContaining("subscriptions[0]")
                .hasMessageContaining("'jq'");

        Path missingName = write("""
                sinks:
                  - type: memory
                """);
        assertThatThrownBy(() -> parser.apply(missingName, router))
                .isInstanceOf(ConfigLoadException.class)
                .hasMessageContaining("'name'");
    }
}
