package io.probeflow.core.engine.jslt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.probeflow.core.engine.ExpressionTransform;
import io.probeflow.core.error.ExpressionCompileException;
import io.probeflow.core.error.ExpressionEvalException;
import io.probeflow.core.model.ExpressionContext;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.Selector;
import io.probeflow.core.model.TagSet;
import io.probeflow.core.spi.CompiledExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JsltExpressionEngineTest")
class JsltExpressionEngineTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ExpressionContext CONTEXT = new ExpressionContext("printer", Selector.of("http", "error"));

    private final JsltExpressionEngine engine = new JsltExpressionEngine();

    private ExpressionTransform transform(String expr) {
        return new ExpressionTransform("jslt", expr, engine.compile(expr), CONTEXT);
    }

    @Test
    void idIsJslt() {
        assertThat(engine.id()).isEqualTo("jslt");
    }

    @Test
    void evaluatesAgainstJson() throws Exception {
        CompiledExpression expr = engine.compile("{\"greeting\": \"hi \" + .name}");

        JsonNode out = expr.evaluate(JSON.readTree("{\"name\":\"ada\"}"), CONTEXT);

        assertThat(out.get("greeting").asText()).isEqualTo("hi ada");
    }

    @Test
    @DisplayName("$sink and $selector expose the subscription to the expression")
    void contextVariables() throws Exception {
        CompiledExpression expr = engine.compile("{\"sink\": $sink, \"sel\": $selector}");

        JsonNode out = expr.evaluate(JSON.readTree("{}"), CONTEXT);

        assertThat(out.get("sink").asText()).isEqualTo("printer");
        assertThat(out.get("sel").toString()).isEqualTo("[\"error\",\"http\"]");
    }

    @Test
    void syntaxErrorFailsCompile() {
        assertThatThrownBy(() -> engine.compile("{\"a\": ")).isInstanceOf(ExpressionCompileException.class);
        assertThatThrownBy(() -> engine.compile("  ")).isInstanceOf(ExpressionCompileException.class);
    }

    @Test
    void runtimeErrorFailsEvaluation() throws Exception {
        CompiledExpression expr = engine.compile("error(\"nope\")");

        assertThatThrownBy(() -> expr.evaluate(JSON.readTree("{}"), CONTEXT))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessageContaining("nope");
    }

    @Test
    @DisplayName("Transform keeps the record's tags when the output has none")
    void transformKeepsTags() {
        ProbeRecord record = ProbeRecord.builder().tags("http", "error").put("status", 503).put("body", "x").build();

        ProbeRecord out = transform("{\"status\": .status}").apply(record);

        assertThat(out.tags()).isEqualTo(TagSet.of("http", "error"));
        assertThat(out.get("status")).isEqualTo(503);
        assertThat(out.has("body")).isFalse();
    }

    @Test
    void transformMayRewriteTags() {
        ProbeRecord record = ProbeRecord.builder().tags("http").build();

        ProbeRecord out = transform("{\"tags\": [\"alert\"] }").apply(record);

        assertThat(out.tags()).isEqualTo(TagSet.of("alert"));
    }

    @Test
    @DisplayName("A null result skips the record")
    void nullResultSkips() {
        ProbeRecord record = ProbeRecord.builder().tags("http").put("status", 200).build();

        assertThat(transform("if (.status >= 500) {\"status\": .status}").apply(record)).isNull();
    }

    @Test
    void nonObjectResultIsAnError() {
        ProbeRecord record = ProbeRecord.builder().tags("http").build();

        assertThatThrownBy(() -> transform("42").apply(record))
                .isInstanceOf(ExpressionEvalException.class)
                .hasMessageContaining("must produce an object");
    }
}
