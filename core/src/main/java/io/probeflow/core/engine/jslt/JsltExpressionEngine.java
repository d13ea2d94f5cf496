package io.probeflow.core.engine.jslt;

import com.fasterxml.jackson.databind.JsonNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.probeflow.core.error.ExpressionCompileException;
import io.probeflow.core.error.ExpressionEvalException;
import io.probeflow.core.model.ExpressionContext;
import io.probeflow.core.spi.CompiledExpression;
import io.probeflow.core.spi.ExpressionEngine;
import java.util.HashMap;
import java.util.Map;

/**
 * JSLT expression engine, backed by the Schibsted JSLT library.
 *
 * <p>
 * The subscription context is injected as the external variables
 * {@code $sink} (sink name) and {@code $selector} (sorted selector tags).
 */
public final class JsltExpressionEngine implements ExpressionEngine {

    /** Engine identifier used in the wiring file {@code lang:} field. */
    public static final String ENGINE_ID = "jslt";

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionCompileException("JSLT expression must not be empty", null, null);
        }
        try {
            return new JsltCompiledExpression(Parser.compileString(expression));
        } catch (JsltException e) {
            throw new ExpressionCompileException("Failed to compile JSLT expression: " + e.getMessage(), e, null);
        }
    }

    private static final class JsltCompiledExpression implements CompiledExpression {

        private final Expression jsltExpression;

        JsltCompiledExpression(Expression jsltExpression) {
            this.jsltExpression = jsltExpression;
        }

        @Override
        public JsonNode evaluate(JsonNode input, ExpressionContext context) {
            try {
                Map<String, JsonNode> variables = new HashMap<>();
                variables.put("sink", context.sinkAsJson());
                variables.put("selector", context.selectorAsJson());
                return jsltExpression.apply(variables, input);
            } catch (JsltException e) {
                throw new ExpressionEvalException("JSLT evaluation failed: " + e.getMessage(), e);
            }
        }
    }
}
