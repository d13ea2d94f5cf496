package io.probeflow.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.probeflow.core.model.ExpressionContext;

/**
 * An immutable, thread-safe compiled expression handle, produced by
 * {@link ExpressionEngine#compile(String)}. A single instance is shared by
 * every thread that dispatches through its subscription.
 */
public interface CompiledExpression {

    /**
     * Evaluates this expression against the JSON view of a record.
     *
     * @param input   the record as a JSON object
     * @param context the subscription the evaluation runs for
     * @return the output, or a JSON null / missing node to skip the record
     * @throws io.probeflow.core.error.ExpressionEvalException if evaluation
     *         fails at runtime
     */
    JsonNode evaluate(JsonNode input, ExpressionContext context);
}
