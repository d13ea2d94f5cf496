package io.probeflow.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.probeflow.core.error.ExpressionEvalException;
import io.probeflow.core.model.ExpressionContext;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.spi.CompiledExpression;
import io.probeflow.core.spi.RecordTransform;
import java.util.Objects;

/**
 * {@link RecordTransform} backed by a compiled expression evaluated against
 * the record's JSON view ({@link RecordJson}).
 *
 * <p>
 * A JSON {@code null} or missing result skips the record. An object result
 * becomes the transformed record; if it has no {@code tags} array the input
 * record's tags are kept. Any other result is an evaluation error.
 */
public final class ExpressionTransform implements RecordTransform {

    private final String lang;
    private final String source;
    private final CompiledExpression expression;
    private final ExpressionContext context;

    public ExpressionTransform(String lang, String source, CompiledExpression expression, ExpressionContext context) {
        this.lang = Objects.requireNonNull(lang, "lang must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    @Override
    public ProbeRecord apply(ProbeRecord record) {
        JsonNode output = expression.evaluate(RecordJson.toJson(record), context);
        if (output == null || output.isNull() || output.isMissingNode()) {
            return null;
        }
        if (!output.isObject()) {
            throw new ExpressionEvalException(
                    lang + " transform must produce an object, got " + output.getNodeType() + ": " + output, null);
        }
        try {
            return RecordJson.fromJson(output, record.tags());
        } catch (IllegalArgumentException e) {
            throw new ExpressionEvalException(lang + " transform produced an invalid record: " + e.getMessage(), e);
        }
    }

    public String lang() {
        return lang;
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return lang + "(" + source + ")";
    }
}
