package io.probeflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Objects;

/**
 * Read-only context for a transform expression: the subscription it belongs
 * to. Exposed to expressions as the {@code $sink} and {@code $selector}
 * variables.
 */
public record ExpressionContext(String sinkName, Selector selector) {

    public ExpressionContext {
        Objects.requireNonNull(sinkName, "sinkName must not be null");
        Objects.requireNonNull(selector, "selector must not be null");
    }

    public static ExpressionContext of(SubscriptionKey key) {
        return new ExpressionContext(key.sinkName(), key.selector());
    }

    public JsonNode sinkAsJson() {
        return TextNode.valueOf(sinkName);
    }

    /** Selector tags as a sorted JSON array. */
    public JsonNode selectorAsJson() {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        selector.tags().sorted().forEach(array::add);
        return array;
    }
}
