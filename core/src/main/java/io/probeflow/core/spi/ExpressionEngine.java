package io.probeflow.core.spi;

/**
 * Pluggable expression engine SPI. Implementations provide a transform
 * language (JSLT, jq, ...) for declaratively wired subscriptions and are
 * registered with an {@code EngineRegistry}.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe.
 */
public interface ExpressionEngine {

    /**
     * Returns the engine identifier, e.g. {@code "jslt"}. The id selects the
     * engine through the {@code lang} field of a wiring file.
     *
     * @return a non-null, non-empty engine identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Compiles the given expression into an immutable, thread-safe handle.
     *
     * @param expression the expression source
     * @return a compiled expression ready for evaluation
     * @throws io.probeflow.core.error.ExpressionCompileException if the
     *         expression has syntax errors
     */
    CompiledExpression compile(String expression);
}
