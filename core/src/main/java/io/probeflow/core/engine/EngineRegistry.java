package io.probeflow.core.engine;

import io.probeflow.core.engine.jslt.JsltExpressionEngine;
import io.probeflow.core.error.ExpressionCompileException;
import io.probeflow.core.model.ExpressionContext;
import io.probeflow.core.spi.CompiledExpression;
import io.probeflow.core.spi.ExpressionEngine;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transform languages available to subscriptions, keyed by language id.
 * Thread-safe.
 */
public final class EngineRegistry {

    private final Map<String, ExpressionEngine> engines = new ConcurrentHashMap<>();

    /** Creates an empty registry. */
    public EngineRegistry() {}

    /** Creates a registry with the built-in {@code jslt} language registered. */
    public static EngineRegistry withDefaults() {
        EngineRegistry registry = new EngineRegistry();
        registry.register(new JsltExpressionEngine());
        return registry;
    }

    /**
     * Registers a transform language, replacing any engine with the same id.
     *
     * @throws IllegalArgumentException if the engine id is null or blank
     */
    public void register(ExpressionEngine engine) {
        Objects.requireNonNull(engine, "engine must not be null");
        String lang = engine.id();
        if (lang == null || lang.isBlank()) {
            throw new IllegalArgumentException("engine id must not be null or blank");
        }
        engines.put(lang, engine);
    }

    public Optional<ExpressionEngine> engine(String lang) {
        return Optional.ofNullable(engines.get(lang));
    }

    /** Registered language ids, sorted. */
    public Set<String> languages() {
        return new TreeSet<>(engines.keySet());
    }

    /**
     * Compiles {@code source} in {@code lang} into a record transform bound to
     * one subscription.
     *
     * @throws ExpressionCompileException if the language is not registered or
     *                                    the expression does not compile
     */
    public ExpressionTransform compile(String lang, String source, ExpressionContext context) {
        Objects.requireNonNull(context, "context must not be null");
        ExpressionEngine engine = engines.get(lang);
        if (engine == null) {
            throw new ExpressionCompileException(
                    "no transform language registered for '" + lang + "', known: " + languages(),
                    null,
                    context.sinkName());
        }
        CompiledExpression compiled = engine.compile(source);
        return new ExpressionTransform(lang, source, compiled, context);
    }
}
