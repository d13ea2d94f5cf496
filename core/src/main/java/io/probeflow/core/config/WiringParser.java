package io.probeflow.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.probeflow.core.engine.EngineRegistry;
import io.probeflow.core.engine.ProbeRouter;
import io.probeflow.core.error.ExpressionCompileException;
import io.probeflow.core.error.InvalidSelectorException;
import io.probeflow.core.model.BackpressureMode;
import io.probeflow.core.model.ExpressionContext;
import io.probeflow.core.model.PolicyExpression;
import io.probeflow.core.model.Selector;
import io.probeflow.core.model.SinkInfo;
import io.probeflow.core.model.Subscription;
import io.probeflow.core.sink.ConsoleSink;
import io.probeflow.core.sink.MemorySink;
import io.probeflow.core.spi.RecordTransform;
import io.probeflow.core.spi.SinkAdapter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads declarative sink and subscription wiring from YAML and applies it to a
 * {@link ProbeRouter}.
 *
 * <pre>
 * sinks:
 *   - name: printer
 *     type: console            # console | memory | registered type
 *     policy: unique           # optional, router default otherwise
 *     backpressure: drop-oldest  # optional
 *     queue-capacity: 256      # optional
 *   - name: recent
 *     type: memory
 *     capacity: 100
 * subscriptions:
 *   - selector: [http, error]
 *     sink: printer
 *     transform:               # optional
 *       lang: jslt
 *       expr: '{"msg": .msg, "status": .status}'
 * </pre>
 *
 * <p>
 * The whole document is parsed, every transform compiled and every sink
 * reference checked before the router is touched. A failure while applying
 * removes what was already added, so a rejected file leaves the router as it
 * was, apart from subscriptions it replaced. Sink types
 * beyond {@code console} and {@code memory} can be added with
 * {@link #registerSinkType}.
 */
public final class WiringParser {

    private static final Logger LOG = LoggerFactory.getLogger(WiringParser.class);

    private final EngineRegistry engines;
    private final Map<String, Function<JsonNode, SinkAdapter>> sinkTypes = new ConcurrentHashMap<>();

    public WiringParser() {
        this(EngineRegistry.withDefaults());
    }

    public WiringParser(EngineRegistry engines) {
        this.engines = Objects.requireNonNull(engines, "engines must not be null");
        sinkTypes.put("console", node -> node.hasNonNull("logger")
                ? new ConsoleSink(LoggerFactory.getLogger(node.get("logger").asText()))
                : new ConsoleSink());
        sinkTypes.put("memory", node -> new MemorySink(node.path("capacity").asInt(1000)));
    }

    /**
     * Registers a factory for a sink {@code type}. The factory receives the
     * sink's YAML node.
     */
    public void registerSinkType(String type, Function<JsonNode, SinkAdapter> factory) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        sinkTypes.put(type, factory);
    }

    /**
     * Parses the wiring file and applies it to {@code router}.
     *
     * @throws ConfigLoadException          if the file is missing or malformed
     * @throws ExpressionCompileException   if a transform does not compile
     * @throws io.probeflow.core.error.ProbeRegistrationException if the router
     *         rejects a sink or subscription
     */
    public Wiring apply(Path path, ProbeRouter router) {
        String source = path.toString();
        if (!Files.exists(path)) {
            throw new ConfigLoadException("Wiring file not found: " + path);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = ConfigLoader.YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML wiring: " + source, e);
        }
        return apply(root == null ? ConfigLoader.YAML_MAPPER.createObjectNode() : root, source, router);
    }

    /**
     * Applies an already-parsed wiring document. Sink names and subscription
     * targets are checked against the router before anything is added; if the
     * router still rejects a step, the sinks and subscriptions this call added
     * are removed again before the exception propagates.
     */
    public Wiring apply(JsonNode root, String source, ProbeRouter router) {
        Objects.requireNonNull(router, "router must not be null");
        List<SinkDecl> sinks = parseSinks(root.path("sinks"), source);
        List<SubscriptionDecl> subscriptions = parseSubscriptions(root.path("subscriptions"), source);
        checkReferences(sinks, subscriptions, source, router);

        Map<String, SinkAdapter> adapters = new LinkedHashMap<>();
        List<SinkInfo> added = new ArrayList<>();
        List<Subscription> subscribed = new ArrayList<>();
        List<Subscription> created = new ArrayList<>();
        try {
            for (SinkDecl decl : sinks) {
                SinkInfo info = decl.backpressure == null && decl.queueCapacity == null
                        ? router.addSink(decl.name, decl.adapter, policyOr(decl.policy, router))
                        : router.addSink(
                                decl.name,
                                decl.adapter,
                                policyOr(decl.policy, router),
                                decl.backpressure != null ? decl.backpressure : router.config().backpressure(),
                                decl.queueCapacity != null ? decl.queueCapacity : router.config().queueCapacity());
                adapters.put(decl.name, decl.adapter);
                added.add(info);
            }
            for (SubscriptionDecl decl : subscriptions) {
                boolean existed = router.getSubscription(decl.selector, decl.sink).isPresent();
                Subscription subscription = router.subscribe(decl.selector, decl.sink, decl.transform);
                subscribed.add(subscription);
                if (!existed) {
                    created.add(subscription);
                }
            }
        } catch (RuntimeException e) {
            rollback(added, created, source, router);
            throw e;
        }

        LOG.info("probe.wiring.applied source={} sinks={} subscriptions={}", source, added.size(), subscribed.size());
        return new Wiring(added, subscribed, Collections.unmodifiableMap(adapters));
    }

    // --- Private helpers ---

    private static void checkReferences(
            List<SinkDecl> sinks, List<SubscriptionDecl> subscriptions, String source, ProbeRouter router) {
        Set<String> declared = new HashSet<>();
        for (int i = 0; i < sinks.size(); i++) {
            String name = sinks.get(i).name;
            if (!declared.add(name)) {
                throw new ConfigLoadException(
                        String.format("%s: sinks[%d]: sink '%s' is declared more than once", source, i, name));
            }
            if (router.getSink(name).isPresent()) {
                throw new ConfigLoadException(
                        String.format("%s: sinks[%d]: sink '%s' is already registered", source, i, name));
            }
        }
        for (int i = 0; i < subscriptions.size(); i++) {
            String sink = subscriptions.get(i).sink;
            if (!declared.contains(sink) && router.getSink(sink).isEmpty()) {
                throw new ConfigLoadException(String.format(
                        "%s: subscriptions[%d]: sink '%s' is neither declared nor registered", source, i, sink));
            }
        }
    }

    private static void rollback(List<SinkInfo> added, List<Subscription> created, String source, ProbeRouter router) {
        for (Subscription subscription : created) {
            router.unsubscribe(subscription.selector(), subscription.sinkName());
        }
        for (SinkInfo info : added) {
            router.removeSink(info.name());
        }
        LOG.warn("probe.wiring.rolled_back source={} sinks={} subscriptions={}", source, added.size(), created.size());
    }

    private static PolicyExpression policyOr(PolicyExpression policy, ProbeRouter router) {
        return policy != null ? policy : router.config().defaultPolicy();
    }

    private List<SinkDecl> parseSinks(JsonNode sinksNode, String source) {
        List<SinkDecl> decls = new ArrayList<>();
        if (sinksNode.isMissingNode() || sinksNode.isNull()) {
            return decls;
        }
        if (!sinksNode.isArray()) {
            throw new ConfigLoadException(source + ": 'sinks' must be a list");
        }
        for (int i = 0; i < sinksNode.size(); i++) {
            JsonNode node = sinksNode.get(i);
            String name = requireString(node, "name", source, "sinks", i);
            String type = requireString(node, "type", source, "sinks", i);
            Function<JsonNode, SinkAdapter> factory = sinkTypes.get(type);
            if (factory == null) {
                throw new ConfigLoadException(String.format(
                        "%s: sinks[%d] '%s': unknown sink type '%s'", source, i, name, type));
            }
            PolicyExpression policy =
                    node.hasNonNull("policy") ? PolicyExpression.parse(node.get("policy").asText()) : null;
            BackpressureMode backpressure = null;
            if (node.hasNonNull("backpressure")) {
                try {
                    backpressure = BackpressureMode.parse(node.get("backpressure").asText());
                } catch (IllegalArgumentException e) {
                    throw new ConfigLoadException(
                            String.format("%s: sinks[%d] '%s': %s", source, i, name, e.getMessage()), e);
                }
            }
            Integer queueCapacity =
                    node.hasNonNull("queue-capacity") ? node.get("queue-capacity").asInt() : null;
            SinkAdapter adapter;
            try {
                adapter = factory.apply(node);
            } catch (RuntimeException e) {
                throw new ConfigLoadException(
                        String.format("%s: sinks[%d] '%s': %s", source, i, name, e.getMessage()), e);
            }
            decls.add(new SinkDecl(name, adapter, policy, backpressure, queueCapacity));
        }
        return decls;
    }

    private List<SubscriptionDecl> parseSubscriptions(JsonNode subsNode, String source) {
        List<SubscriptionDecl> decls = new ArrayList<>();
        if (subsNode.isMissingNode() || subsNode.isNull()) {
            return decls;
        }
        if (!subsNode.isArray()) {
            throw new ConfigLoadException(source + ": 'subscriptions' must be a list");
        }
        for (int i = 0; i < subsNode.size(); i++) {
            JsonNode node = subsNode.get(i);
            String sink = requireString(node, "sink", source, "subscriptions", i);
            Selector selector = parseSelector(node.get("selector"), source, i);
            RecordTransform transform = node.hasNonNull("transform")
                    ? compileTransform(node.get("transform"), new ExpressionContext(sink, selector), source, i)
                    : RecordTransform.identity();
            decls.add(new SubscriptionDecl(selector, sink, transform));
        }
        return decls;
    }

    private static Selector parseSelector(JsonNode node, String source, int index) {
        if (node == null || !node.isArray()) {
            throw new ConfigLoadException(
                    String.format("%s: subscriptions[%d]: 'selector' must be a list of tags", source, index));
        }
        List<String> tags = new ArrayList<>();
        for (JsonNode tag : node) {
            tags.add(tag.isTextual() ? tag.asText() : null);
        }
        try {
            return Selector.of(tags);
        } catch (InvalidSelectorException e) {
            throw new ConfigLoadException(
                    String.format("%s: subscriptions[%d]: %s", source, index, e.getMessage()), e);
        }
    }

    private RecordTransform compileTransform(JsonNode node, ExpressionContext context, String source, int index) {
        String lang = node.path("lang").asText("jslt");
        String expr = requireString(node, "expr", source, "subscriptions[" + index + "].transform", -1);
        try {
            return engines.compile(lang, expr, context);
        } catch (ExpressionCompileException e) {
            throw new ExpressionCompileException(
                    String.format("%s: subscriptions[%d]: %s", source, index, e.getMessage()),
                    e.getCause(),
                    context.sinkName());
        }
    }

    private static String requireString(JsonNode node, String field, String source, String section, int index) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            String where = index < 0 ? section : section + "[" + index + "]";
            throw new ConfigLoadException(
                    String.format("%s: %s: missing or empty required field '%s'", source, where, field));
        }
        return value.asText();
    }

    private record SinkDecl(
            String name,
            SinkAdapter adapter,
            PolicyExpression policy,
            BackpressureMode backpressure,
            Integer queueCapacity) {}

    private record SubscriptionDecl(Selector selector, String sink, RecordTransform transform) {}

    /**
     * Result of applying a wiring document.
     *
     * @param sinks         the sinks added, in file order
     * @param subscriptions the subscriptions registered, in file order
     * @param adapters      the adapter instances created, by sink name
     */
    public record Wiring(List<SinkInfo> sinks, List<Subscription> subscriptions, Map<String, SinkAdapter> adapters) {

        /** The adapter created for {@code sinkName}, cast to its concrete type. */
        public <T extends SinkAdapter> T adapter(String sinkName, Class<T> type) {
            return type.cast(adapters.get(sinkName));
        }
    }
}
