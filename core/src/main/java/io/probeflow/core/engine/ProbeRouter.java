package io.probeflow.core.engine;

import io.probeflow.core.config.RouterConfig;
import io.probeflow.core.error.DuplicateSinkException;
import io.probeflow.core.error.PolicyFailureException;
import io.probeflow.core.error.SinkAcceptException;
import io.probeflow.core.error.TransformFailureException;
import io.probeflow.core.error.UnknownSinkException;
import io.probeflow.core.model.BackpressureMode;
import io.probeflow.core.model.PolicyExpression;
import io.probeflow.core.model.ProbeRecord;
import io.probeflow.core.model.Routed;
import io.probeflow.core.model.Selector;
import io.probeflow.core.model.SinkInfo;
import io.probeflow.core.model.Subscription;
import io.probeflow.core.model.SubscriptionKey;
import io.probeflow.core.model.TagSet;
import io.probeflow.core.spi.DedupPolicy;
import io.probeflow.core.spi.ProbeListener;
import io.probeflow.core.spi.RecordTransform;
import io.probeflow.core.spi.SinkAdapter;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.management.InstanceAlreadyExistsException;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probe routing engine. Holds the sink and subscription registries and routes
 * every emitted record to the sinks whose subscriptions select it.
 *
 * <p>
 * Emission path: a cheap pre-check against the {@link ActiveTagIndex} using
 * only the call-site tags, then record construction, exact selector matching,
 * per-subscription transforms, the destination sink's dedup policy, and
 * finally the sink's {@link SinkMultiplexer}. {@link #emit} returns as soon
 * as the surviving records are queued; sinks consume them on their own
 * threads.
 *
 * <p>
 * Thread-safe: uses {@link AtomicReference} to hold an immutable
 * {@link RoutingTable} snapshot. Registry mutations are serialized and swap in
 * a whole new table, so a dispatch in flight completes against the snapshot it
 * started with while new dispatches see the new one.
 *
 * <p>
 * Fail-safe: transform, policy, body and sink failures are logged, counted
 * and reported to the {@link ProbeListener}; none of them propagates to the
 * emitting thread. Only registry mutations throw.
 */
public final class ProbeRouter implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProbeRouter.class);

    private final RouterConfig config;
    private final PolicyRegistry policyRegistry;
    private final ProbeListener listener;
    private final RouterMetrics metrics = new RouterMetrics();
    private final AtomicReference<RoutingTable> tableRef = new AtomicReference<>(RoutingTable.empty());
    private final AtomicLong generations = new AtomicLong();
    private final ReentrantLock mutationLock = new ReentrantLock();
    private final SinkMultiplexer.Events multiplexerEvents = new MultiplexerEvents();
    private volatile boolean closed;
    private ObjectName jmxObjectName;

    /** Creates a router with the default configuration and no listener. */
    public ProbeRouter() {
        this(RouterConfig.DEFAULT, new PolicyRegistry(), null);
    }

    /**
     * Creates a router with the given configuration and no listener.
     *
     * @param config router configuration
     */
    public ProbeRouter(RouterConfig config) {
        this(config, new PolicyRegistry(), null);
    }

    /**
     * Creates a router with the given configuration and an optional listener.
     *
     * @param config   router configuration
     * @param listener optional listener for routing events, may be null
     */
    public ProbeRouter(RouterConfig config, ProbeListener listener) {
        this(config, new PolicyRegistry(), listener);
    }

    /**
     * Creates a router with all options.
     *
     * @param config         router configuration
     * @param policyRegistry registry used to resolve named dedup policies
     * @param listener       optional listener for routing events, may be null
     */
    public ProbeRouter(RouterConfig config, PolicyRegistry policyRegistry, ProbeListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.policyRegistry = Objects.requireNonNull(policyRegistry, "policyRegistry must not be null");
        this.listener = listener; // nullable
        // Resolve eagerly so a bad default policy fails at construction.
        policyRegistry.resolve(config.defaultPolicy());
        if (config.jmxEnabled()) {
            registerMBean();
        }
    }

    // --- Sink registry ---

    /**
     * Registers a sink under the router's default dedup policy.
     *
     * @see #addSink(String, SinkAdapter, PolicyExpression)
     */
    public SinkInfo addSink(String name, SinkAdapter adapter) {
        return addSink(name, adapter, config.defaultPolicy());
    }

    /**
     * Registers a sink using the configured queue capacity and backpressure
     * mode.
     *
     * @param name    unique sink name
     * @param adapter the sink's accept function
     * @param policy  the sink's dedup policy
     * @return a snapshot of the new sink
     * @throws DuplicateSinkException if a sink is already registered under
     *                                {@code name}
     * @throws io.probeflow.core.error.UnknownPolicyException if a named policy
     *                                cannot be resolved
     */
    public SinkInfo addSink(String name, SinkAdapter adapter, PolicyExpression policy) {
        return addSink(name, adapter, policy, config.backpressure(), config.queueCapacity());
    }

    /**
     * Registers a sink with an explicit merge point configuration.
     *
     * @param name         unique sink name
     * @param adapter      the sink's accept function
     * @param policy       the sink's dedup policy
     * @param backpressure full-queue behaviour of the sink's merge point
     * @param capacity     merge point capacity, in records
     * @return a snapshot of the new sink
     * @throws DuplicateSinkException if a sink is already registered under
     *                                {@code name}
     * @throws IllegalStateException  if the router is closed
     */
    public SinkInfo addSink(
            String name, SinkAdapter adapter, PolicyExpression policy, BackpressureMode backpressure, int capacity) {
        requireName(name);
        Objects.requireNonNull(adapter, "adapter must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(backpressure, "backpressure must not be null");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        DedupPolicy resolved = policyRegistry.resolve(policy);

        SinkHandle handle;
        mutationLock.lock();
        try {
            requireOpen();
            RoutingTable current = tableRef.get();
            if (current.sink(name) != null) {
                throw new DuplicateSinkException("Sink already registered: '" + name + "'", name);
            }
            long generation = generations.incrementAndGet();
            SinkMultiplexer multiplexer = new SinkMultiplexer(
                    name, generation, adapter, backpressure, capacity, config.instanceName(), multiplexerEvents);
            handle = new SinkHandle(name, generation, adapter, policy, resolved, multiplexer);
            multiplexer.start();
            publish(current.withSink(handle));
        } finally {
            mutationLock.unlock();
        }

        LOG.info(
                "probe.sink.added sink={} generation={} policy={} backpressure={} capacity={}",
                name,
                handle.generation(),
                policy.label(),
                backpressure,
                capacity);
        notifySinkAdded(handle);
        return handle.info();
    }

    /**
     * Removes a sink and every subscription targeting it, then closes its merge
     * point. Records already queued are still delivered; records forwarded by
     * dispatches still in flight are dropped.
     *
     * @param name the sink name
     * @return {@code true} if a sink was removed, {@code false} if none was
     *         registered under {@code name}
     */
    public boolean removeSink(String name) {
        Objects.requireNonNull(name, "name must not be null");
        SinkHandle removed;
        int cascaded;
        mutationLock.lock();
        try {
            RoutingTable current = tableRef.get();
            removed = current.sink(name);
            if (removed == null) {
                return false;
            }
            RoutingTable next = current.withoutSink(name);
            cascaded = current.subscriptionCount() - next.subscriptionCount();
            publish(next);
        } finally {
            mutationLock.unlock();
        }
        removed.multiplexer().close();

        LOG.info(
                "probe.sink.removed sink={} generation={} removed_subscriptions={}",
                name,
                removed.generation(),
                cascaded);
        notifySinkRemoved(removed, cascaded);
        return true;
    }

    /**
     * Atomically replaces a sink's dedup policy. Dispatches that started before
     * the swap complete under the old policy.
     *
     * @param name   the sink name
     * @param policy the new policy
     * @return a snapshot of the updated sink
     * @throws UnknownSinkException if no sink is registered under {@code name}
     * @throws IllegalStateException if the router is closed
     */
    public SinkInfo swapPolicy(String name, PolicyExpression policy) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        DedupPolicy resolved = policyRegistry.resolve(policy);

        SinkHandle updated;
        String previous;
        mutationLock.lock();
        try {
            requireOpen();
            RoutingTable current = tableRef.get();
            SinkHandle handle = current.sink(name);
            if (handle == null) {
                throw new UnknownSinkException("No sink registered under name: '" + name + "'", name);
            }
            previous = handle.policyExpression().label();
            updated = handle.withPolicy(policy, resolved);
            publish(current.withSink(updated));
        } finally {
            mutationLock.unlock();
        }

        LOG.info("probe.sink.policy_swapped sink={} from={} to={}", name, previous, policy.label());
        return updated.info();
    }

    /** Read-only snapshot of the named sink, or empty if not registered. */
    public Optional<SinkInfo> getSink(String name) {
        SinkHandle handle = tableRef.get().sink(name);
        return handle == null ? Optional.empty() : Optional.of(handle.info());
    }

    /** Snapshots of all registered sinks, in registration order. */
    public List<SinkInfo> listSinks() {
        List<SinkInfo> infos = new ArrayList<>();
        for (SinkHandle handle : tableRef.get().sinks()) {
            infos.add(handle.info());
        }
        return Collections.unmodifiableList(infos);
    }

    // --- Subscription registry ---

    /**
     * Subscribes a sink to records matching {@code selector}, without a
     * transform.
     *
     * @see #subscribe(Selector, String, RecordTransform)
     */
    public Subscription subscribe(Selector selector, String sinkName) {
        return subscribe(selector, sinkName, RecordTransform.identity());
    }

    /**
     * Subscribes a sink to records matching {@code selector}. An existing
     * subscription for the same {@code (selector, sinkName)} is replaced,
     * transform included, and keeps its registration slot.
     *
     * @param selector  the required tags
     * @param sinkName  the destination sink
     * @param transform the record transform
     * @return the registered subscription
     * @throws UnknownSinkException if no sink is registered under
     *                              {@code sinkName}
     * @throws IllegalStateException if the router is closed
     */
    public Subscription subscribe(Selector selector, String sinkName, RecordTransform transform) {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(sinkName, "sinkName must not be null");
        Objects.requireNonNull(transform, "transform must not be null");
        Subscription subscription = new Subscription(selector, sinkName, transform);

        boolean replaced;
        mutationLock.lock();
        try {
            requireOpen();
            RoutingTable current = tableRef.get();
            if (current.sink(sinkName) == null) {
                throw new UnknownSinkException(
                        "Cannot subscribe " + selector + ": no sink registered under name '" + sinkName + "'",
                        sinkName);
            }
            replaced = current.subscription(subscription.key()) != null;
            publish(current.withSubscription(subscription));
        } finally {
            mutationLock.unlock();
        }

        LOG.info("probe.subscribed selector={} sink={} replaced={}", selector, sinkName, replaced);
        return subscription;
    }

    /**
     * Removes the subscription for {@code (selector, sinkName)}, if present.
     *
     * @return {@code true} if a subscription was removed
     */
    public boolean unsubscribe(Selector selector, String sinkName) {
        SubscriptionKey key = new SubscriptionKey(selector, sinkName);
        mutationLock.lock();
        try {
            RoutingTable current = tableRef.get();
            RoutingTable next = current.withoutSubscription(key);
            if (next == current) {
                return false;
            }
            publish(next);
        } finally {
            mutationLock.unlock();
        }
        LOG.info("probe.unsubscribed selector={} sink={}", selector, sinkName);
        return true;
    }

    /** Keys of all live subscriptions, in registration order. */
    public List<SubscriptionKey> listSubscriptions() {
        List<SubscriptionKey> keys = new ArrayList<>();
        for (Subscription sub : tableRef.get().subscriptions()) {
            keys.add(sub.key());
        }
        return Collections.unmodifiableList(keys);
    }

    /** The live subscription for {@code (selector, sinkName)}, or empty. */
    public Optional<Subscription> getSubscription(Selector selector, String sinkName) {
        return Optional.ofNullable(tableRef.get().subscription(new SubscriptionKey(selector, sinkName)));
    }

    // --- Emission ---

    /**
     * Emission-side pre-check: could any live subscription select a record
     * carrying at least {@code candidateTags}? Never returns {@code false} when
     * a selector is a subset of {@code candidateTags}.
     */
    public boolean couldMatch(TagSet candidateTags) {
        Objects.requireNonNull(candidateTags, "candidateTags must not be null");
        return tableRef.get().index().couldMatch(candidateTags);
    }

    /**
     * Emits a probe. If no live selector is a subset of {@code candidateTags},
     * returns immediately without calling {@code body}. Otherwise builds the
     * record, merges {@code candidateTags} into its tags, and routes it.
     *
     * <p>
     * The body may return {@code null} to decline emission.
     *
     * @param candidateTags tags known at the call site
     * @param body          builds the record; called at most once
     * @return {@code true} if at least one record was forwarded to a sink
     */
    public boolean emit(TagSet candidateTags, Supplier<ProbeRecord> body) {
        Objects.requireNonNull(candidateTags, "candidateTags must not be null");
        Objects.requireNonNull(body, "body must not be null");
        metrics.recordEmit();

        RoutingTable snapshot = tableRef.get();
        if (!snapshot.index().couldMatch(candidateTags)) {
            metrics.recordShortCircuit();
            return false;
        }

        ProbeRecord built;
        try {
            built = body.get();
        } catch (RuntimeException e) {
            metrics.recordBodyFailure();
            LOG.warn("probe.body.failed tags={} detail={}", candidateTags, e.toString(), e);
            return false;
        }
        if (built == null) {
            return false;
        }
        ProbeRecord record = built.tags().containsAll(candidateTags)
                ? built
                : built.withTags(TagSet.union(candidateTags, built.tags()));
        return dispatch(snapshot, record);
    }

    /**
     * Emits an already-built record, using its own tags for the pre-check.
     *
     * @return {@code true} if at least one record was forwarded to a sink
     */
    public boolean emit(ProbeRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        return emit(record.tags(), () -> record);
    }

    private boolean dispatch(RoutingTable snapshot, ProbeRecord record) {
        List<Subscription> matches = snapshot.index().matching(record.tags());
        if (matches.isEmpty()) {
            return false;
        }

        Map<String, List<Subscription>> bySink = new LinkedHashMap<>();
        for (Subscription sub : matches) {
            bySink.computeIfAbsent(sub.sinkName(), k -> new ArrayList<>()).add(sub);
        }

        int forwarded = 0;
        for (Map.Entry<String, List<Subscription>> entry : bySink.entrySet()) {
            SinkHandle sink = snapshot.sink(entry.getKey());
            if (sink == null) {
                // Cannot happen: removeSink retracts subscriptions in the same snapshot.
                continue;
            }
            List<Routed> candidates = applyTransforms(record, entry.getValue());
            if (candidates.isEmpty()) {
                continue;
            }
            List<Routed> survivors = applyPolicy(sink, record, candidates);
            for (Routed routed : survivors) {
                if (sink.multiplexer().offer(routed.record())) {
                    forwarded++;
                }
            }
        }

        metrics.recordDispatch(forwarded);
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "probe.dispatched tags={} matched={} sinks={} forwarded={}",
                    record.tags(),
                    matches.size(),
                    bySink.size(),
                    forwarded);
        }
        notifyDispatched(record.tags(), matches.size(), forwarded);
        return forwarded > 0;
    }

    private List<Routed> applyTransforms(ProbeRecord record, List<Subscription> subscriptions) {
        List<Routed> candidates = new ArrayList<>(subscriptions.size());
        for (Subscription sub : subscriptions) {
            try {
                ProbeRecord transformed = sub.transform().apply(record);
                if (transformed != null) {
                    candidates.add(new Routed(sub, transformed));
                }
            } catch (RuntimeException e) {
                reportTransformFailure(new TransformFailureException(
                        "Transform of " + sub.key() + " failed: " + e, e, sub.key()));
            }
        }
        return candidates;
    }

    private List<Routed> applyPolicy(SinkHandle sink, ProbeRecord record, List<Routed> candidates) {
        try {
            List<Routed> survivors = sink.policy().select(record, Collections.unmodifiableList(candidates));
            if (survivors == null) {
                throw new IllegalStateException("policy returned null");
            }
            for (Routed routed : survivors) {
                if (routed == null) {
                    throw new IllegalStateException("policy returned a null entry");
                }
            }
            return survivors;
        } catch (RuntimeException e) {
            reportPolicyFailure(
                    sink,
                    new PolicyFailureException(
                            "Dedup policy '" + sink.policyExpression().label() + "' of sink '" + sink.name()
                                    + "' failed: " + e,
                            e,
                            sink.name()));
            return List.of();
        }
    }

    // --- Lifecycle ---

    /**
     * Waits until every sink's merge point is empty and its last record has
     * been handled.
     *
     * @param timeout maximum total wait
     * @return {@code true} if all sinks drained within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (SinkHandle handle : tableRef.get().sinks()) {
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            if (!handle.multiplexer().awaitDrained(remaining)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Removes every sink and waits up to the configured shutdown timeout for
     * their consumer threads to drain and exit. Idempotent.
     */
    @Override
    public void close() {
        List<SinkHandle> handles;
        mutationLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            handles = new ArrayList<>(tableRef.get().sinks());
            publish(RoutingTable.empty());
        } finally {
            mutationLock.unlock();
        }

        for (SinkHandle handle : handles) {
            handle.multiplexer().close();
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.shutdownTimeoutMs());
        for (SinkHandle handle : handles) {
            try {
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                if (!handle.multiplexer().awaitTermination(remaining)) {
                    LOG.warn(
                            "probe.sink.shutdown_timeout sink={} queued={}",
                            handle.name(),
                            handle.multiplexer().queueDepth());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for sink '{}' to drain", handle.name());
                break;
            }
        }
        unregisterMBean();
        LOG.info("probe.router.closed instance={} sinks={}", config.instanceName(), handles.size());
    }

    public boolean isClosed() {
        return closed;
    }

    public RouterMetrics metrics() {
        return metrics;
    }

    public PolicyRegistry policies() {
        return policyRegistry;
    }

    public RouterConfig config() {
        return config;
    }

    // --- Internal ---

    /** Publishes a new snapshot. Caller holds {@link #mutationLock}. */
    private void publish(RoutingTable next) {
        tableRef.set(next);
        metrics.setRegistrySize(next.sinkCount(), next.subscriptionCount());
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("router '" + config.instanceName() + "' is closed");
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("sink name must not be null or blank");
        }
    }

    private void registerMBean() {
        ObjectName name;
        try {
            name = new ObjectName("io.probeflow:type=RouterMetrics,instance=" + config.instanceName());
            ManagementFactory.getPlatformMBeanServer().registerMBean(metrics, name);
        } catch (InstanceAlreadyExistsException e) {
            LOG.warn(
                    "JMX MBean not registered: instance name '{}' is already in use by another router",
                    config.instanceName());
            return;
        } catch (Exception e) {
            LOG.warn("Failed to register JMX MBean: {}", e.getMessage());
            return;
        }
        jmxObjectName = name;
        LOG.info("JMX MBean registered: {}", name);
    }

    private void unregisterMBean() {
        if (jmxObjectName == null) return;
        try {
            MBeanServer mbs = ManagementFactory.getPlatformMBeanServer();
            if (mbs.isRegistered(jmxObjectName)) {
                mbs.unregisterMBean(jmxObjectName);
            }
        } catch (Exception e) {
            LOG.warn("Failed to unregister JMX MBean {}: {}", jmxObjectName, e.getMessage());
        }
        jmxObjectName = null;
    }

    private void reportTransformFailure(TransformFailureException failure) {
        metrics.recordTransformFailure();
        LOG.warn("probe.transform.failed subscription={} detail={}", failure.subscription(), failure.detail());
        if (listener == null) return;
        try {
            listener.onTransformFailed(
                    new ProbeListener.TransformFailedEvent(failure.subscription(), failure.detail()));
        } catch (Exception e) {
            LOG.warn("ProbeListener.onTransformFailed failed", e);
        }
    }

    private void reportPolicyFailure(SinkHandle sink, PolicyFailureException failure) {
        metrics.recordPolicyFailure();
        LOG.warn("probe.policy.failed sink={} policy={} detail={}", sink.name(), sink.policyExpression().label(),
                failure.detail());
        if (listener == null) return;
        try {
            listener.onPolicyFailed(new ProbeListener.PolicyFailedEvent(
                    sink.name(), sink.policyExpression().label(), failure.detail()));
        } catch (Exception e) {
            LOG.warn("ProbeListener.onPolicyFailed failed", e);
        }
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never affect routing.

    private void notifyDispatched(TagSet tags, int matched, int forwarded) {
        if (listener == null) return;
        try {
            listener.onRecordDispatched(new ProbeListener.RecordDispatchedEvent(tags, matched, forwarded));
        } catch (Exception e) {
            LOG.warn("ProbeListener.onRecordDispatched failed", e);
        }
    }

    private void notifySinkAdded(SinkHandle handle) {
        if (listener == null) return;
        try {
            listener.onSinkAdded(new ProbeListener.SinkAddedEvent(
                    handle.name(), handle.generation(), handle.policyExpression().label()));
        } catch (Exception e) {
            LOG.warn("ProbeListener.onSinkAdded failed", e);
        }
    }

    private void notifySinkRemoved(SinkHandle handle, int removedSubscriptions) {
        if (listener == null) return;
        try {
            listener.onSinkRemoved(
                    new ProbeListener.SinkRemovedEvent(handle.name(), handle.generation(), removedSubscriptions));
        } catch (Exception e) {
            LOG.warn("ProbeListener.onSinkRemoved failed", e);
        }
    }

    /** Routes merge point callbacks to metrics, logs and the listener. */
    private final class MultiplexerEvents implements SinkMultiplexer.Events {

        @Override
        public void delivered(String sinkName) {
            metrics.recordDelivered();
        }

        @Override
        public void acceptFailed(SinkAcceptException failure, long generation) {
            metrics.recordSinkAcceptFailure();
            LOG.warn("probe.sink.accept_failed sink={} generation={} detail={}", failure.sinkName(), generation,
                    failure.detail(), failure.getCause());
            if (listener == null) return;
            try {
                listener.onSinkAcceptFailed(new ProbeListener.SinkAcceptFailedEvent(
                        failure.sinkName(), generation, failure.detail()));
            } catch (Exception e) {
                LOG.warn("ProbeListener.onSinkAcceptFailed failed", e);
            }
        }

        @Override
        public void dropped(String sinkName, long generation, ProbeListener.DropReason reason) {
            metrics.recordDropped();
            LOG.debug("probe.record.dropped sink={} generation={} reason={}", sinkName, generation, reason);
            if (listener == null) return;
            try {
                listener.onRecordDropped(new ProbeListener.RecordDroppedEvent(sinkName, generation, reason));
            } catch (Exception e) {
                LOG.warn("ProbeListener.onRecordDropped failed", e);
            }
        }
    }
}
