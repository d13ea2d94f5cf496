package io.probeflow.core.config;

import io.probeflow.core.model.BackpressureMode;
import io.probeflow.core.model.PolicyExpression;
import java.util.Objects;

/**
 * Router configuration.
 *
 * <p>
 * All fields have defaults; use {@link #builder()} to override some of them, or
 * {@link ConfigLoader} to read them from YAML with environment overrides.
 *
 * @param queueCapacity     per-sink merge point capacity, in records
 * @param backpressure      full-queue behaviour for new sinks
 * @param shutdownTimeoutMs max wait for sink consumer threads on
 *                          {@code close()}
 * @param defaultPolicy     dedup policy for sinks added without one
 * @param jmxEnabled        register router metrics as a platform MXBean
 * @param instanceName      JMX instance name and consumer thread name prefix
 */
public record RouterConfig(
        int queueCapacity,
        BackpressureMode backpressure,
        int shutdownTimeoutMs,
        PolicyExpression defaultPolicy,
        boolean jmxEnabled,
        String instanceName) {

    /** Default configuration: 1024 records per sink, blocking, 5s shutdown. */
    public static final RouterConfig DEFAULT = builder().build();

    public RouterConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive, got: " + queueCapacity);
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException("shutdownTimeoutMs must not be negative, got: " + shutdownTimeoutMs);
        }
        Objects.requireNonNull(backpressure, "backpressure must not be null");
        Objects.requireNonNull(defaultPolicy, "defaultPolicy must not be null");
        if (instanceName == null || instanceName.isBlank()) {
            throw new IllegalArgumentException("instanceName must not be null or blank");
        }
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link RouterConfig}. */
    public static final class Builder {
        private int queueCapacity = 1024;
        private BackpressureMode backpressure = BackpressureMode.BLOCK;
        private int shutdownTimeoutMs = 5000;
        private PolicyExpression defaultPolicy = PolicyExpression.all();
        private boolean jmxEnabled = false;
        private String instanceName = "default";

        Builder() {}

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder backpressure(BackpressureMode backpressure) {
            this.backpressure = backpressure;
            return this;
        }

        public Builder shutdownTimeoutMs(int shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
            return this;
        }

        public Builder defaultPolicy(PolicyExpression defaultPolicy) {
            this.defaultPolicy = defaultPolicy;
            return this;
        }

        public Builder jmxEnabled(boolean jmxEnabled) {
            this.jmxEnabled = jmxEnabled;
            return this;
        }

        public Builder instanceName(String instanceName) {
            this.instanceName = instanceName;
            return this;
        }

        public RouterConfig build() {
            return new RouterConfig(
                    queueCapacity, backpressure, shutdownTimeoutMs, defaultPolicy, jmxEnabled, instanceName);
        }
    }
}
