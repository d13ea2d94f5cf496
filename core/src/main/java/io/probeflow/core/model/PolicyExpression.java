package io.probeflow.core.model;

import io.probeflow.core.spi.DedupPolicy;
import java.util.Locale;
import java.util.Objects;

/**
 * How a sink's dedup policy is specified at registration time. The router
 * resolves the expression to a {@link DedupPolicy} once, when the sink is
 * added or its policy swapped.
 *
 * <p>
 * Sealed hierarchy: a built-in policy, a policy registered by name in the
 * router's policy registry, or a policy function passed by value.
 */
public sealed interface PolicyExpression {

    /** Short label for logs and snapshots. */
    String label();

    /** The {@code all} policy. */
    static PolicyExpression all() {
        return new Builtin(BuiltinPolicy.ALL);
    }

    /** The {@code unique} policy. */
    static PolicyExpression unique() {
        return new Builtin(BuiltinPolicy.UNIQUE);
    }

    /** The {@code first} policy. */
    static PolicyExpression first() {
        return new Builtin(BuiltinPolicy.FIRST);
    }

    /** A policy looked up by name in the policy registry. */
    static PolicyExpression named(String name) {
        return new Named(name);
    }

    /** A policy function supplied directly. */
    static PolicyExpression custom(String label, DedupPolicy policy) {
        return new Custom(label, policy);
    }

    /**
     * Parses a configuration value: a built-in id ({@code all}, {@code unique},
     * {@code first}) maps to {@link Builtin}; anything else to {@link Named}.
     */
    static PolicyExpression parse(String value) {
        Objects.requireNonNull(value, "policy must not be null");
        String trimmed = value.trim();
        for (BuiltinPolicy builtin : BuiltinPolicy.values()) {
            if (builtin.id().equals(trimmed.toLowerCase(Locale.ROOT))) {
                return new Builtin(builtin);
            }
        }
        return new Named(trimmed);
    }

    // ── Variants ──

    /** One of the built-in policies. */
    record Builtin(BuiltinPolicy policy) implements PolicyExpression {
        public Builtin {
            Objects.requireNonNull(policy, "policy must not be null");
        }

        @Override
        public String label() {
            return policy.id();
        }
    }

    /** A policy registered under {@code name}. */
    record Named(String name) implements PolicyExpression {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("policy name must not be null or blank");
            }
        }

        @Override
        public String label() {
            return name;
        }
    }

    /** A policy function passed by value; {@code label} is used in logs only. */
    record Custom(String label, DedupPolicy policy) implements PolicyExpression {
        public Custom {
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(policy, "policy must not be null");
        }
    }
}
