package io.probeflow.core.engine;

import io.probeflow.core.error.UnknownPolicyException;
import io.probeflow.core.model.BuiltinPolicy;
import io.probeflow.core.model.PolicyExpression;
import io.probeflow.core.spi.DedupPolicy;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of dedup policies addressable by name. The built-in policies are
 * registered under {@code all}, {@code unique} and {@code first} on
 * construction. Thread-safe: registration and lookup can happen
 * concurrently.
 */
public final class PolicyRegistry {

    private final Map<String, DedupPolicy> policies = new ConcurrentHashMap<>();

    public PolicyRegistry() {
        for (BuiltinPolicy builtin : BuiltinPolicy.values()) {
            policies.put(builtin.id(), DedupPolicies.of(builtin));
        }
    }

    /**
     * Registers a policy under a name. If a policy with the same name is already
     * registered, it is replaced (last-write-wins semantics). Sinks that already
     * resolved the old policy keep it until their policy is swapped.
     *
     * @param name   the policy name
     * @param policy the policy function
     * @throws NullPointerException     if policy or name is null
     * @throws IllegalArgumentException if name is blank or names a built-in
     */
    public void register(String name, DedupPolicy policy) {
        if (policy == null) {
            throw new NullPointerException("policy must not be null");
        }
        if (name == null) {
            throw new NullPointerException("policy name must not be null");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("policy name must not be blank");
        }
        for (BuiltinPolicy builtin : BuiltinPolicy.values()) {
            if (builtin.id().equals(name)) {
                throw new IllegalArgumentException("'" + name + "' is a builtin policy and cannot be replaced");
            }
        }
        policies.put(name, policy);
    }

    /**
     * Looks up a policy by name.
     *
     * @param name the policy name (e.g. "unique")
     * @return the policy, or empty if not registered
     */
    public Optional<DedupPolicy> getPolicy(String name) {
        return Optional.ofNullable(policies.get(name));
    }

    /**
     * Resolves a policy expression to the callable the router will run.
     *
     * @param expression the expression to resolve
     * @return the resolved policy
     * @throws UnknownPolicyException if a named policy is not registered
     */
    public DedupPolicy resolve(PolicyExpression expression) {
        if (expression instanceof PolicyExpression.Builtin) {
            return DedupPolicies.of(((PolicyExpression.Builtin) expression).policy());
        }
        if (expression instanceof PolicyExpression.Custom) {
            return ((PolicyExpression.Custom) expression).policy();
        }
        String name = ((PolicyExpression.Named) expression).name();
        return getPolicy(name)
                .orElseThrow(() -> new UnknownPolicyException("No dedup policy registered for name: '" + name + "'", null));
    }

    /** Returns the number of registered policies, built-ins included. */
    public int size() {
        return policies.size();
    }

    /** Returns {@code true} if a policy with the given name is registered. */
    public boolean hasPolicy(String name) {
        return policies.containsKey(name);
    }
}
