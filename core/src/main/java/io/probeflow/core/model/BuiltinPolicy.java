package io.probeflow.core.model;

/**
 * Built-in dedup policies.
 *
 * <ul>
 * <li>{@link #ALL}: forward every transformed record.</li>
 * <li>{@link #UNIQUE}: forward one record per distinct transformed value,
 * keeping the first seen in registration order.</li>
 * <li>{@link #FIRST}: forward only the first transformed record in
 * registration order.</li>
 * </ul>
 */
public enum BuiltinPolicy {
    ALL("all"),
    UNIQUE("unique"),
    FIRST("first");

    private final String id;

    BuiltinPolicy(String id) {
        this.id = id;
    }

    /** Lower-case name under which the policy is registered. */
    public String id() {
        return id;
    }
}
