package io.probeflow.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.probeflow.core.error.UnknownPolicyException;
import io.probeflow.core.model.PolicyExpression;
import io.probeflow.core.spi.DedupPolicy;
import org.junit.jupiter.api.Test;

class PolicyRegistryTest {

    private final PolicyRegistry registry = new PolicyRegistry();

    @Test
    void builtinsArePreRegistered() {
        assertThat(registry.size()).isEqualTo(3);
        assertThat(registry.hasPolicy("all")).isTrue();
        assertThat(registry.hasPolicy("unique")).isTrue();
        assertThat(registry.getPolicy("first")).contains(DedupPolicies.FIRST);
    }

    @Test
    void registerAndResolveNamed() {
        DedupPolicy none = (record, candidates) -> java.util.List.of();
        registry.register("none", none);

        assertThat(registry.resolve(PolicyExpression.named("none"))).isSameAs(none);
        assertThat(registry.resolve(PolicyExpression.parse("none"))).isSameAs(none);
    }

    @Test
    void lastRegistrationWins() {
        DedupPolicy a = (record, candidates) -> candidates;
        DedupPolicy b = (record, candidates) -> candidates;
        registry.register("p", a);
        registry.register("p", b);

        assertThat(registry.getPolicy("p")).contains(b);
    }

    @Test
    void resolvesBuiltinAndCustom() {
        DedupPolicy custom = (record, candidates) -> candidates;

        assertThat(registry.resolve(PolicyExpression.unique())).isSameAs(DedupPolicies.UNIQUE);
        assertThat(registry.resolve(PolicyExpression.custom("c", custom))).isSameAs(custom);
    }

    @Test
    void unknownNameThrows() {
        assertThatThrownBy(() -> registry.resolve(PolicyExpression.named("missing")))
                .isInstanceOf(UnknownPolicyException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void rejectsInvalidRegistrations() {
        assertThatThrownBy(() -> registry.register("x", null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.register(null, DedupPolicies.ALL)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> registry.register(" ", DedupPolicies.ALL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("unique", DedupPolicies.ALL))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("builtin");
    }
}
