package io.probeflow.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TagSetTest")
class TagSetTest {

    @Test
    @DisplayName("Duplicates collapse and order does not matter")
    void duplicatesCollapse() {
        TagSet a = TagSet.of("x", "y", "x");
        TagSet b = TagSet.of(List.of("y", "x"));

        assertThat(a.size()).isEqualTo(2);
        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void emptyFactoriesShareInstance() {
        assertThat(TagSet.of()).isSameAs(TagSet.empty());
        assertThat(TagSet.of(List.of())).isSameAs(TagSet.empty());
        assertThat(TagSet.empty().isEmpty()).isTrue();
    }

    @Test
    void nullTagRejected() {
        assertThatThrownBy(() -> TagSet.of("a", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("union and plus merge without mutating operands")
    void unionAndPlus() {
        TagSet left = TagSet.of("a");
        TagSet right = TagSet.of("b", "c");

        TagSet union = TagSet.union(left, null, right);

        assertThat(union.asSet()).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(left.asSet()).containsExactly("a");
        assertThat(left.plus("z").asSet()).containsExactlyInAnyOrder("a", "z");
        assertThat(union.plus(TagSet.of("a"))).isSameAs(union);
    }

    @Test
    void containsAllIsSubsetInclusion() {
        TagSet tags = TagSet.of("http", "error", "db");

        assertThat(tags.containsAll(TagSet.of("http", "error"))).isTrue();
        assertThat(tags.containsAll(TagSet.of("http", "warn"))).isFalse();
        assertThat(tags.containsAll(TagSet.empty())).isTrue();
        assertThat(tags.contains("db")).isTrue();
    }

    @Test
    void toStringIsSorted() {
        assertThat(TagSet.of("b", "c", "a")).hasToString("#[a, b, c]");
        assertThat(TagSet.of("b", "a").sorted()).containsExactly("a", "b");
    }
}
