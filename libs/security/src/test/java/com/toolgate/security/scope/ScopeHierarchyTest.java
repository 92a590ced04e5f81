package com.toolgate.security.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScopeHierarchy")
class ScopeHierarchyTest {

    private final ScopeHierarchy standard = ScopeHierarchy.standard();

    @Nested
    @DisplayName("standard table")
    class StandardTable {

        @Test
        @DisplayName("requiring any child accepts its parent")
        void everyChildAcceptsItsParent() {
            for (Scope parent : Scope.values()) {
                for (String child : standard.childrenOf(parent.value())) {
                    assertThat(standard.expand(List.of(child)))
                            .as("expand(%s)", child)
                            .contains(parent.value());
                }
            }
        }

        @Test
        @DisplayName("requiring a parent does not accept its children")
        void implicationIsOneDirectional() {
            assertThat(standard.expand(List.of("repo"))).containsExactly("repo");
            assertThat(standard.expand(List.of("admin:org"))).containsExactly("admin:org");
        }

        @Test
        @DisplayName("read:org is satisfied by write:org and, transitively, admin:org")
        void transitiveParents() {
            assertThat(standard.expand(List.of("read:org")))
                    .containsExactlyInAnyOrder("read:org", "write:org", "admin:org");
        }

        @Test
        @DisplayName("public_repo and security_events are satisfied by repo")
        void repoFamily() {
            assertThat(ScopeExpander.expand("public_repo")).containsExactlyInAnyOrder("public_repo", "repo");
            assertThat(ScopeExpander.expand("security_events"))
                    .containsExactlyInAnyOrder("security_events", "repo");
        }

        @Test
        @DisplayName("scopes outside the table pass through unchanged")
        void unknownScope() {
            assertThat(standard.expand(List.of("gist", "workflow"))).containsExactlyInAnyOrder("gist", "workflow");
        }
    }

    @Test
    @DisplayName("empty input expands to nothing")
    void emptyInput() {
        assertThat(standard.expand(List.of())).isEmpty();
        assertThat(standard.expand(null)).isEmpty();
    }

    @Test
    @DisplayName("expansion is idempotent")
    void idempotent() {
        for (Scope scope : Scope.values()) {
            Set<String> once = standard.expand(List.of(scope.value()));
            assertThat(standard.expand(once)).isEqualTo(once);
        }
    }

    @Test
    @DisplayName("follows chains deeper than one level")
    void deepChains() {
        ScopeHierarchy deep = new ScopeHierarchy(Map.of(
                "a", Set.of("b"),
                "b", Set.of("c"),
                "c", Set.of("d")));

        assertThat(deep.expand(List.of("d"))).containsExactlyInAnyOrder("a", "b", "c", "d");
    }

    @Test
    @DisplayName("rejects tables with cycles")
    void rejectsCycles() {
        assertThatThrownBy(() -> new ScopeHierarchy(Map.of(
                "a", Set.of("b"),
                "b", Set.of("a"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cycle");
    }
}
