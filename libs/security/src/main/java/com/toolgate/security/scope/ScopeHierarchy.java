package com.toolgate.security.scope;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only implication table between scopes: holding a parent implies holding every child.
 * <p>
 * Implication is one-directional. Requiring a child makes its parents acceptable, but holding a
 * child never satisfies a parent requirement. The table is checked for cycles at construction.
 */
public final class ScopeHierarchy {

    private static final ScopeHierarchy STANDARD = new ScopeHierarchy(Map.of(
            Scope.REPO.value(), Set.of(Scope.PUBLIC_REPO.value(), Scope.SECURITY_EVENTS.value()),
            Scope.ADMIN_ORG.value(), Set.of(Scope.WRITE_ORG.value(), Scope.READ_ORG.value()),
            Scope.WRITE_ORG.value(), Set.of(Scope.READ_ORG.value()),
            Scope.PROJECT.value(), Set.of(Scope.READ_PROJECT.value()),
            Scope.WRITE_PACKAGES.value(), Set.of(Scope.READ_PACKAGES.value()),
            Scope.USER.value(), Set.of(Scope.READ_USER.value(), Scope.USER_EMAIL.value())
    ));

    private final Map<String, Set<String>> children;

    /**
     * @param children parent scope to the set of scopes it implies
     * @throws IllegalArgumentException if the table contains a cycle
     */
    public ScopeHierarchy(Map<String, Set<String>> children) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        children.forEach((parent, kids) -> copy.put(parent, Set.copyOf(kids)));
        this.children = Map.copyOf(copy);
        rejectCycles();
    }

    /** The upstream platform's scope table. */
    public static ScopeHierarchy standard() {
        return STANDARD;
    }

    /** Scopes directly implied by {@code parent}; empty if it has none. */
    public Set<String> childrenOf(String parent) {
        return children.getOrDefault(parent, Set.of());
    }

    /**
     * Returns every scope that satisfies a requirement for any of {@code required}: the required
     * scopes themselves plus, transitively, every parent that implies one of them.
     *
     * @param required the narrow scopes an operation asks for
     * @return accepted scopes, empty when nothing is required
     */
    public Set<String> expand(Collection<String> required) {
        if (required == null || required.isEmpty()) {
            return Set.of();
        }
        Set<String> accepted = new LinkedHashSet<>(required);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Map.Entry<String, Set<String>> entry : children.entrySet()) {
                if (!accepted.contains(entry.getKey())
                        && entry.getValue().stream().anyMatch(accepted::contains)) {
                    accepted.add(entry.getKey());
                    changed = true;
                }
            }
        }
        return Set.copyOf(accepted);
    }

    private void rejectCycles() {
        for (String start : children.keySet()) {
            Deque<String> pending = new ArrayDeque<>(childrenOf(start));
            Set<String> seen = new HashSet<>();
            while (!pending.isEmpty()) {
                String next = pending.pop();
                if (next.equals(start)) {
                    throw new IllegalArgumentException("scope hierarchy contains a cycle through '%s'".formatted(start));
                }
                if (seen.add(next)) {
                    pending.addAll(childrenOf(next));
                }
            }
        }
    }
}
