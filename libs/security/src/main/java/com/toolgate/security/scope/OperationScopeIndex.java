package com.toolgate.security.scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps operation names to their {@link OperationScopeInfo}, built once from the catalogue.
 * <p>
 * Authorization checks use the accepted set, but {@link #missingScopes} always reports the
 * narrow required set so the client is asked for the least privilege that would work.
 * Immutable after {@link #build}; safe to share between request threads.
 */
public final class OperationScopeIndex {

    private static final Logger log = LoggerFactory.getLogger(OperationScopeIndex.class);

    private static final OperationScopeIndex EMPTY = new OperationScopeIndex(Map.of());

    private final Map<String, OperationScopeInfo> byName;

    private OperationScopeIndex(Map<String, OperationScopeInfo> byName) {
        this.byName = Map.copyOf(byName);
    }

    public static OperationScopeIndex empty() {
        return EMPTY;
    }

    /**
     * Builds the index against {@link ScopeHierarchy#standard()}.
     */
    public static OperationScopeIndex build(Collection<OperationDescriptor> operations) {
        return build(operations, ScopeHierarchy.standard());
    }

    /**
     * Builds the index. Operations without required scopes get no entry.
     *
     * @throws IllegalArgumentException if two operations share a name
     */
    public static OperationScopeIndex build(Collection<OperationDescriptor> operations, ScopeHierarchy hierarchy) {
        Map<String, OperationScopeInfo> byName = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (OperationDescriptor operation : operations) {
            if (!seen.add(operation.name())) {
                throw new IllegalArgumentException("duplicate operation '%s' in catalogue".formatted(operation.name()));
            }
            if (operation.requiredScopes().isEmpty()) {
                continue;
            }
            byName.put(operation.name(), new OperationScopeInfo(
                    operation.requiredScopes(), hierarchy.expand(operation.requiredScopes())));
        }
        log.info("Built operation scope index: {} operations, {} scope-gated", seen.size(), byName.size());
        return new OperationScopeIndex(byName);
    }

    /**
     * @return scope info for the operation, or empty when it has no scope requirement
     */
    public Optional<OperationScopeInfo> lookup(String operationName) {
        if (operationName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(operationName));
    }

    /** Number of scope-gated operations. */
    public int size() {
        return byName.size();
    }

    /**
     * Sorted union of all required scopes, advertised by the discovery document.
     */
    public List<String> allRequiredScopes() {
        Set<String> all = new TreeSet<>();
        byName.values().forEach(info -> all.addAll(info.requiredScopes()));
        return List.copyOf(all);
    }

    /**
     * True if {@code info} is absent or empty, or if the actor holds at least one accepted scope.
     */
    public static boolean hasAcceptedScope(OperationScopeInfo info, Collection<String> actorScopes) {
        if (info == null || info.acceptedScopes().isEmpty()) {
            return true;
        }
        if (actorScopes == null) {
            return false;
        }
        for (String scope : actorScopes) {
            if (info.acceptedScopes().contains(scope)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Required scopes the actor still needs, or an empty list if {@link #hasAcceptedScope} holds.
     */
    public static List<String> missingScopes(OperationScopeInfo info, Collection<String> actorScopes) {
        if (hasAcceptedScope(info, actorScopes)) {
            return List.of();
        }
        return info.requiredScopes();
    }
}
