package com.toolgate.lockdown;

/**
 * Upstream lookup behind {@link AccessLockdownCache}.
 */
@FunctionalInterface
public interface RepoAccessQuery {

    /**
     * @param actor login whose push access is checked
     * @param owner repository owner
     * @param repo  repository name
     * @throws RepoAccessQueryException if the upstream cannot answer
     */
    RepoAccessInfo query(String actor, String owner, String repo);
}
