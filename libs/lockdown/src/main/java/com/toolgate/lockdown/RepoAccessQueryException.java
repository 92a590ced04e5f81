package com.toolgate.lockdown;

/**
 * The upstream could not supply repository access facts.
 * <p>
 * Never absorbed by the cache: a content-safety decision must not guess on failure.
 */
public class RepoAccessQueryException extends RuntimeException {

    private final String repository;

    public RepoAccessQueryException(String repository, String message) {
        super("failed to query repository access info for %s: %s".formatted(repository, message));
        this.repository = repository;
    }

    public RepoAccessQueryException(String repository, String message, Throwable cause) {
        super("failed to query repository access info for %s: %s".formatted(repository, message), cause);
        this.repository = repository;
    }

    /** The {@code owner/repo} being queried. */
    public String repository() {
        return repository;
    }
}
