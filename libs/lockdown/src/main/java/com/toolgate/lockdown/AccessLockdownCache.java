package com.toolgate.lockdown;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * TTL-bound cache of repository access facts backing the lockdown content policy.
 * <p>
 * Content from a public repository is only treated as safe when the actor can push to it, is the
 * querying identity itself, or the repository is private. Facts are cached per lowercase
 * {@code owner/repo}; each entry remembers every actor already checked against that repository.
 * <p>
 * One lock guards the whole table, including the upstream query, so at most one query is in
 * flight per cache at any time. Query failures propagate and are never cached.
 * <p>
 * Production code shares one instance via {@link #getInstance}; tests construct isolated
 * instances directly.
 */
public class AccessLockdownCache {

    private static final Logger log = LoggerFactory.getLogger(AccessLockdownCache.class);

    private static final Object INSTANCE_LOCK = new Object();
    private static AccessLockdownCache instance;

    private final RepoAccessQuery query;
    private final LockdownOptions options;
    private final Cache<String, Entry> entries;
    private final ReentrantLock lock = new ReentrantLock();

    private long hits;
    private long misses;

    public AccessLockdownCache(RepoAccessQuery query, LockdownOptions options) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        this.options = options == null ? LockdownOptions.defaults() : options;

        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .ticker(this.options.ticker())
                .recordStats();
        if (!this.options.expiryDisabled()) {
            builder.expireAfterWrite(this.options.ttl());
        }
        this.entries = builder.build();
        log.info("Repository access cache '{}' initialised (ttl={})", this.options.cacheName(),
                this.options.expiryDisabled() ? "none" : this.options.ttl());
    }

    /**
     * Returns the process-wide cache, creating it on the first call. Later calls ignore their
     * arguments and return the instance built by the first caller.
     */
    public static AccessLockdownCache getInstance(RepoAccessQuery query, LockdownOptions options) {
        synchronized (INSTANCE_LOCK) {
            if (instance == null) {
                instance = new AccessLockdownCache(query, options);
            }
            return instance;
        }
    }

    static void resetInstance() {
        synchronized (INSTANCE_LOCK) {
            instance = null;
        }
    }

    /**
     * Decides whether content written by {@code actor} in {@code owner/repo} may be shown.
     *
     * @return true for private repositories, for the querying identity itself, and for actors
     *         with push access
     * @throws RepoAccessQueryException if the facts are not cached and the upstream query fails
     */
    public boolean isSafeContent(String actor, String owner, String repo) {
        RepoAccessInfo info = accessInfo(actor, owner, repo);
        return info.isPrivate()
                || actor.equals(info.viewerLogin())
                || info.hasPushAccess();
    }

    /**
     * Returns the access facts for the actor on the repository, querying upstream only when the
     * actor has not been seen for this repository within the TTL.
     */
    public RepoAccessInfo accessInfo(String actor, String owner, String repo) {
        Objects.requireNonNull(actor, "actor must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(repo, "repo must not be null");

        String key = cacheKey(owner, repo);
        String actorKey = actor.toLowerCase(Locale.ROOT);

        lock.lock();
        try {
            Entry entry = entries.getIfPresent(key);
            if (entry != null) {
                Boolean cachedPush = entry.knownActors.get(actorKey);
                if (cachedPush != null) {
                    hits++;
                    log.debug("Repository access cache hit for {} (actor {})", key, actor);
                    return new RepoAccessInfo(entry.isPrivate, cachedPush, entry.viewerLogin);
                }
                log.debug("Known-actor miss for {} (actor {})", key, actor);
            } else {
                log.debug("Repository access cache miss for {} (actor {})", key, actor);
            }
            misses++;

            RepoAccessInfo fetched = query.query(actor, owner, repo);
            Entry updated = entry == null ? new Entry() : entry;
            updated.isPrivate = fetched.isPrivate();
            updated.viewerLogin = fetched.viewerLogin();
            updated.knownActors.put(actorKey, fetched.hasPushAccess());
            // re-put so expireAfterWrite restarts for the merged entry
            entries.put(key, updated);
            return new RepoAccessInfo(updated.isPrivate, fetched.hasPushAccess(), updated.viewerLogin);
        } finally {
            lock.unlock();
        }
    }

    public AccessCacheStats stats() {
        lock.lock();
        try {
            entries.cleanUp();
            return new AccessCacheStats(hits, misses, entries.stats().evictionCount());
        } finally {
            lock.unlock();
        }
    }

    public LockdownOptions options() {
        return options;
    }

    static String cacheKey(String owner, String repo) {
        return owner.toLowerCase(Locale.ROOT) + "/" + repo.toLowerCase(Locale.ROOT);
    }

    /** Mutable; only touched while {@link #lock} is held. */
    private static final class Entry {
        private boolean isPrivate;
        private String viewerLogin;
        private final Map<String, Boolean> knownActors = new HashMap<>();
    }
}
