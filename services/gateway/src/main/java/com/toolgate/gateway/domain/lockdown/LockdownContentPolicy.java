package com.toolgate.gateway.domain.lockdown;

import com.toolgate.gateway.domain.pipeline.RequestContext;
import com.toolgate.gateway.domain.request.ParsedRequest;
import com.toolgate.lockdown.AccessLockdownCache;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hides content written by untrusted authors on public repositories when the request asked for
 * lockdown mode.
 *
 * <p>The repository comes from the {@code owner} and {@code repo} arguments of the parsed call.
 * Upstream failures from the access cache propagate to the caller.
 */
public class LockdownContentPolicy {

    private static final Logger log = LoggerFactory.getLogger(LockdownContentPolicy.class);

    private final AccessLockdownCache cache;

    public LockdownContentPolicy(AccessLockdownCache cache) {
        this.cache = cache;
    }

    /**
     * @param context the forwarded request context
     * @param author  login of the content's author
     * @throws IllegalArgumentException in lockdown mode, when the call carries no owner or repo
     */
    public boolean isVisible(RequestContext context, String author) {
        if (!context.requestConfig().lockdown()) {
            return true;
        }
        ParsedRequest parsed = context.parsedRequest()
                .filter(ParsedRequest::hasRepositoryHints)
                .orElseThrow(() -> new IllegalArgumentException("lockdown mode requires owner and repo arguments"));
        boolean safe = cache.isSafeContent(author, parsed.ownerHint(), parsed.resourceHint());
        if (!safe) {
            log.debug("Hiding content by {} in {}/{}", author, parsed.ownerHint(), parsed.resourceHint());
        }
        return safe;
    }

    /**
     * Keeps the items whose author passes {@link #isVisible}. Order is preserved.
     */
    public <T> List<T> filterVisible(RequestContext context, List<T> items, Function<T, String> authorOf) {
        if (!context.requestConfig().lockdown()) {
            return items;
        }
        return items.stream().filter(item -> isVisible(context, authorOf.apply(item))).toList();
    }
}
