package com.qualitrack.backend.modules.authorization.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.qualitrack.backend.modules.authorization.domain.ResolvedAccess;
import com.qualitrack.backend.modules.rbac.application.AccessChangeListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Per-user cache of resolved access, bounded in size. An entry lives for the TTL or until the
 * earliest expiry among its grants, whichever comes first. Expiry follows the injected
 * {@link Clock}.
 *
 * <p>Every invalidation bumps a stamp. A resolution that overlapped an invalidation is handed back
 * to its caller but not kept, so a concurrent reader can never re-insert what was just evicted.
 * Invalidations issued inside a transaction are repeated once it completes, since readers may
 * have cached the pre-commit state in between.</p>
 */
@Component
public class PermissionCache implements AccessChangeListener {

    private static final Logger log = LoggerFactory.getLogger(PermissionCache.class);

    private final PermissionResolver permissionResolver;
    private final Clock clock;
    private final Duration ttl;
    private final Cache<Long, ResolvedAccess> entries;
    private final AtomicLong invalidationStamp = new AtomicLong();

    public PermissionCache(
            PermissionResolver permissionResolver,
            Clock clock,
            @Value("${app.access.cache.ttl:PT5M}") Duration ttl,
            @Value("${app.access.cache.max-size:10000}") long maximumSize
    ) {
        this.permissionResolver = permissionResolver;
        this.clock = clock;
        this.ttl = ttl;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new AccessExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                // maintenance on the calling thread, so expired entries are gone when a call returns
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    public Set<String> getOrResolve(Long userId) {
        return getOrResolveAccess(userId).permissions();
    }

    public ResolvedAccess getOrResolveAccess(Long userId) {
        ResolvedAccess cached = entries.getIfPresent(userId);
        if (cached != null) {
            log.debug("Permission cache hit for user {}", userId);
            return cached;
        }

        log.debug("Permission cache miss for user {}", userId);
        long stamp = invalidationStamp.get();
        ResolvedAccess access = permissionResolver.resolveAccess(userId);
        if (invalidationStamp.get() == stamp) {
            entries.put(userId, access);
            if (invalidationStamp.get() != stamp) {
                entries.asMap().remove(userId, access);
            }
        }
        return access;
    }

    public void invalidate(Long userId) {
        evict(userId);
        afterTransaction(() -> evict(userId));
    }

    public void invalidateAll() {
        evictAll();
        afterTransaction(this::evictAll);
    }

    public CacheStats stats() {
        entries.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats counters = entries.stats();
        return new CacheStats(entries.estimatedSize(), counters.hitCount(), counters.missCount(), ttl);
    }

    @Override
    public void grantsChanged(Long userId) {
        invalidate(userId);
    }

    @Override
    public void rolesChanged() {
        invalidateAll();
    }

    private void evict(Long userId) {
        invalidationStamp.incrementAndGet();
        entries.invalidate(userId);
    }

    private void evictAll() {
        invalidationStamp.incrementAndGet();
        entries.invalidateAll();
    }

    private void afterTransaction(Runnable eviction) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                eviction.run();
            }
        });
    }

    public record CacheStats(long size, long hits, long misses, Duration ttl) {
    }

    /**
     * Lifetime of an entry: the TTL, cut short by the earliest grant expiry. Reads do not extend it.
     */
    private final class AccessExpiry implements Expiry<Long, ResolvedAccess> {

        @Override
        public long expireAfterCreate(Long userId, ResolvedAccess access, long currentTime) {
            return lifetimeOf(access);
        }

        @Override
        public long expireAfterUpdate(Long userId, ResolvedAccess access, long currentTime, long currentDuration) {
            return lifetimeOf(access);
        }

        @Override
        public long expireAfterRead(Long userId, ResolvedAccess access, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long lifetimeOf(ResolvedAccess access) {
            if (access.nextExpiry() == null) {
                return ttl.toNanos();
            }
            Duration untilGrantExpiry = Duration.between(OffsetDateTime.now(clock), access.nextExpiry());
            if (untilGrantExpiry.isNegative()) {
                return 0L;
            }
            return untilGrantExpiry.compareTo(ttl) < 0 ? untilGrantExpiry.toNanos() : ttl.toNanos();
        }
    }
}
