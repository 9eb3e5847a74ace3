package com.surveylauncher.backend.modules.authorization.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.surveylauncher.backend.global.config.AuthorizationProperties;
import com.surveylauncher.backend.modules.authorization.domain.CachedPermissions;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.infrastructure.cache.PermissionCacheStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 캐시를 거쳐 사용자 유효 권한을 제공한다.
 *
 * <p>같은 사용자에 대한 동시 미스는 하나의 계산으로 합쳐진다. 캐시 백엔드 오류는 경고만 남기고
 * 캐시 없이 계산 결과를 돌려준다. 저장소 오류는 호출 측으로 전파된다.
 */
@Service
public class EffectivePermissionService {

    private static final Logger log = LoggerFactory.getLogger(EffectivePermissionService.class);

    private final EffectivePermissionCalculator calculator;
    private final PermissionCacheStore cacheStore;
    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentMap<UUID, CompletableFuture<EffectivePermissions>> inFlight = new ConcurrentHashMap<>();

    public EffectivePermissionService(
            EffectivePermissionCalculator calculator,
            PermissionCacheStore cacheStore,
            AuthorizationProperties properties,
            Clock clock
    ) {
        this.calculator = calculator;
        this.cacheStore = cacheStore;
        this.ttl = properties.cache().ttl();
        this.clock = clock;
    }

    public ResolvedPermissions resolve(UUID userId) {
        Optional<CachedPermissions> cached = readCache(userId);
        if (cached.isPresent()) {
            return new ResolvedPermissions(cached.get().permissions(), true);
        }
        return new ResolvedPermissions(computeShared(userId), false);
    }

    /**
     * 캐시를 읽지 않고 다시 계산한다. 좁히지 않은 결과는 bypassCache가 false일 때 캐시에 기록된다.
     */
    public EffectivePermissions compute(UUID userId, AssignmentFilter filter, boolean bypassCache) {
        AssignmentFilter effectiveFilter = filter == null ? AssignmentFilter.none() : filter;
        if (effectiveFilter.narrows() || bypassCache) {
            return calculator.calculate(userId, effectiveFilter);
        }
        return computeAndStore(userId);
    }

    public void invalidate(UUID userId) {
        inFlight.remove(userId);
        cacheStore.invalidate(userId);
        log.info("Invalidated permission cache for user {}", userId);
    }

    public int cleanupExpired() {
        return cacheStore.cleanupExpired();
    }

    private EffectivePermissions computeShared(UUID userId) {
        CompletableFuture<EffectivePermissions> mine = new CompletableFuture<>();
        CompletableFuture<EffectivePermissions> existing = inFlight.putIfAbsent(userId, mine);
        if (existing != null) {
            return await(existing);
        }
        try {
            EffectivePermissions permissions = computeAndStore(userId);
            mine.complete(permissions);
            return permissions;
        } catch (RuntimeException ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(userId, mine);
        }
    }

    private EffectivePermissions computeAndStore(UUID userId) {
        long version = readVersion(userId);
        EffectivePermissions permissions = calculator.calculate(userId, AssignmentFilter.none());
        if (version < 0) {
            return permissions;
        }
        Instant now = clock.instant();
        CachedPermissions entry = new CachedPermissions(permissions, permissions.computedAt(), now.plus(ttl), version);
        try {
            if (!cacheStore.put(userId, entry, ttl)) {
                log.debug("Skipped caching permissions for user {}: invalidated during computation", userId);
            }
        } catch (RuntimeException ex) {
            log.warn("Permission cache write failed for user {}: {}", userId, ex.getMessage());
        }
        return permissions;
    }

    private Optional<CachedPermissions> readCache(UUID userId) {
        try {
            return cacheStore.get(userId);
        } catch (RuntimeException ex) {
            log.warn("Permission cache read failed for user {}, computing without cache: {}", userId, ex.getMessage());
            return Optional.empty();
        }
    }

    // 음수는 저장을 건너뛰라는 의미
    private long readVersion(UUID userId) {
        try {
            return cacheStore.currentVersion(userId);
        } catch (RuntimeException ex) {
            log.warn("Permission cache version lookup failed for user {}: {}", userId, ex.getMessage());
            return -1L;
        }
    }

    private EffectivePermissions await(CompletableFuture<EffectivePermissions> pending) {
        try {
            return pending.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }
}
