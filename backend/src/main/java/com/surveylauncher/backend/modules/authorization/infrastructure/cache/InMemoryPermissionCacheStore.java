package com.surveylauncher.backend.modules.authorization.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.surveylauncher.backend.modules.authorization.domain.CachedPermissions;

/**
 * Caffeine 기반 단일 노드 캐시. 다른 인스턴스와 무효화를 공유하지 않는다.
 *
 * <p>같은 사용자에 대한 저장과 무효화는 version 맵의 {@code compute} 안에서 직렬화된다.
 * version은 마지막 접근 뒤 TTL의 두 배 동안 보관한다. 그보다 오래 걸린 계산은 없다고 보고,
 * 그 사이 스냅샷도 모두 만료되므로 version이 0으로 돌아가도 오래된 값이 살아나지 않는다.
 */
public class InMemoryPermissionCacheStore implements PermissionCacheStore {

    private final Cache<UUID, CachedPermissions> cache;
    private final Cache<UUID, Long> versions;
    private final Clock clock;

    public InMemoryPermissionCacheStore(Duration ttl, long maxEntries, Clock clock) {
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .build();
        this.versions = Caffeine.newBuilder()
                .expireAfterAccess(ttl.multipliedBy(2))
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    @Override
    public Optional<CachedPermissions> get(UUID userId) {
        CachedPermissions entry = cache.getIfPresent(userId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.version() != currentVersion(userId) || !entry.isUsableAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public long currentVersion(UUID userId) {
        Long version = versions.getIfPresent(userId);
        return version == null ? 0L : version;
    }

    @Override
    public boolean put(UUID userId, CachedPermissions entry, Duration ttl) {
        AtomicBoolean accepted = new AtomicBoolean(false);
        versions.asMap().compute(userId, (id, current) -> {
            long version = current == null ? 0L : current;
            if (version == entry.version()) {
                cache.put(id, entry);
                accepted.set(true);
            }
            return current;
        });
        return accepted.get();
    }

    @Override
    public void invalidate(UUID userId) {
        versions.asMap().compute(userId, (id, current) -> {
            cache.invalidate(id);
            return (current == null ? 0L : current) + 1;
        });
    }

    @Override
    public int cleanupExpired() {
        Instant now = clock.instant();
        int before = cache.asMap().size();
        cache.asMap().entrySet().removeIf(entry -> !entry.getValue().isUsableAt(now));
        cache.cleanUp();
        versions.cleanUp();
        return Math.max(before - cache.asMap().size(), 0);
    }

    long trackedUsers() {
        versions.cleanUp();
        return versions.estimatedSize();
    }
}
