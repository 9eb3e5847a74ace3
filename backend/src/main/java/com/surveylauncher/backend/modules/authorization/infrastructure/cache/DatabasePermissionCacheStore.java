package com.surveylauncher.backend.modules.authorization.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.CachedPermissions;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionCacheEntry;
import com.surveylauncher.backend.modules.authorization.infrastructure.persistence.PermissionCacheRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * PostgreSQL permission_cache 테이블 기반 캐시. 같은 DB를 보는 모든 인스턴스가 무효화를 공유한다.
 * 사용자별 행은 지우지 않는다. 정리는 만료된 본문만 비우고 version은 계속 단조 증가한다.
 */
public class DatabasePermissionCacheStore implements PermissionCacheStore {

    private static final Logger log = LoggerFactory.getLogger(DatabasePermissionCacheStore.class);

    private final PermissionCacheRepository repository;
    private final PermissionSnapshotCodec codec;
    private final Duration tombstoneTtl;
    private final Clock clock;

    public DatabasePermissionCacheStore(
            PermissionCacheRepository repository,
            PermissionSnapshotCodec codec,
            Duration tombstoneTtl,
            Clock clock
    ) {
        this.repository = repository;
        this.codec = codec;
        this.tombstoneTtl = tombstoneTtl;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true, propagation = Propagation.REQUIRES_NEW)
    public Optional<CachedPermissions> get(UUID userId) {
        Optional<PermissionCacheEntry> row = repository.findById(userId);
        if (row.isEmpty() || !row.get().hasPayload()) {
            return Optional.empty();
        }
        PermissionCacheEntry entry = row.get();
        if (!entry.getExpiresAt().isAfter(now())) {
            return Optional.empty();
        }
        Optional<EffectivePermissions> snapshot = codec.read(entry.getEffectivePermissions(), EffectivePermissions.class);
        if (snapshot.isEmpty()) {
            log.warn("Discarding unreadable permission cache row for user {}", userId);
            return Optional.empty();
        }
        return Optional.of(new CachedPermissions(
                snapshot.get(),
                entry.getComputedAt().toInstant(),
                entry.getExpiresAt().toInstant(),
                entry.getVersion()
        ));
    }

    @Override
    @Transactional(readOnly = true, propagation = Propagation.REQUIRES_NEW)
    public long currentVersion(UUID userId) {
        return repository.findVersion(userId);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean put(UUID userId, CachedPermissions entry, Duration ttl) {
        int updated = repository.upsertIfVersionCurrent(
                userId,
                codec.write(entry.permissions()),
                entry.computedAt().atOffset(ZoneOffset.UTC),
                entry.expiresAt().atOffset(ZoneOffset.UTC),
                entry.version()
        );
        return updated > 0;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void invalidate(UUID userId) {
        repository.invalidate(userId, now().plus(tombstoneTtl));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int cleanupExpired() {
        return repository.clearExpiredSnapshots(now());
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
