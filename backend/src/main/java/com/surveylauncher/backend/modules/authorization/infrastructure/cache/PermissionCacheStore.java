package com.surveylauncher.backend.modules.authorization.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.CachedPermissions;

/**
 * 사용자별 유효 권한 캐시.
 *
 * <p>모든 구현은 사용자별 단조 증가 version을 유지한다. 계산을 시작하기 전에 읽은 version이
 * 저장 시점까지 유지될 때만 {@link #put}이 반영되고, {@link #get}은 현재 version이 아닌 항목을
 * 돌려주지 않는다. 따라서 {@link #invalidate}가 끝난 뒤에는 이전 데이터가 읽히지 않는다.
 */
public interface PermissionCacheStore {

    /**
     * 만료되지 않았고 현재 version인 항목만 반환한다.
     */
    Optional<CachedPermissions> get(UUID userId);

    long currentVersion(UUID userId);

    /**
     * @return entry.version()이 여전히 현재 값이어서 저장되었으면 true
     */
    boolean put(UUID userId, CachedPermissions entry, Duration ttl);

    void invalidate(UUID userId);

    /**
     * @return 정리된 항목 수
     */
    int cleanupExpired();
}
