package com.surveylauncher.backend.modules.authorization.domain;

import java.time.Instant;

/**
 * 캐시 백엔드에 저장되는 단위. version은 저장 시점의 사용자별 무효화 버전이다.
 */
public record CachedPermissions(
        EffectivePermissions permissions,
        Instant computedAt,
        Instant expiresAt,
        long version
) {

    public boolean isUsableAt(Instant now) {
        return permissions != null && now.isBefore(expiresAt);
    }
}
