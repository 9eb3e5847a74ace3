package com.surveylauncher.backend.modules.authorization.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * database 캐시 백엔드의 사용자별 유효 권한 스냅샷.
 * 무효화 시 payload를 비우고 version만 올린 행(tombstone)이 남는다.
 */
@Entity
@Table(name = "permission_cache")
public class PermissionCacheEntry {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "effective_permissions", columnDefinition = "text")
    private String effectivePermissions;

    @Column(name = "computed_at")
    private OffsetDateTime computedAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "version", nullable = false)
    private long version;

    public UUID getUserId() {
        return userId;
    }

    public String getEffectivePermissions() {
        return effectivePermissions;
    }

    public OffsetDateTime getComputedAt() {
        return computedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public long getVersion() {
        return version;
    }

    public boolean hasPayload() {
        return effectivePermissions != null && computedAt != null;
    }
}
