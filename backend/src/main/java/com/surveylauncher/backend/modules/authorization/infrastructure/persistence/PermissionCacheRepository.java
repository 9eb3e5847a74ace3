package com.surveylauncher.backend.modules.authorization.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.PermissionCacheEntry;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PermissionCacheRepository extends JpaRepository<PermissionCacheEntry, UUID> {

    @Query(value = "select coalesce((select version from permission_cache where user_id = :userId), 0)",
            nativeQuery = true)
    long findVersion(@Param("userId") UUID userId);

    /**
     * 계산 시작 시점의 version이 아직 현재 값일 때만 스냅샷을 기록한다.
     * 행이 없으면 version 0 기준으로만 삽입된다.
     */
    @Modifying
    @Query(value = """
            insert into permission_cache (user_id, effective_permissions, computed_at, expires_at, version)
            select :userId, :payload, :computedAt, :expiresAt, :version
             where :version = 0
                or exists (select 1 from permission_cache pc where pc.user_id = :userId and pc.version = :version)
            on conflict (user_id) do update
               set effective_permissions = excluded.effective_permissions,
                   computed_at = excluded.computed_at,
                   expires_at = excluded.expires_at
             where permission_cache.version = excluded.version
            """, nativeQuery = true)
    int upsertIfVersionCurrent(
            @Param("userId") UUID userId,
            @Param("payload") String payload,
            @Param("computedAt") OffsetDateTime computedAt,
            @Param("expiresAt") OffsetDateTime expiresAt,
            @Param("version") long version
    );

    /**
     * 스냅샷을 비우고 version을 올린다.
     */
    @Modifying
    @Query(value = """
            insert into permission_cache (user_id, effective_permissions, computed_at, expires_at, version)
            values (:userId, null, null, :expiresAt, 1)
            on conflict (user_id) do update
               set effective_permissions = null,
                   computed_at = null,
                   expires_at = excluded.expires_at,
                   version = permission_cache.version + 1
            """, nativeQuery = true)
    int invalidate(@Param("userId") UUID userId, @Param("expiresAt") OffsetDateTime expiresAt);

    /**
     * 만료된 스냅샷 본문만 비운다. 행과 version은 남겨서 정리 뒤에도 version이 0으로 돌아가지 않는다.
     */
    @Modifying
    @Query(value = """
            update permission_cache
               set effective_permissions = null,
                   computed_at = null
             where expires_at < :now
               and effective_permissions is not null
            """, nativeQuery = true)
    int clearExpiredSnapshots(@Param("now") OffsetDateTime now);
}
