package com.surveylauncher.backend.modules.authorization.infrastructure.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.CachedPermissions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis 기반 공유 캐시. 스냅샷 키와 version 키를 분리하고, 비교 후 저장/삭제 후 증가를
 * Lua 스크립트로 원자적으로 수행한다. 만료는 Redis TTL에 맡긴다.
 */
public class RedisPermissionCacheStore implements PermissionCacheStore {

    private static final Logger log = LoggerFactory.getLogger(RedisPermissionCacheStore.class);

    private static final RedisScript<Long> PUT_IF_VERSION_CURRENT = new DefaultRedisScript<>("""
            local current = redis.call('GET', KEYS[2]) or '0'
            if current ~= ARGV[1] then
              return 0
            end
            redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
            return 1
            """, Long.class);

    private static final RedisScript<Long> INVALIDATE = new DefaultRedisScript<>("""
            redis.call('DEL', KEYS[1])
            return redis.call('INCR', KEYS[2])
            """, Long.class);

    private final StringRedisTemplate redisTemplate;
    private final PermissionSnapshotCodec codec;
    private final String keyPrefix;
    private final Clock clock;

    public RedisPermissionCacheStore(
            StringRedisTemplate redisTemplate,
            PermissionSnapshotCodec codec,
            String keyPrefix,
            Clock clock
    ) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
    }

    @Override
    public Optional<CachedPermissions> get(UUID userId) {
        String payload = redisTemplate.opsForValue().get(entryKey(userId));
        if (payload == null) {
            return Optional.empty();
        }
        Optional<CachedPermissions> entry = codec.read(payload, CachedPermissions.class);
        if (entry.isEmpty()) {
            log.warn("Evicting unreadable permission cache entry for user {}", userId);
            redisTemplate.delete(entryKey(userId));
            return Optional.empty();
        }
        CachedPermissions cached = entry.get();
        if (cached.version() != currentVersion(userId) || !cached.isUsableAt(clock.instant())) {
            return Optional.empty();
        }
        return entry;
    }

    @Override
    public long currentVersion(UUID userId) {
        String raw = redisTemplate.opsForValue().get(versionKey(userId));
        if (raw == null) {
            return 0L;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            // 숫자가 아니면 어떤 저장도 통과하지 못하도록 음수 version으로 본다
            log.warn("Corrupt permission cache version for user {}: {}", userId, raw);
            return -1L;
        }
    }

    @Override
    public boolean put(UUID userId, CachedPermissions entry, Duration ttl) {
        if (entry.version() < 0) {
            return false;
        }
        Long stored = redisTemplate.execute(
                PUT_IF_VERSION_CURRENT,
                List.of(entryKey(userId), versionKey(userId)),
                Long.toString(entry.version()),
                codec.write(entry),
                Long.toString(ttl.toMillis())
        );
        return stored != null && stored > 0;
    }

    @Override
    public void invalidate(UUID userId) {
        redisTemplate.execute(INVALIDATE, List.of(entryKey(userId), versionKey(userId)));
    }

    @Override
    public int cleanupExpired() {
        return 0;
    }

    String entryKey(UUID userId) {
        return keyPrefix + userId;
    }

    String versionKey(UUID userId) {
        return keyPrefix + "version:" + userId;
    }
}
