package com.surveylauncher.backend.global.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 권한 엔진 설정. 값이 비어 있으면 운영 기본값을 사용한다.
 *
 * <pre>
 * app.authorization.cache.type=memory|database|redis
 * app.authorization.cache.ttl=PT15M
 * app.authorization.cache.max-entries=10000
 * app.authorization.cache.cleanup-interval=PT5M
 * app.authorization.cache.key-prefix=authz:permissions:
 * app.authorization.slow-check-threshold=PT0.1S
 * </pre>
 */
@ConfigurationProperties(prefix = "app.authorization")
public record AuthorizationProperties(
        Cache cache,
        Duration slowCheckThreshold
) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(15);

    public AuthorizationProperties {
        if (cache == null) {
            cache = Cache.defaults();
        }
        if (slowCheckThreshold == null || slowCheckThreshold.isNegative()) {
            slowCheckThreshold = Duration.ofMillis(100);
        }
    }

    public static AuthorizationProperties defaults() {
        return new AuthorizationProperties(Cache.defaults(), null);
    }

    public record Cache(
            CacheType type,
            Duration ttl,
            long maxEntries,
            Duration cleanupInterval,
            String keyPrefix
    ) {

        public Cache {
            if (type == null) {
                type = CacheType.MEMORY;
            }
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                ttl = DEFAULT_TTL;
            }
            if (maxEntries <= 0) {
                maxEntries = 10_000;
            }
            if (cleanupInterval == null || cleanupInterval.isZero() || cleanupInterval.isNegative()) {
                cleanupInterval = Duration.ofMinutes(5);
            }
            if (keyPrefix == null || keyPrefix.isBlank()) {
                keyPrefix = "authz:permissions:";
            }
        }

        public static Cache defaults() {
            return new Cache(null, null, 0, null, null);
        }
    }

    public enum CacheType {
        MEMORY,
        DATABASE,
        REDIS
    }
}
