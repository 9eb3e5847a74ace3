package com.surveylauncher.backend.modules.authorization.infrastructure.cache;

import java.time.Clock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.surveylauncher.backend.global.config.AuthorizationProperties;
import com.surveylauncher.backend.modules.authorization.infrastructure.persistence.PermissionCacheRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * app.authorization.cache.type 값에 따라 캐시 백엔드를 하나만 등록한다.
 */
@Configuration
public class PermissionCacheConfig {

    private static final Logger log = LoggerFactory.getLogger(PermissionCacheConfig.class);

    @Bean
    public PermissionSnapshotCodec permissionSnapshotCodec(ObjectMapper objectMapper) {
        return new PermissionSnapshotCodec(objectMapper);
    }

    @Bean
    public PermissionCacheStore permissionCacheStore(
            AuthorizationProperties properties,
            Clock clock,
            PermissionSnapshotCodec codec,
            ObjectProvider<PermissionCacheRepository> cacheRepository,
            ObjectProvider<StringRedisTemplate> redisTemplate
    ) {
        AuthorizationProperties.Cache cache = properties.cache();
        log.info("Initializing permission cache store: type={}, ttl={}", cache.type(), cache.ttl());

        return switch (cache.type()) {
            case MEMORY -> new InMemoryPermissionCacheStore(cache.ttl(), cache.maxEntries(), clock);
            case DATABASE -> new DatabasePermissionCacheStore(
                    cacheRepository.getObject(), codec, cache.ttl(), clock);
            case REDIS -> new RedisPermissionCacheStore(
                    redisTemplate.getObject(), codec, cache.keyPrefix(), clock);
        };
    }
}
