package com.surveylauncher.backend.global.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 설정과 캐시 설정 범위를 검증한다.
 * 잘못된 값이 있으면 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final Duration MIN_CACHE_TTL = Duration.ofSeconds(30);
    private static final Duration MAX_CACHE_TTL = Duration.ofHours(24);

    private final Environment environment;
    private final AuthorizationProperties properties;

    public EnvironmentValidator(Environment environment, AuthorizationProperties properties) {
        this.environment = environment;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        Optional<String> datasourceUrl = Optional.ofNullable(environment.getProperty("spring.datasource.url"));
        if (datasourceUrl.map(String::trim).orElse("").isEmpty()) {
            problems.add("spring.datasource.url: 권한 저장소 접속 정보가 없습니다");
        }

        AuthorizationProperties.Cache cache = properties.cache();
        if (cache.ttl().compareTo(MIN_CACHE_TTL) < 0 || cache.ttl().compareTo(MAX_CACHE_TTL) > 0) {
            problems.add("app.authorization.cache.ttl: " + MIN_CACHE_TTL + " ~ " + MAX_CACHE_TTL + " 범위여야 합니다");
        }

        if (cache.type() == AuthorizationProperties.CacheType.REDIS) {
            Optional<String> redisHost = Optional.ofNullable(environment.getProperty("spring.data.redis.host"));
            if (redisHost.map(String::trim).orElse("").isEmpty()) {
                problems.add("spring.data.redis.host: redis 캐시 백엔드에는 필수입니다");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed: {}", problem));
            throw new IllegalStateException("Invalid authorization configuration: " + String.join("; ", problems));
        }

        log.info("Authorization engine ready (cacheType={}, ttl={}, cleanupInterval={})",
                cache.type(), cache.ttl(), cache.cleanupInterval());
    }
}
