package com.surveylauncher.backend.global.config;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 권한 평가, 할당 만료, 캐시 TTL 판단이 모두 같은 UTC 시계를 보도록 공용 {@link Clock}을 제공한다.
 * 테스트에서는 고정 시계로 교체한다.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock authorizationClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
