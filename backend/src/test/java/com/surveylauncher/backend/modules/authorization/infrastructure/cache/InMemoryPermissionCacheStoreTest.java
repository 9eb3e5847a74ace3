package com.surveylauncher.backend.modules.authorization.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.CachedPermissions;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryPermissionCacheStoreTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000701");
    private static final Duration TTL = Duration.ofMinutes(15);

    private MutableClock clock;
    private InMemoryPermissionCacheStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        store = new InMemoryPermissionCacheStore(TTL, 100, clock);
    }

    @Test
    @DisplayName("현재 version으로 저장한 항목은 TTL 동안 조회된다")
    void storedEntryIsReturnedUntilExpiry() {
        assertThat(store.put(USER_ID, entry(0), TTL)).isTrue();
        assertThat(store.get(USER_ID)).isPresent();

        clock.advance(TTL);

        assertThat(store.get(USER_ID)).isEmpty();
    }

    @Test
    @DisplayName("무효화는 version을 올리고 이전 version 쓰기를 거부한다")
    void invalidationRejectsStaleWriters() {
        long before = store.currentVersion(USER_ID);
        store.put(USER_ID, entry(before), TTL);

        store.invalidate(USER_ID);

        assertThat(store.get(USER_ID)).isEmpty();
        assertThat(store.currentVersion(USER_ID)).isEqualTo(before + 1);
        assertThat(store.put(USER_ID, entry(before), TTL)).isFalse();
        assertThat(store.put(USER_ID, entry(before + 1), TTL)).isTrue();
        assertThat(store.get(USER_ID)).get().extracting(CachedPermissions::version).isEqualTo(before + 1);
    }

    @Test
    @DisplayName("정리 작업은 만료 항목만 지우고 반복 실행해도 안전하다")
    void cleanupRemovesOnlyExpiredEntries() {
        UUID other = UUID.fromString("00000000-0000-0000-0000-000000000702");
        store.put(USER_ID, entry(0), TTL);
        clock.advance(Duration.ofMinutes(10));
        store.put(other, entry(0), TTL);
        clock.advance(Duration.ofMinutes(6));

        assertThat(store.cleanupExpired()).isEqualTo(1);
        assertThat(store.cleanupExpired()).isZero();
        assertThat(store.get(other)).isPresent();
    }

    @Test
    @DisplayName("접근이 없는 사용자의 version은 TTL 두 배가 지나면 정리된다")
    void idleVersionsAreEvicted() {
        store.invalidate(USER_ID);
        assertThat(store.trackedUsers()).isEqualTo(1);

        clock.advance(TTL);
        assertThat(store.currentVersion(USER_ID)).isEqualTo(1);
        clock.advance(TTL);
        assertThat(store.currentVersion(USER_ID)).isEqualTo(1);

        clock.advance(TTL.multipliedBy(2).plusSeconds(1));

        assertThat(store.trackedUsers()).isZero();
        assertThat(store.currentVersion(USER_ID)).isZero();
    }

    @Test
    @DisplayName("version 보관 중에는 오래된 쓰기가 계속 거부된다")
    void retainedVersionStillGuardsWrites() {
        store.invalidate(USER_ID);
        clock.advance(TTL.plusMinutes(5));

        assertThat(store.put(USER_ID, entry(0), TTL)).isFalse();
        assertThat(store.put(USER_ID, entry(1), TTL)).isTrue();
    }

    private CachedPermissions entry(long version) {
        Instant now = clock.instant();
        return new CachedPermissions(EffectivePermissions.none(USER_ID, now), now, now.plus(TTL), version);
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
