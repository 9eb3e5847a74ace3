package com.surveylauncher.backend.modules.authorization.application;

import static com.surveylauncher.backend.support.AuthorizationFixtures.ORG_A;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.surveylauncher.backend.global.config.AuthorizationProperties;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermission;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;
import com.surveylauncher.backend.modules.authorization.domain.ResourceType;
import com.surveylauncher.backend.modules.authorization.infrastructure.cache.InMemoryPermissionCacheStore;
import com.surveylauncher.backend.modules.authorization.infrastructure.cache.PermissionCacheStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EffectivePermissionServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000401");

    @Mock
    private EffectivePermissionCalculator calculator;

    private Clock clock;
    private PermissionCacheStore cacheStore;
    private EffectivePermissionService service;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        cacheStore = new InMemoryPermissionCacheStore(Duration.ofMinutes(15), 100, clock);
        service = new EffectivePermissionService(calculator, cacheStore, AuthorizationProperties.defaults(), clock);
    }

    @Test
    @DisplayName("두 번째 조회는 캐시 적중이며 같은 스냅샷을 돌려준다")
    void secondResolveHitsCache() {
        EffectivePermissions snapshot = snapshot(ResourceType.TEAMS);
        when(calculator.calculate(eq(USER_ID), any())).thenReturn(snapshot);

        ResolvedPermissions first = service.resolve(USER_ID);
        ResolvedPermissions second = service.resolve(USER_ID);

        assertThat(first.cacheHit()).isFalse();
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.permissions()).isEqualTo(first.permissions());
        verify(calculator, times(1)).calculate(eq(USER_ID), any());
    }

    @Test
    @DisplayName("무효화 후에는 다시 계산된 권한이 보인다")
    void invalidationForcesRecompute() {
        when(calculator.calculate(eq(USER_ID), any()))
                .thenReturn(snapshot(ResourceType.TEAMS))
                .thenReturn(snapshot(ResourceType.DEVICES));

        service.resolve(USER_ID);
        service.invalidate(USER_ID);
        ResolvedPermissions afterInvalidate = service.resolve(USER_ID);

        assertThat(afterInvalidate.cacheHit()).isFalse();
        assertThat(afterInvalidate.permissions().permissions())
                .extracting(EffectivePermission::resource)
                .containsExactly(ResourceType.DEVICES);
    }

    @Test
    @DisplayName("계산 도중 무효화되면 결과를 캐시에 남기지 않는다")
    void writeRacingInvalidationIsDiscarded() {
        when(calculator.calculate(eq(USER_ID), any()))
                .thenAnswer(invocation -> {
                    cacheStore.invalidate(USER_ID);
                    return snapshot(ResourceType.TEAMS);
                })
                .thenReturn(snapshot(ResourceType.DEVICES));

        service.resolve(USER_ID);
        ResolvedPermissions next = service.resolve(USER_ID);

        assertThat(next.cacheHit()).isFalse();
        assertThat(next.permissions().permissions())
                .extracting(EffectivePermission::resource)
                .containsExactly(ResourceType.DEVICES);
    }

    @Test
    @DisplayName("조직/팀으로 좁힌 계산은 사용자 캐시에 기록하지 않는다")
    void narrowedComputationIsNotCached() {
        when(calculator.calculate(eq(USER_ID), any())).thenReturn(snapshot(ResourceType.TEAMS));

        service.compute(USER_ID, new AssignmentFilter(ORG_A, null), false);

        assertThat(cacheStore.get(USER_ID)).isEmpty();
    }

    @Test
    @DisplayName("좁히지 않은 계산은 bypassCache가 아니면 캐시에 기록된다")
    void unnarrowedComputationIsCached() {
        when(calculator.calculate(eq(USER_ID), any())).thenReturn(snapshot(ResourceType.TEAMS));

        service.compute(USER_ID, AssignmentFilter.none(), true);
        assertThat(cacheStore.get(USER_ID)).isEmpty();

        service.compute(USER_ID, AssignmentFilter.none(), false);
        assertThat(cacheStore.get(USER_ID)).isPresent();
    }

    @Test
    @DisplayName("캐시 백엔드 오류는 캐시 없이 계산으로 대체된다")
    void cacheFailureDegradesToCompute() {
        PermissionCacheStore failingStore = mock(PermissionCacheStore.class);
        when(failingStore.get(USER_ID)).thenThrow(new IllegalStateException("redis down"));
        when(failingStore.currentVersion(USER_ID)).thenThrow(new IllegalStateException("redis down"));
        EffectivePermissionService degraded = new EffectivePermissionService(
                calculator, failingStore, AuthorizationProperties.defaults(), clock);
        EffectivePermissions snapshot = snapshot(ResourceType.TEAMS);
        when(calculator.calculate(eq(USER_ID), any())).thenReturn(snapshot);

        ResolvedPermissions resolved = degraded.resolve(USER_ID);

        assertThat(resolved.cacheHit()).isFalse();
        assertThat(resolved.permissions()).isEqualTo(snapshot);
    }

    @Test
    @DisplayName("같은 사용자의 동시 미스는 한 번만 계산한다")
    void concurrentMissesShareOneComputation() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        EffectivePermissions snapshot = snapshot(ResourceType.TEAMS);
        when(calculator.calculate(eq(USER_ID), any())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return snapshot;
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ResolvedPermissions> first = executor.submit(() -> service.resolve(USER_ID));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            Future<ResolvedPermissions> second = executor.submit(() -> service.resolve(USER_ID));
            Thread.sleep(100);
            release.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS).permissions()).isEqualTo(snapshot);
            assertThat(second.get(5, TimeUnit.SECONDS).permissions()).isEqualTo(snapshot);
        } finally {
            executor.shutdownNow();
        }
        verify(calculator, times(1)).calculate(eq(USER_ID), any());
    }

    private EffectivePermissions snapshot(ResourceType resource) {
        return new EffectivePermissions(
                USER_ID,
                List.of(),
                List.of(new EffectivePermission(resource, PermissionAction.READ, PermissionScope.TEAM, List.of())),
                clock.instant()
        );
    }
}
