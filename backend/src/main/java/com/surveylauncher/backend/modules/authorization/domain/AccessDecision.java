package com.surveylauncher.backend.modules.authorization.domain;

import java.util.List;

/**
 * 권한 판정 결과.
 *
 * @param grantedBy         허용 근거가 된 역할(거부 시 빈 목록)
 * @param cacheHit          유효 권한을 캐시에서 읽었는지 여부. 계산 전에 실패하면 null
 * @param evaluationTimeMs  판정 소요 시간(ms, 소수)
 */
public record AccessDecision(
        boolean allowed,
        ReasonCode reason,
        List<RoleRef> grantedBy,
        Boolean cacheHit,
        double evaluationTimeMs
) {

    public AccessDecision {
        if (reason == null) {
            throw new IllegalArgumentException("reason is required");
        }
        grantedBy = grantedBy == null ? List.of() : List.copyOf(grantedBy);
    }

    public static AccessDecision allow(ReasonCode reason, List<RoleRef> grantedBy) {
        return new AccessDecision(true, reason, grantedBy, null, 0d);
    }

    public static AccessDecision deny(ReasonCode reason) {
        return new AccessDecision(false, reason, List.of(), null, 0d);
    }

    public AccessDecision withTiming(Boolean hit, double elapsedMs) {
        return new AccessDecision(allowed, reason, grantedBy, hit, elapsedMs);
    }
}
