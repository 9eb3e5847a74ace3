package com.surveylauncher.backend.modules.authorization.application.scope;

import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.PermissionContext;
import com.surveylauncher.backend.modules.authorization.domain.ResourceRef;

/**
 * 범위 규칙이 비교할 값. 리소스 참조에 값이 있으면 요청 컨텍스트보다 우선한다.
 *
 * @param callerId     판정을 요청한 사용자
 * @param targetUserId USER 범위에서 비교할 대상 사용자
 */
public record EvaluationTarget(
        UUID callerId,
        UUID organizationId,
        UUID teamId,
        String regionId,
        UUID targetUserId
) {

    public static EvaluationTarget of(UUID callerId, PermissionContext context) {
        PermissionContext ctx = context == null ? PermissionContext.empty() : context;
        return new EvaluationTarget(callerId, ctx.organizationId(), ctx.teamId(), ctx.regionId(), ctx.userId());
    }

    public static EvaluationTarget of(UUID callerId, ResourceRef resource, PermissionContext context) {
        EvaluationTarget base = of(callerId, context);
        if (resource == null) {
            return base;
        }
        return new EvaluationTarget(
                callerId,
                resource.organizationId() != null ? resource.organizationId() : base.organizationId(),
                resource.teamId() != null ? resource.teamId() : base.teamId(),
                resource.regionId() != null ? resource.regionId() : base.regionId(),
                base.targetUserId()
        );
    }
}
