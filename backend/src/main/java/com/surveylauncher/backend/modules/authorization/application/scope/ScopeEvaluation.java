package com.surveylauncher.backend.modules.authorization.application.scope;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.ReasonCode;
import com.surveylauncher.backend.modules.authorization.domain.RoleRef;

public record ScopeEvaluation(boolean allowed, ReasonCode reason, List<RoleRef> grantedBy) {

    public ScopeEvaluation {
        grantedBy = grantedBy == null ? List.of() : List.copyOf(grantedBy);
    }

    public static ScopeEvaluation granted(List<PermissionGrant> grants) {
        Map<UUID, RoleRef> roles = new LinkedHashMap<>();
        for (PermissionGrant grant : grants) {
            roles.putIfAbsent(grant.roleId(), grant.toRoleRef());
        }
        return new ScopeEvaluation(true, ReasonCode.PERMISSION_GRANTED, List.copyOf(roles.values()));
    }

    public static ScopeEvaluation denied(ReasonCode reason) {
        return new ScopeEvaluation(false, reason, List.of());
    }

    /**
     * 조직 경계를 넘는 역할로 허용. 시스템 설정 권한이 없는 조직 간 역할(전국 지원 관리자)이 하나라도 있으면
     * 그 사유를 먼저 쓰고, 모든 조직 간 역할이 시스템 설정 권한까지 가질 때만 시스템 관리자 사유를 쓴다.
     * 호출 전에 {@link EffectivePermissions#hasCrossOrganizationRole()}을 확인해야 한다.
     */
    public static ScopeEvaluation crossOrganization(EffectivePermissions permissions) {
        boolean nationalSupport = permissions.roles().stream()
                .anyMatch(role -> role.crossOrganizationAccess() && !role.systemSettingsAccess());
        ReasonCode reason = nationalSupport
                ? ReasonCode.NATIONAL_SUPPORT_ADMIN_CROSS_TEAM_ACCESS
                : ReasonCode.SYSTEM_ADMIN_CROSS_TEAM_ACCESS;
        return new ScopeEvaluation(true, reason, permissions.crossOrganizationRoles());
    }

    static ScopeEvaluation crossOrganizationOr(EffectivePermissions permissions, ReasonCode denial) {
        return permissions.hasCrossOrganizationRole()
                ? crossOrganization(permissions)
                : denied(denial);
    }
}
