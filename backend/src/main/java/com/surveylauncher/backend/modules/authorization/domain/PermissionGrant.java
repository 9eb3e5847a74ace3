package com.surveylauncher.backend.modules.authorization.domain;

import java.util.UUID;

/**
 * 특정 권한 튜플을 만들어 낸 (역할, 권한, 할당 범위) 경로 하나.
 * 상속으로 들어온 경우 roleId/roleName은 할당된 역할이고 inheritedFrom은 권한을 실제로 가진 역할 이름이다.
 */
public record PermissionGrant(
        UUID roleId,
        String roleName,
        UUID permissionId,
        UUID organizationId,
        UUID teamId,
        String regionId,
        boolean crossTeam,
        PermissionConditions conditions,
        String inheritedFrom
) {

    public boolean inherited() {
        return inheritedFrom != null;
    }

    public RoleRef toRoleRef() {
        return new RoleRef(roleId, roleName);
    }
}
