package com.surveylauncher.backend.modules.authorization.domain;

import java.util.UUID;

/**
 * 유효한 할당 하나에서 파생된 역할 정보. 같은 역할이라도 할당 범위가 다르면 따로 남는다.
 */
public record AssignedRole(
        UUID roleId,
        String name,
        int hierarchyLevel,
        UUID organizationId,
        UUID teamId,
        String regionId,
        boolean crossOrganizationAccess,
        boolean systemSettingsAccess
) {

    public static AssignedRole from(UserRoleAssignment assignment) {
        Role role = assignment.getRole();
        return new AssignedRole(
                role.getId(),
                role.getName(),
                role.getHierarchyLevel(),
                assignment.getOrganizationId(),
                assignment.getTeamId(),
                assignment.getRegionId(),
                role.isCrossOrganizationAccess(),
                role.isSystemSettingsAccess()
        );
    }

    public RoleRef toRef() {
        return new RoleRef(roleId, name);
    }
}
