package com.surveylauncher.backend.modules.authorization.application;

import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.UserRoleAssignment;

/**
 * 유효 할당을 조직/팀으로 좁히는 선택 조건. 좁힌 결과는 사용자 단위 캐시에 저장하지 않는다.
 */
public record AssignmentFilter(UUID organizationId, UUID teamId) {

    private static final AssignmentFilter NONE = new AssignmentFilter(null, null);

    public static AssignmentFilter none() {
        return NONE;
    }

    public boolean narrows() {
        return organizationId != null || teamId != null;
    }

    boolean accepts(UserRoleAssignment assignment) {
        if (organizationId != null && !organizationId.equals(assignment.getOrganizationId())) {
            return false;
        }
        return teamId == null || teamId.equals(assignment.getTeamId());
    }
}
