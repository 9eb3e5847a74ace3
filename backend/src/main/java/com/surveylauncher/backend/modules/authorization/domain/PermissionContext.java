package com.surveylauncher.backend.modules.authorization.domain;

import java.util.UUID;

/**
 * 판정 요청 컨텍스트. 모든 필드는 선택이며 비어 있는 필드는 해당 범위를 제약하지 않는다.
 *
 * @param userId 대상 사용자(USER 범위 판정에 사용)
 */
public record PermissionContext(
        UUID organizationId,
        UUID teamId,
        String regionId,
        String resourceId,
        UUID userId,
        String ipAddress,
        String requestId
) {

    private static final PermissionContext EMPTY = new PermissionContext(null, null, null, null, null, null, null);

    public static PermissionContext empty() {
        return EMPTY;
    }

    public static PermissionContext forOrganization(UUID organizationId) {
        return new PermissionContext(organizationId, null, null, null, null, null, null);
    }

    public static PermissionContext forTeam(UUID organizationId, UUID teamId) {
        return new PermissionContext(organizationId, teamId, null, null, null, null, null);
    }

    public static PermissionContext forRegion(String regionId) {
        return new PermissionContext(null, null, regionId, null, null, null, null);
    }

    public static PermissionContext forTargetUser(UUID targetUserId) {
        return new PermissionContext(null, null, null, null, targetUserId, null, null);
    }

    public PermissionContext withIpAddress(String ip) {
        return new PermissionContext(organizationId, teamId, regionId, resourceId, userId, ip, requestId);
    }

    public PermissionContext withRequestId(String id) {
        return new PermissionContext(organizationId, teamId, regionId, resourceId, userId, ipAddress, id);
    }
}
