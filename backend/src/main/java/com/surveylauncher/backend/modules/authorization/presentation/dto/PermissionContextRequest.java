package com.surveylauncher.backend.modules.authorization.presentation.dto;

import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.PermissionContext;

import jakarta.validation.constraints.Size;

public record PermissionContextRequest(
        UUID organizationId,
        UUID teamId,
        @Size(max = 32) String regionId,
        @Size(max = 128) String resourceId,
        UUID userId,
        @Size(max = 64) String ipAddress
) {

    public PermissionContext toContext(String requestId) {
        return new PermissionContext(organizationId, teamId, regionId, resourceId, userId, ipAddress, requestId);
    }
}
