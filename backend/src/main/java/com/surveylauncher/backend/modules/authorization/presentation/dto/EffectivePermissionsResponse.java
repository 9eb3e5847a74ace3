package com.surveylauncher.backend.modules.authorization.presentation.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;

public record EffectivePermissionsResponse(
        UUID userId,
        List<RoleItem> roles,
        List<EffectivePermissionResponse> permissions,
        Instant computedAt
) {

    public static EffectivePermissionsResponse from(EffectivePermissions permissions) {
        List<RoleItem> roles = permissions.roles().stream()
                .map(role -> new RoleItem(role.roleId(), role.name(), role.hierarchyLevel(),
                        role.organizationId(), role.teamId(), role.regionId()))
                .toList();
        List<EffectivePermissionResponse> items = permissions.permissions().stream()
                .map(EffectivePermissionResponse::from)
                .toList();
        return new EffectivePermissionsResponse(permissions.userId(), roles, items, permissions.computedAt());
    }

    public record RoleItem(
            UUID roleId,
            String name,
            int hierarchyLevel,
            UUID organizationId,
            UUID teamId,
            String regionId
    ) {
    }
}
