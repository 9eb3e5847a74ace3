package com.surveylauncher.backend.modules.authorization.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermission;

public record EffectivePermissionResponse(
        String resource,
        String action,
        String scope,
        List<Source> grantedBy
) {

    public static EffectivePermissionResponse from(EffectivePermission permission) {
        List<Source> sources = permission.grants().stream()
                .map(grant -> new Source(grant.roleId(), grant.roleName(), grant.organizationId(), grant.teamId(),
                        grant.regionId(), grant.crossTeam(), grant.inheritedFrom()))
                .toList();
        return new EffectivePermissionResponse(
                permission.resource().name(),
                permission.action().name(),
                permission.scope().name(),
                sources
        );
    }

    public record Source(
            UUID roleId,
            String roleName,
            UUID organizationId,
            UUID teamId,
            String regionId,
            boolean crossTeam,
            String inheritedFrom
    ) {
    }
}
