package com.surveylauncher.backend.modules.authorization.domain;

import java.util.List;

/**
 * 값으로 중복 제거된 (resource, action, scope) 튜플과 그 근거 목록.
 */
public record EffectivePermission(
        ResourceType resource,
        PermissionAction action,
        PermissionScope scope,
        List<PermissionGrant> grants
) {

    public EffectivePermission {
        grants = grants == null ? List.of() : List.copyOf(grants);
    }

    public boolean matches(ResourceType requestedResource, PermissionAction requestedAction) {
        return resource == requestedResource && action.covers(requestedAction);
    }
}
