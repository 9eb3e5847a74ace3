package com.surveylauncher.backend.modules.authorization.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * 한 사용자의 유효 역할과 권한 튜플 스냅샷. 캐시에 직렬화되어 저장된다.
 */
public record EffectivePermissions(
        UUID userId,
        List<AssignedRole> roles,
        List<EffectivePermission> permissions,
        Instant computedAt
) {

    public EffectivePermissions {
        roles = roles == null ? List.of() : List.copyOf(roles);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static EffectivePermissions none(UUID userId, Instant computedAt) {
        return new EffectivePermissions(userId, List.of(), List.of(), computedAt);
    }

    public boolean hasNoPermissions() {
        return permissions.isEmpty();
    }

    public boolean hasCrossOrganizationRole() {
        return roles.stream().anyMatch(AssignedRole::crossOrganizationAccess);
    }

    public List<RoleRef> crossOrganizationRoles() {
        return distinctRoles(AssignedRole::crossOrganizationAccess);
    }

    public List<RoleRef> systemSettingsRoles() {
        return distinctRoles(AssignedRole::systemSettingsAccess);
    }

    private List<RoleRef> distinctRoles(Predicate<AssignedRole> filter) {
        Map<UUID, RoleRef> refs = new LinkedHashMap<>();
        roles.stream()
                .filter(filter)
                .forEach(role -> refs.putIfAbsent(role.roleId(), role.toRef()));
        return List.copyOf(refs.values());
    }
}
