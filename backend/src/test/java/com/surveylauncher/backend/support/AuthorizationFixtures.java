package com.surveylauncher.backend.support;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.AssignedRole;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermission;
import com.surveylauncher.backend.modules.authorization.domain.Permission;
import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.PermissionConditions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;
import com.surveylauncher.backend.modules.authorization.domain.ResourceType;
import com.surveylauncher.backend.modules.authorization.domain.Role;
import com.surveylauncher.backend.modules.authorization.domain.RoleInheritance;
import com.surveylauncher.backend.modules.authorization.domain.RolePermission;
import com.surveylauncher.backend.modules.authorization.domain.UserRoleAssignment;

/**
 * 단위 테스트용 엔터티/스냅샷 생성기. 식별자는 리플렉션으로 직접 부여한다.
 */
public final class AuthorizationFixtures {

    public static final UUID ORG_A = UUID.fromString("00000000-0000-0000-0000-00000000a001");
    public static final UUID ORG_B = UUID.fromString("00000000-0000-0000-0000-00000000b001");
    public static final UUID TEAM_1 = UUID.fromString("00000000-0000-0000-0000-000000000101");
    public static final UUID TEAM_2 = UUID.fromString("00000000-0000-0000-0000-000000000202");

    private AuthorizationFixtures() {
    }

    public static Role role(String name, int level, boolean crossOrganization, boolean systemSettings) {
        Role role = new Role();
        setId(Role.class, role, UUID.nameUUIDFromBytes(("role:" + name).getBytes()));
        role.setName(name);
        role.setDisplayName(name);
        role.setHierarchyLevel(level);
        role.setSystemRole(true);
        role.setActive(true);
        role.setCrossOrganizationAccess(crossOrganization);
        role.setSystemSettingsAccess(systemSettings);
        return role;
    }

    public static Permission permission(ResourceType resource, PermissionAction action, PermissionScope scope) {
        Permission permission = new Permission();
        setId(Permission.class, permission,
                UUID.nameUUIDFromBytes((resource + "." + action + "." + scope).getBytes()));
        permission.setName(resource + "." + action + "." + scope);
        permission.setResource(resource);
        permission.setAction(action);
        permission.setScope(scope);
        permission.setActive(true);
        return permission;
    }

    public static RolePermission link(Role role, Permission permission) {
        RolePermission rolePermission = new RolePermission();
        rolePermission.setRole(role);
        rolePermission.setPermission(permission);
        rolePermission.setActive(true);
        rolePermission.setGrantedAt(OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        return rolePermission;
    }

    public static RoleInheritance inheritance(Role role, Role inheritedRole) {
        RoleInheritance inheritance = new RoleInheritance();
        setId(RoleInheritance.class, inheritance, UUID.randomUUID());
        inheritance.setRole(role);
        inheritance.setInheritedRole(inheritedRole);
        return inheritance;
    }

    public static UserRoleAssignment assignment(UUID userId, Role role, UUID organizationId, UUID teamId) {
        UserRoleAssignment assignment = new UserRoleAssignment();
        setId(UserRoleAssignment.class, assignment, UUID.randomUUID());
        assignment.setUserId(userId);
        assignment.setRole(role);
        assignment.setOrganizationId(organizationId);
        assignment.setTeamId(teamId);
        assignment.setGrantedAt(OffsetDateTime.parse("2025-01-01T00:00:00Z"));
        assignment.setActive(true);
        return assignment;
    }

    public static AssignedRole assignedRole(Role role, UUID organizationId, UUID teamId, String regionId) {
        return new AssignedRole(role.getId(), role.getName(), role.getHierarchyLevel(), organizationId, teamId,
                regionId, role.isCrossOrganizationAccess(), role.isSystemSettingsAccess());
    }

    public static PermissionGrant grant(AssignedRole role, boolean crossTeam, PermissionConditions conditions) {
        return new PermissionGrant(role.roleId(), role.name(), UUID.randomUUID(), role.organizationId(),
                role.teamId(), role.regionId(), crossTeam, conditions, null);
    }

    public static EffectivePermission tuple(
            ResourceType resource,
            PermissionAction action,
            PermissionScope scope,
            PermissionGrant... grants
    ) {
        return new EffectivePermission(resource, action, scope, List.of(grants));
    }

    private static <T> void setId(Class<T> type, T target, UUID id) {
        try {
            java.lang.reflect.Field idField = type.getDeclaredField("id");
            idField.setAccessible(true);
            idField.set(target, id);
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }
}
