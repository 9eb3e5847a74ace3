package com.surveylauncher.backend.modules.authorization.application;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.surveylauncher.backend.modules.authorization.domain.AssignedRole;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermission;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.Permission;
import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;
import com.surveylauncher.backend.modules.authorization.domain.ResourceType;
import com.surveylauncher.backend.modules.authorization.domain.Role;
import com.surveylauncher.backend.modules.authorization.domain.RolePermission;
import com.surveylauncher.backend.modules.authorization.domain.UserRoleAssignment;
import com.surveylauncher.backend.modules.authorization.infrastructure.persistence.RolePermissionRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 유효 할당과 역할-권한 연결을 합쳐 (resource, action, scope) 튜플 집합을 만든다.
 * 물려받은 역할의 권한은 할당된 역할의 범위로 붙고, 역할 플래그(조직 간, 시스템 설정)는 상속되지 않는다.
 * 캐시는 다루지 않는다.
 */
@Component
public class EffectivePermissionCalculator {

    private final AssignmentResolver assignmentResolver;
    private final RoleInheritanceResolver roleInheritanceResolver;
    private final RolePermissionRepository rolePermissionRepository;
    private final Clock clock;

    public EffectivePermissionCalculator(
            AssignmentResolver assignmentResolver,
            RoleInheritanceResolver roleInheritanceResolver,
            RolePermissionRepository rolePermissionRepository,
            Clock clock
    ) {
        this.assignmentResolver = assignmentResolver;
        this.roleInheritanceResolver = roleInheritanceResolver;
        this.rolePermissionRepository = rolePermissionRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public EffectivePermissions calculate(UUID userId, AssignmentFilter filter) {
        List<UserRoleAssignment> assignments = assignmentResolver.resolveValidAssignments(userId, filter);
        if (assignments.isEmpty()) {
            return EffectivePermissions.none(userId, clock.instant());
        }

        Set<UUID> roleIds = assignments.stream()
                .map(assignment -> assignment.getRole().getId())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<UUID, List<Role>> inheritedByRole = roleInheritanceResolver.resolveInheritedRoles(roleIds);
        Set<UUID> lookupIds = new LinkedHashSet<>(roleIds);
        inheritedByRole.values().forEach(inherited -> inherited.forEach(role -> lookupIds.add(role.getId())));
        Map<UUID, List<Permission>> permissionsByRole = rolePermissionRepository.findActiveByRoleIds(lookupIds)
                .stream()
                .collect(Collectors.groupingBy(
                        rolePermission -> rolePermission.getRole().getId(),
                        LinkedHashMap::new,
                        Collectors.mapping(RolePermission::getPermission, Collectors.toList())
                ));

        List<AssignedRole> roles = new ArrayList<>();
        Map<TupleKey, List<PermissionGrant>> grantsByTuple = new LinkedHashMap<>();
        for (UserRoleAssignment assignment : assignments) {
            AssignedRole role = AssignedRole.from(assignment);
            roles.add(role);
            Set<UUID> granted = new LinkedHashSet<>();
            for (Permission permission : permissionsByRole.getOrDefault(role.roleId(), List.of())) {
                granted.add(permission.getId());
                addGrant(grantsByTuple, permission, toGrant(role, permission, null));
            }
            for (Role inherited : inheritedByRole.getOrDefault(role.roleId(), List.of())) {
                for (Permission permission : permissionsByRole.getOrDefault(inherited.getId(), List.of())) {
                    if (granted.add(permission.getId())) {
                        addGrant(grantsByTuple, permission, toGrant(role, permission, inherited.getName()));
                    }
                }
            }
        }

        List<EffectivePermission> permissions = grantsByTuple.entrySet().stream()
                .map(entry -> new EffectivePermission(
                        entry.getKey().resource(),
                        entry.getKey().action(),
                        entry.getKey().scope(),
                        entry.getValue()))
                .toList();
        return new EffectivePermissions(userId, roles, permissions, clock.instant());
    }

    private void addGrant(Map<TupleKey, List<PermissionGrant>> grantsByTuple, Permission permission, PermissionGrant grant) {
        TupleKey key = new TupleKey(permission.getResource(), permission.getAction(), permission.getScope());
        grantsByTuple.computeIfAbsent(key, ignored -> new ArrayList<>()).add(grant);
    }

    private PermissionGrant toGrant(AssignedRole role, Permission permission, String inheritedFrom) {
        return new PermissionGrant(
                role.roleId(),
                role.name(),
                permission.getId(),
                role.organizationId(),
                role.teamId(),
                role.regionId(),
                permission.isCrossTeam(),
                permission.getConditions(),
                inheritedFrom
        );
    }

    private record TupleKey(ResourceType resource, PermissionAction action, PermissionScope scope) {
    }
}
