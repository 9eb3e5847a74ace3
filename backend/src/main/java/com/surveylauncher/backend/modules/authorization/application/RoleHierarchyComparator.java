package com.surveylauncher.backend.modules.authorization.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.Role;
import com.surveylauncher.backend.modules.authorization.domain.UserRoleAssignment;
import com.surveylauncher.backend.modules.authorization.infrastructure.persistence.RoleRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 역할 계층 비교. 조회 계열 액션은 동급까지, 그 외 액션은 더 높은 레벨만 허용한다.
 */
@Component
public class RoleHierarchyComparator {

    public static final int NO_ROLE_LEVEL = 0;

    private final RoleRepository roleRepository;
    private final AssignmentResolver assignmentResolver;

    public RoleHierarchyComparator(RoleRepository roleRepository, AssignmentResolver assignmentResolver) {
        this.roleRepository = roleRepository;
        this.assignmentResolver = assignmentResolver;
    }

    @Transactional(readOnly = true)
    public boolean canRolePerformAction(String actorRoleName, String targetRoleName, PermissionAction action) {
        if (action == null) {
            return false;
        }
        Optional<Role> actor = findActiveRole(actorRoleName);
        Optional<Role> target = findActiveRole(targetRoleName);
        if (actor.isEmpty() || target.isEmpty()) {
            return false;
        }
        return compareLevels(actor.get().getHierarchyLevel(), target.get().getHierarchyLevel(), action);
    }

    public int getUserHighestRoleLevel(UUID userId) {
        List<UserRoleAssignment> assignments = assignmentResolver.resolveValidAssignments(userId, AssignmentFilter.none());
        return assignments.stream()
                .mapToInt(assignment -> assignment.getRole().getHierarchyLevel())
                .max()
                .orElse(NO_ROLE_LEVEL);
    }

    static boolean compareLevels(int actorLevel, int targetLevel, PermissionAction action) {
        return action.isReadClass() ? actorLevel >= targetLevel : actorLevel > targetLevel;
    }

    private Optional<Role> findActiveRole(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return roleRepository.findByName(name.trim()).filter(Role::isActive);
    }
}
