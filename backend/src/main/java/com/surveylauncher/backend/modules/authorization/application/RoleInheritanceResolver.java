package com.surveylauncher.backend.modules.authorization.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.Role;
import com.surveylauncher.backend.modules.authorization.domain.RoleInheritance;
import com.surveylauncher.backend.modules.authorization.infrastructure.persistence.RoleInheritanceRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * role_inheritance를 따라 각 역할이 추이적으로 물려받는 역할을 펼친다.
 * 상속 그래프는 깊이 단위로 한 번씩만 조회하고, 순환이 있어도 한 역할은 한 번만 방문한다.
 */
@Component
public class RoleInheritanceResolver {

    private static final Logger log = LoggerFactory.getLogger(RoleInheritanceResolver.class);

    private final RoleInheritanceRepository roleInheritanceRepository;

    public RoleInheritanceResolver(RoleInheritanceRepository roleInheritanceRepository) {
        this.roleInheritanceRepository = roleInheritanceRepository;
    }

    /**
     * 역할 id별로 물려받는 활성 역할 목록. 자기 자신은 포함하지 않는다.
     */
    @Transactional(readOnly = true)
    public Map<UUID, List<Role>> resolveInheritedRoles(Collection<UUID> roleIds) {
        Map<UUID, List<Role>> parents = loadGraph(roleIds);
        Map<UUID, List<Role>> inherited = new LinkedHashMap<>();
        for (UUID roleId : roleIds) {
            Map<UUID, Role> collected = new LinkedHashMap<>();
            Set<UUID> path = new HashSet<>();
            path.add(roleId);
            collect(roleId, parents, path, collected);
            inherited.put(roleId, List.copyOf(collected.values()));
        }
        return inherited;
    }

    private Map<UUID, List<Role>> loadGraph(Collection<UUID> roleIds) {
        Map<UUID, List<Role>> parents = new HashMap<>();
        Set<UUID> seen = new HashSet<>(roleIds);
        Set<UUID> frontier = new LinkedHashSet<>(roleIds);
        while (!frontier.isEmpty()) {
            Set<UUID> next = new LinkedHashSet<>();
            for (RoleInheritance edge : roleInheritanceRepository.findActiveParentsOf(frontier)) {
                Role parent = edge.getInheritedRole();
                parents.computeIfAbsent(edge.getRole().getId(), ignored -> new ArrayList<>()).add(parent);
                if (seen.add(parent.getId())) {
                    next.add(parent.getId());
                }
            }
            frontier = next;
        }
        return parents;
    }

    private void collect(UUID roleId, Map<UUID, List<Role>> parents, Set<UUID> path, Map<UUID, Role> collected) {
        for (Role parent : parents.getOrDefault(roleId, List.of())) {
            if (path.contains(parent.getId())) {
                log.warn("Role inheritance cycle through {} -> {}; edge ignored", roleId, parent.getName());
                continue;
            }
            if (collected.putIfAbsent(parent.getId(), parent) != null) {
                continue;
            }
            path.add(parent.getId());
            collect(parent.getId(), parents, path, collected);
            path.remove(parent.getId());
        }
    }
}
