package com.surveylauncher.backend.modules.authorization.application;

import static com.surveylauncher.backend.support.AuthorizationFixtures.inheritance;
import static com.surveylauncher.backend.support.AuthorizationFixtures.role;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import com.surveylauncher.backend.modules.authorization.domain.Role;
import com.surveylauncher.backend.modules.authorization.domain.RoleInheritance;
import com.surveylauncher.backend.modules.authorization.infrastructure.persistence.RoleInheritanceRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RoleInheritanceResolverTest {

    @Mock
    private RoleInheritanceRepository roleInheritanceRepository;

    private RoleInheritanceResolver resolver;

    private Role member;
    private Role supervisor;
    private Role policyAdmin;
    private Role regionalManager;
    private Role systemAdmin;

    @BeforeEach
    void setUp() {
        resolver = new RoleInheritanceResolver(roleInheritanceRepository);
        member = role("TEAM_MEMBER", 1, false, false);
        supervisor = role("FIELD_SUPERVISOR", 2, false, false);
        regionalManager = role("REGIONAL_MANAGER", 3, false, false);
        policyAdmin = role("POLICY_ADMIN", 7, false, false);
        systemAdmin = role("SYSTEM_ADMIN", 9, true, true);
    }

    @Test
    @DisplayName("상속은 여러 단계를 따라가고 다이아몬드 경로의 역할은 한 번만 나온다")
    void resolvesTransitivelyWithoutDuplicates() {
        graph(List.of(
                inheritance(systemAdmin, regionalManager),
                inheritance(systemAdmin, policyAdmin),
                inheritance(regionalManager, supervisor),
                inheritance(policyAdmin, supervisor),
                inheritance(supervisor, member)
        ));

        Map<UUID, List<Role>> result = resolver.resolveInheritedRoles(List.of(systemAdmin.getId(), member.getId()));

        assertThat(result.get(systemAdmin.getId())).extracting(Role::getName)
                .containsExactlyInAnyOrder("REGIONAL_MANAGER", "POLICY_ADMIN", "FIELD_SUPERVISOR", "TEAM_MEMBER");
        assertThat(result.get(member.getId())).isEmpty();
        // 깊이마다 한 번: SYSTEM_ADMIN/TEAM_MEMBER, RM/PA, FS, (TEAM_MEMBER는 이미 봤다)
        verify(roleInheritanceRepository, times(3)).findActiveParentsOf(anyCollection());
    }

    @Test
    @DisplayName("순환 상속이 있어도 멈추고 자기 자신은 결과에 넣지 않는다")
    void cyclesAreCut() {
        graph(List.of(
                inheritance(policyAdmin, supervisor),
                inheritance(supervisor, member),
                inheritance(member, policyAdmin)
        ));

        Map<UUID, List<Role>> result = resolver.resolveInheritedRoles(List.of(policyAdmin.getId()));

        assertThat(result.get(policyAdmin.getId())).extracting(Role::getName)
                .containsExactly("FIELD_SUPERVISOR", "TEAM_MEMBER");
    }

    @Test
    @DisplayName("상속 선언이 없으면 빈 목록")
    void noEdgesYieldEmptyLists() {
        graph(List.of());

        Map<UUID, List<Role>> result = resolver.resolveInheritedRoles(List.of(supervisor.getId()));

        assertThat(result).containsOnlyKeys(supervisor.getId());
        assertThat(result.get(supervisor.getId())).isEmpty();
    }

    /**
     * 저장소가 요청받은 역할 id에 해당하는 간선만 돌려주도록 흉내낸다.
     */
    private void graph(List<RoleInheritance> edges) {
        when(roleInheritanceRepository.findActiveParentsOf(anyCollection())).thenAnswer(invocation -> {
            Collection<UUID> roleIds = invocation.getArgument(0);
            Set<UUID> requested = Set.copyOf(roleIds);
            return edges.stream()
                    .filter(edge -> requested.contains(edge.getRole().getId()))
                    .collect(Collectors.toList());
        });
    }
}
