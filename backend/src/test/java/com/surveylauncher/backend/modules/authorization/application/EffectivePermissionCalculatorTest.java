package com.surveylauncher.backend.modules.authorization.application;

import static com.surveylauncher.backend.support.AuthorizationFixtures.ORG_A;
import static com.surveylauncher.backend.support.AuthorizationFixtures.TEAM_1;
import static com.surveylauncher.backend.support.AuthorizationFixtures.TEAM_2;
import static com.surveylauncher.backend.support.AuthorizationFixtures.assignment;
import static com.surveylauncher.backend.support.AuthorizationFixtures.link;
import static com.surveylauncher.backend.support.AuthorizationFixtures.permission;
import static com.surveylauncher.backend.support.AuthorizationFixtures.role;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.AssignedRole;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermission;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.Permission;
import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;
import com.surveylauncher.backend.modules.authorization.domain.ResourceType;
import com.surveylauncher.backend.modules.authorization.domain.Role;
import com.surveylauncher.backend.modules.authorization.infrastructure.persistence.RolePermissionRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EffectivePermissionCalculatorTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000301");

    @Mock
    private AssignmentResolver assignmentResolver;

    @Mock
    private RoleInheritanceResolver roleInheritanceResolver;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    private EffectivePermissionCalculator calculator;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        calculator = new EffectivePermissionCalculator(assignmentResolver, roleInheritanceResolver,
                rolePermissionRepository, clock);
    }

    @Test
    @DisplayName("유효 할당이 없으면 저장소를 더 조회하지 않고 빈 스냅샷을 돌려준다")
    void noAssignmentsYieldsEmptySnapshot() {
        when(assignmentResolver.resolveValidAssignments(eq(USER_ID), any())).thenReturn(List.of());

        EffectivePermissions result = calculator.calculate(USER_ID, AssignmentFilter.none());

        assertThat(result.userId()).isEqualTo(USER_ID);
        assertThat(result.roles()).isEmpty();
        assertThat(result.hasNoPermissions()).isTrue();
        assertThat(result.computedAt()).isEqualTo(clock.instant());
        verify(rolePermissionRepository, never()).findActiveByRoleIds(anyCollection());
    }

    @Test
    @DisplayName("여러 역할이 같은 튜플을 주면 하나로 합치고 근거를 모두 남긴다")
    void duplicateTuplesAreMergedWithAllSources() {
        Role member = role("TEAM_MEMBER", 1, false, false);
        Role auditor = role("AUDITOR", 5, false, false);
        Permission teamsReadTeam = permission(ResourceType.TEAMS, PermissionAction.READ, PermissionScope.TEAM);
        Permission devicesReadTeam = permission(ResourceType.DEVICES, PermissionAction.READ, PermissionScope.TEAM);
        Permission teamsReadOrg = permission(ResourceType.TEAMS, PermissionAction.READ, PermissionScope.ORGANIZATION);

        when(assignmentResolver.resolveValidAssignments(eq(USER_ID), any())).thenReturn(List.of(
                assignment(USER_ID, member, ORG_A, TEAM_1),
                assignment(USER_ID, member, ORG_A, TEAM_2),
                assignment(USER_ID, auditor, ORG_A, null)
        ));
        when(rolePermissionRepository.findActiveByRoleIds(anyCollection())).thenReturn(List.of(
                link(member, teamsReadTeam),
                link(member, devicesReadTeam),
                link(auditor, teamsReadOrg)
        ));

        EffectivePermissions result = calculator.calculate(USER_ID, AssignmentFilter.none());

        assertThat(result.roles()).extracting(AssignedRole::name)
                .containsExactly("TEAM_MEMBER", "TEAM_MEMBER", "AUDITOR");
        assertThat(result.permissions()).hasSize(3);

        EffectivePermission teamsRead = result.permissions().get(0);
        assertThat(teamsRead.resource()).isEqualTo(ResourceType.TEAMS);
        assertThat(teamsRead.scope()).isEqualTo(PermissionScope.TEAM);
        assertThat(teamsRead.grants()).extracting(PermissionGrant::teamId).containsExactly(TEAM_1, TEAM_2);

        assertThat(result.permissions())
                .filteredOn(permission -> permission.scope() == PermissionScope.ORGANIZATION)
                .singleElement()
                .satisfies(permission -> assertThat(permission.grants())
                        .extracting(PermissionGrant::roleName)
                        .containsExactly("AUDITOR"));
    }

    @Test
    @DisplayName("cross-team 플래그가 근거에 그대로 실린다")
    void crossTeamFlagIsCarried() {
        Role supervisor = role("FIELD_SUPERVISOR", 2, false, false);
        Permission crossTeamRead = permission(ResourceType.TEAMS, PermissionAction.READ, PermissionScope.TEAM);
        crossTeamRead.setCrossTeam(true);

        when(assignmentResolver.resolveValidAssignments(eq(USER_ID), any()))
                .thenReturn(List.of(assignment(USER_ID, supervisor, ORG_A, TEAM_1)));
        when(rolePermissionRepository.findActiveByRoleIds(anyCollection()))
                .thenReturn(List.of(link(supervisor, crossTeamRead)));

        EffectivePermissions result = calculator.calculate(USER_ID, AssignmentFilter.none());

        assertThat(result.permissions()).singleElement()
                .satisfies(permission -> assertThat(permission.grants()).singleElement()
                        .satisfies(grant -> {
                            assertThat(grant.crossTeam()).isTrue();
                            assertThat(grant.organizationId()).isEqualTo(ORG_A);
                        }));
    }

    @Test
    @DisplayName("물려받은 역할의 권한은 할당 범위로 붙고 어느 역할에서 왔는지 남는다")
    void inheritedPermissionsAreTaggedWithSourceRole() {
        Role member = role("TEAM_MEMBER", 1, false, false);
        Role supervisor = role("FIELD_SUPERVISOR", 2, false, false);
        Role policyAdmin = role("POLICY_ADMIN", 7, false, false);
        Permission policyManageOrg = permission(ResourceType.POLICY, PermissionAction.MANAGE, PermissionScope.ORGANIZATION);
        Permission teamsManageTeam = permission(ResourceType.TEAMS, PermissionAction.MANAGE, PermissionScope.TEAM);
        Permission authCreateUser = permission(ResourceType.AUTH, PermissionAction.CREATE, PermissionScope.USER);
        Permission teamsReadTeam = permission(ResourceType.TEAMS, PermissionAction.READ, PermissionScope.TEAM);

        when(assignmentResolver.resolveValidAssignments(eq(USER_ID), any()))
                .thenReturn(List.of(assignment(USER_ID, policyAdmin, ORG_A, TEAM_1)));
        when(roleInheritanceResolver.resolveInheritedRoles(anyCollection()))
                .thenReturn(Map.of(policyAdmin.getId(), List.of(supervisor, member)));
        when(rolePermissionRepository.findActiveByRoleIds(anyCollection())).thenReturn(List.of(
                link(policyAdmin, policyManageOrg),
                link(supervisor, teamsManageTeam),
                link(member, authCreateUser),
                link(member, teamsReadTeam),
                link(supervisor, teamsReadTeam)
        ));

        EffectivePermissions result = calculator.calculate(USER_ID, AssignmentFilter.none());

        assertThat(result.roles()).extracting(AssignedRole::name).containsExactly("POLICY_ADMIN");
        assertThat(result.permissions()).hasSize(4);
        assertThat(result.permissions()).flatExtracting(EffectivePermission::grants)
                .allSatisfy(grant -> {
                    assertThat(grant.roleName()).isEqualTo("POLICY_ADMIN");
                    assertThat(grant.teamId()).isEqualTo(TEAM_1);
                });
        assertThat(result.permissions())
                .filteredOn(permission -> permission.resource() == ResourceType.AUTH)
                .singleElement()
                .satisfies(permission -> assertThat(permission.grants()).singleElement()
                        .extracting(PermissionGrant::inheritedFrom).isEqualTo("TEAM_MEMBER"));
        assertThat(result.permissions())
                .filteredOn(permission -> permission.resource() == ResourceType.POLICY)
                .singleElement()
                .satisfies(permission -> assertThat(permission.grants()).singleElement()
                        .satisfies(grant -> assertThat(grant.inherited()).isFalse()));
        // 두 상속 경로로 들어온 같은 권한은 근거 하나로 합친다
        assertThat(result.permissions())
                .filteredOn(permission -> permission.resource() == ResourceType.TEAMS
                        && permission.action() == PermissionAction.READ)
                .singleElement()
                .satisfies(permission -> assertThat(permission.grants()).singleElement()
                        .extracting(PermissionGrant::inheritedFrom).isEqualTo("FIELD_SUPERVISOR"));
        verify(rolePermissionRepository).findActiveByRoleIds(
                argThat(ids -> ids.containsAll(
                        List.of(policyAdmin.getId(), supervisor.getId(), member.getId()))));
    }
}
