package com.surveylauncher.backend.modules.authorization.application.scope;

import java.util.List;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;
import com.surveylauncher.backend.modules.authorization.domain.ReasonCode;

import org.springframework.stereotype.Component;

/**
 * 팀 경계. 같은 팀의 할당이거나, 같은 조직 안의 cross-team 권한이면 허용한다.
 */
@Component
public class TeamScopeRule implements ScopeRule {

    @Override
    public PermissionScope scope() {
        return PermissionScope.TEAM;
    }

    @Override
    public ScopeEvaluation evaluate(EvaluationTarget target, List<PermissionGrant> grants, EffectivePermissions permissions) {
        if (target.teamId() == null) {
            return ScopeEvaluation.granted(grants);
        }
        List<PermissionGrant> sameTeam = grants.stream()
                .filter(grant -> target.teamId().equals(grant.teamId()))
                .toList();
        if (!sameTeam.isEmpty()) {
            return ScopeEvaluation.granted(sameTeam);
        }
        if (target.organizationId() != null) {
            List<PermissionGrant> crossTeam = grants.stream()
                    .filter(PermissionGrant::crossTeam)
                    .filter(grant -> target.organizationId().equals(grant.organizationId()))
                    .toList();
            if (!crossTeam.isEmpty()) {
                return ScopeEvaluation.granted(crossTeam);
            }
        }
        return ScopeEvaluation.crossOrganizationOr(permissions, ReasonCode.TEAM_SCOPE_VIOLATION);
    }
}
