package com.surveylauncher.backend.modules.authorization.application.scope;

import java.util.List;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;
import com.surveylauncher.backend.modules.authorization.domain.ReasonCode;

import org.springframework.stereotype.Component;

@Component
public class OrganizationScopeRule implements ScopeRule {

    @Override
    public PermissionScope scope() {
        return PermissionScope.ORGANIZATION;
    }

    @Override
    public ScopeEvaluation evaluate(EvaluationTarget target, List<PermissionGrant> grants, EffectivePermissions permissions) {
        if (target.organizationId() == null) {
            return ScopeEvaluation.granted(grants);
        }
        List<PermissionGrant> sameOrganization = grants.stream()
                .filter(grant -> target.organizationId().equals(grant.organizationId()))
                .toList();
        if (!sameOrganization.isEmpty()) {
            return ScopeEvaluation.granted(sameOrganization);
        }
        return ScopeEvaluation.crossOrganizationOr(permissions, ReasonCode.ORGANIZATION_SCOPE_VIOLATION);
    }
}
