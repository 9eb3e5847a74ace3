package com.surveylauncher.backend.modules.authorization.application.scope;

import java.util.List;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;
import com.surveylauncher.backend.modules.authorization.domain.ReasonCode;

import org.springframework.stereotype.Component;

@Component
public class RegionScopeRule implements ScopeRule {

    @Override
    public PermissionScope scope() {
        return PermissionScope.REGION;
    }

    @Override
    public ScopeEvaluation evaluate(EvaluationTarget target, List<PermissionGrant> grants, EffectivePermissions permissions) {
        if (target.regionId() == null) {
            return ScopeEvaluation.granted(grants);
        }
        List<PermissionGrant> sameRegion = grants.stream()
                .filter(grant -> target.regionId().equals(grant.regionId()))
                .toList();
        if (!sameRegion.isEmpty()) {
            return ScopeEvaluation.granted(sameRegion);
        }
        return ScopeEvaluation.crossOrganizationOr(permissions, ReasonCode.CONTEXT_DENIED);
    }
}
