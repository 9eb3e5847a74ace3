package com.surveylauncher.backend.modules.authorization.application.scope;

import java.util.List;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;

import org.springframework.stereotype.Component;

@Component
public class SystemScopeRule implements ScopeRule {

    @Override
    public PermissionScope scope() {
        return PermissionScope.SYSTEM;
    }

    @Override
    public ScopeEvaluation evaluate(EvaluationTarget target, List<PermissionGrant> grants, EffectivePermissions permissions) {
        return ScopeEvaluation.granted(grants);
    }
}
