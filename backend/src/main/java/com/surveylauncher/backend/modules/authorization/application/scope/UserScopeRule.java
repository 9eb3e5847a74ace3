package com.surveylauncher.backend.modules.authorization.application.scope;

import java.util.List;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;
import com.surveylauncher.backend.modules.authorization.domain.ReasonCode;

import org.springframework.stereotype.Component;

/**
 * 본인 리소스만 허용한다.
 */
@Component
public class UserScopeRule implements ScopeRule {

    @Override
    public PermissionScope scope() {
        return PermissionScope.USER;
    }

    @Override
    public ScopeEvaluation evaluate(EvaluationTarget target, List<PermissionGrant> grants, EffectivePermissions permissions) {
        if (target.targetUserId() == null || target.targetUserId().equals(target.callerId())) {
            return ScopeEvaluation.granted(grants);
        }
        return ScopeEvaluation.crossOrganizationOr(permissions, ReasonCode.CONTEXT_DENIED);
    }
}
