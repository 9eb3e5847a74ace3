package com.surveylauncher.backend.modules.authorization.application.scope;

import java.util.List;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;

/**
 * 권한 튜플의 scope별 판정 규칙.
 */
public interface ScopeRule {

    PermissionScope scope();

    /**
     * @param grants 조건을 통과한 근거만 전달된다(비어 있지 않음)
     */
    ScopeEvaluation evaluate(EvaluationTarget target, List<PermissionGrant> grants, EffectivePermissions permissions);
}
