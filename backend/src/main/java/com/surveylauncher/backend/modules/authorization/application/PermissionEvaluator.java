package com.surveylauncher.backend.modules.authorization.application;

import java.util.Comparator;
import java.util.List;

import com.surveylauncher.backend.modules.authorization.application.scope.EvaluationTarget;
import com.surveylauncher.backend.modules.authorization.application.scope.ScopeEvaluation;
import com.surveylauncher.backend.modules.authorization.application.scope.ScopeRuleRegistry;
import com.surveylauncher.backend.modules.authorization.domain.AccessDecision;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermission;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.PermissionContext;
import com.surveylauncher.backend.modules.authorization.domain.PermissionGrant;
import com.surveylauncher.backend.modules.authorization.domain.ReasonCode;
import com.surveylauncher.backend.modules.authorization.domain.ResourceType;
import com.surveylauncher.backend.modules.authorization.domain.RoleRef;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 유효 권한 스냅샷 위에서 (resource, action, 대상) 요청을 판정한다. 저장소에 접근하지 않는다.
 */
@Component
public class PermissionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PermissionEvaluator.class);

    private final ScopeRuleRegistry scopeRules;
    private final PermissionConditionEvaluator conditionEvaluator;

    public PermissionEvaluator(ScopeRuleRegistry scopeRules, PermissionConditionEvaluator conditionEvaluator) {
        this.scopeRules = scopeRules;
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * @param contextual true면 조건을 통과한 뒤 조직 경계를 넘는 역할이 범위 규칙보다 먼저 허용된다
     */
    public AccessDecision evaluate(
            EffectivePermissions permissions,
            EvaluationTarget target,
            ResourceType resource,
            PermissionAction action,
            PermissionContext context,
            boolean contextual
    ) {
        if (permissions.hasNoPermissions()) {
            return AccessDecision.deny(ReasonCode.NO_PERMISSIONS);
        }
        if (resource == ResourceType.SYSTEM_SETTINGS) {
            return evaluateSystemSettings(permissions, target, action);
        }

        List<EffectivePermission> matches = permissions.permissions().stream()
                .filter(permission -> permission.matches(resource, action))
                .sorted(Comparator.comparing(permission -> permission.action() == action ? 0 : 1))
                .toList();
        if (matches.isEmpty()) {
            return AccessDecision.deny(ReasonCode.NO_PERMISSION);
        }

        AccessDecision firstDenial = null;
        for (EffectivePermission match : matches) {
            ScopeEvaluation evaluation = evaluateTuple(match, permissions, target, context, contextual);
            if (evaluation.allowed()) {
                return AccessDecision.allow(evaluation.reason(), evaluation.grantedBy());
            }
            if (firstDenial == null) {
                firstDenial = AccessDecision.deny(evaluation.reason());
            }
        }
        return firstDenial;
    }

    private ScopeEvaluation evaluateTuple(
            EffectivePermission match,
            EffectivePermissions permissions,
            EvaluationTarget target,
            PermissionContext context,
            boolean contextual
    ) {
        List<PermissionGrant> grants = conditionEvaluator.satisfiedGrants(match.grants(), context);
        if (grants.isEmpty()) {
            return ScopeEvaluation.denied(ReasonCode.CONTEXT_DENIED);
        }
        if (contextual && permissions.hasCrossOrganizationRole()) {
            return ScopeEvaluation.crossOrganization(permissions);
        }
        return scopeRules.ruleFor(match.scope()).evaluate(target, grants, permissions);
    }

    private AccessDecision evaluateSystemSettings(
            EffectivePermissions permissions,
            EvaluationTarget target,
            PermissionAction action
    ) {
        List<RoleRef> roles = permissions.systemSettingsRoles();
        if (roles.isEmpty()) {
            log.warn("System settings access denied: user={}, action={}", target.callerId(), action);
            return AccessDecision.deny(ReasonCode.SYSTEM_SETTINGS_ACCESS_DENIED);
        }
        if (action == PermissionAction.DELETE || action == PermissionAction.MANAGE) {
            log.warn("Sensitive system settings action: user={}, action={}, roles={}",
                    target.callerId(), action, roles);
        }
        return AccessDecision.allow(ReasonCode.PERMISSION_GRANTED, roles);
    }
}
