package com.surveylauncher.backend.modules.authorization.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.AccessDecision;

public record AccessDecisionResponse(
        boolean allowed,
        String reason,
        List<GrantedRole> grantedBy,
        Boolean cacheHit,
        double evaluationTime
) {

    public static AccessDecisionResponse from(AccessDecision decision) {
        List<GrantedRole> roles = decision.grantedBy().stream()
                .map(role -> new GrantedRole(role.roleId(), role.name()))
                .toList();
        return new AccessDecisionResponse(
                decision.allowed(),
                decision.reason().name(),
                roles,
                decision.cacheHit(),
                decision.evaluationTimeMs()
        );
    }

    public record GrantedRole(UUID roleId, String roleName) {
    }
}
