package com.surveylauncher.backend.modules.authorization.application.scope;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.surveylauncher.backend.modules.authorization.domain.PermissionScope;

import org.springframework.stereotype.Component;

@Component
public class ScopeRuleRegistry {

    private final Map<PermissionScope, ScopeRule> rules = new EnumMap<>(PermissionScope.class);

    public ScopeRuleRegistry(List<ScopeRule> scopeRules) {
        for (ScopeRule rule : scopeRules) {
            ScopeRule previous = rules.put(rule.scope(), rule);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scope rule for " + rule.scope());
            }
        }
        for (PermissionScope scope : PermissionScope.values()) {
            if (!rules.containsKey(scope)) {
                throw new IllegalStateException("Missing scope rule for " + scope);
            }
        }
    }

    public static ScopeRuleRegistry withDefaultRules() {
        return new ScopeRuleRegistry(List.of(
                new SystemScopeRule(),
                new OrganizationScopeRule(),
                new TeamScopeRule(),
                new RegionScopeRule(),
                new UserScopeRule()
        ));
    }

    public ScopeRule ruleFor(PermissionScope scope) {
        return rules.get(scope);
    }
}
