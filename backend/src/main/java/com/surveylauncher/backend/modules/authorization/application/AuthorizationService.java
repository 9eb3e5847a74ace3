package com.surveylauncher.backend.modules.authorization.application;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

import com.surveylauncher.backend.global.config.AuthorizationProperties;
import com.surveylauncher.backend.modules.authorization.application.scope.EvaluationTarget;
import com.surveylauncher.backend.modules.authorization.domain.AccessDecision;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermission;
import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;
import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.PermissionContext;
import com.surveylauncher.backend.modules.authorization.domain.ReasonCode;
import com.surveylauncher.backend.modules.authorization.domain.ResourceRef;
import com.surveylauncher.backend.modules.authorization.domain.ResourceType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 권한 엔진 진입점.
 *
 * <p>판정 메서드는 예외를 던지지 않는다. 잘못된 사용자 ID와 저장소 오류는 {@code NO_PERMISSIONS},
 * 그 밖의 오류는 {@code SYSTEM_ERROR}로 거부된다.
 */
@Service
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    private final EffectivePermissionService effectivePermissionService;
    private final PermissionEvaluator permissionEvaluator;
    private final RoleHierarchyComparator hierarchyComparator;
    private final AssignmentResolver assignmentResolver;
    private final Duration slowCheckThreshold;

    public AuthorizationService(
            EffectivePermissionService effectivePermissionService,
            PermissionEvaluator permissionEvaluator,
            RoleHierarchyComparator hierarchyComparator,
            AssignmentResolver assignmentResolver,
            AuthorizationProperties properties
    ) {
        this.effectivePermissionService = effectivePermissionService;
        this.permissionEvaluator = permissionEvaluator;
        this.hierarchyComparator = hierarchyComparator;
        this.assignmentResolver = assignmentResolver;
        this.slowCheckThreshold = properties.slowCheckThreshold();
    }

    public AccessDecision checkPermission(
            String userId,
            ResourceType resource,
            PermissionAction action,
            PermissionContext context
    ) {
        return decide("checkPermission", userId, resource, action, context,
                (callerId, permissions) -> permissionEvaluator.evaluate(
                        permissions, EvaluationTarget.of(callerId, context), resource, action, context, false));
    }

    public AccessDecision checkContextualAccess(
            String userId,
            ResourceRef resource,
            PermissionAction action,
            PermissionContext context
    ) {
        ResourceType type = resource == null ? null : resource.type();
        return decide("checkContextualAccess", userId, type, action, context,
                (callerId, permissions) -> permissionEvaluator.evaluate(
                        permissions, EvaluationTarget.of(callerId, resource, context), type, action, context, true));
    }

    public EffectivePermissions computeEffectivePermissions(UUID userId, AssignmentFilter filter, boolean bypassCache) {
        return effectivePermissionService.compute(userId, filter, bypassCache);
    }

    public void invalidatePermissionCache(UUID userId) {
        effectivePermissionService.invalidate(userId);
    }

    public int cleanupExpiredCache() {
        return effectivePermissionService.cleanupExpired();
    }

    public boolean canRolePerformAction(String actorRoleName, String targetRoleName, PermissionAction action) {
        try {
            return hierarchyComparator.canRolePerformAction(actorRoleName, targetRoleName, action);
        } catch (RuntimeException ex) {
            log.error("Role hierarchy check failed: actor={}, target={}, action={}",
                    actorRoleName, targetRoleName, action, ex);
            return false;
        }
    }

    public int getUserHighestRoleLevel(String userId) {
        Optional<UUID> parsed = parseUserId(userId);
        if (parsed.isEmpty()) {
            return RoleHierarchyComparator.NO_ROLE_LEVEL;
        }
        try {
            return hierarchyComparator.getUserHighestRoleLevel(parsed.get());
        } catch (RuntimeException ex) {
            log.error("Highest role level lookup failed: user={}", userId, ex);
            return RoleHierarchyComparator.NO_ROLE_LEVEL;
        }
    }

    public boolean hasAnyRole(String userId, Collection<String> roleNames) {
        Optional<UUID> parsed = parseUserId(userId);
        if (parsed.isEmpty() || roleNames == null || roleNames.isEmpty()) {
            return false;
        }
        Set<String> wanted = roleNames.stream().collect(Collectors.toSet());
        try {
            return assignmentResolver.resolveValidAssignments(parsed.get(), AssignmentFilter.none()).stream()
                    .anyMatch(assignment -> wanted.contains(assignment.getRole().getName()));
        } catch (RuntimeException ex) {
            log.error("Role membership check failed: user={}, roles={}", userId, roleNames, ex);
            return false;
        }
    }

    /**
     * 사용자의 유효 권한 튜플. resource가 있으면 해당 리소스만 돌려준다.
     */
    public List<EffectivePermission> findPermissions(UUID userId, ResourceType resource) {
        EffectivePermissions permissions = effectivePermissionService.resolve(userId).permissions();
        return permissions.permissions().stream()
                .filter(permission -> resource == null || permission.resource() == resource)
                .toList();
    }

    private AccessDecision decide(
            String operation,
            String userId,
            ResourceType resource,
            PermissionAction action,
            PermissionContext context,
            BiFunction<UUID, EffectivePermissions, AccessDecision> evaluation
    ) {
        long started = System.nanoTime();
        Boolean cacheHit = null;
        try {
            Optional<UUID> callerId = parseUserId(userId);
            if (callerId.isEmpty()) {
                log.warn("{} denied for malformed user id '{}'", operation, userId);
                return AccessDecision.deny(ReasonCode.NO_PERMISSIONS).withTiming(null, elapsedMs(started));
            }
            if (resource == null || action == null) {
                return AccessDecision.deny(ReasonCode.NO_PERMISSION).withTiming(null, elapsedMs(started));
            }

            ResolvedPermissions resolved = effectivePermissionService.resolve(callerId.get());
            cacheHit = resolved.cacheHit();
            AccessDecision decision = evaluation.apply(callerId.get(), resolved.permissions())
                    .withTiming(cacheHit, elapsedMs(started));
            logDecision(operation, userId, resource, action, context, decision);
            return decision;
        } catch (DataAccessException ex) {
            log.error("{} failed on permission store: user={}, resource={}, action={}, context={}",
                    operation, userId, resource, action, context, ex);
            return AccessDecision.deny(ReasonCode.NO_PERMISSIONS).withTiming(cacheHit, elapsedMs(started));
        } catch (RuntimeException ex) {
            log.error("{} failed: user={}, resource={}, action={}, context={}",
                    operation, userId, resource, action, context, ex);
            return AccessDecision.deny(ReasonCode.SYSTEM_ERROR).withTiming(cacheHit, elapsedMs(started));
        }
    }

    private void logDecision(
            String operation,
            String userId,
            ResourceType resource,
            PermissionAction action,
            PermissionContext context,
            AccessDecision decision
    ) {
        if (decision.allowed()) {
            log.debug("{} granted: user={}, resource={}, action={}, reason={}, cacheHit={}",
                    operation, userId, resource, action, decision.reason(), decision.cacheHit());
        } else {
            log.info("{} denied: user={}, resource={}, action={}, reason={}, context={}",
                    operation, userId, resource, action, decision.reason(), context);
        }
        if (decision.evaluationTimeMs() > slowCheckThreshold.toNanos() / 1_000_000.0) {
            log.warn("Slow authorization check: {} took {} ms (user={}, cacheHit={})",
                    operation, String.format("%.2f", decision.evaluationTimeMs()), userId, decision.cacheHit());
        }
    }

    private static Optional<UUID> parseUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(userId.trim()));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    private static double elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }
}
