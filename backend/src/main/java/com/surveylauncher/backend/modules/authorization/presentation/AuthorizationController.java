package com.surveylauncher.backend.modules.authorization.presentation;

import java.util.List;
import java.util.UUID;

import com.surveylauncher.backend.global.error.ProblemException;
import com.surveylauncher.backend.global.web.RequestIdFilter;
import com.surveylauncher.backend.modules.authorization.application.AssignmentFilter;
import com.surveylauncher.backend.modules.authorization.application.AuthorizationService;
import com.surveylauncher.backend.modules.authorization.domain.AccessDecision;
import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.PermissionContext;
import com.surveylauncher.backend.modules.authorization.domain.ResourceType;
import com.surveylauncher.backend.modules.authorization.presentation.dto.AccessDecisionResponse;
import com.surveylauncher.backend.modules.authorization.presentation.dto.BooleanResultResponse;
import com.surveylauncher.backend.modules.authorization.presentation.dto.CacheCleanupResponse;
import com.surveylauncher.backend.modules.authorization.presentation.dto.CheckPermissionRequest;
import com.surveylauncher.backend.modules.authorization.presentation.dto.ContextualAccessRequest;
import com.surveylauncher.backend.modules.authorization.presentation.dto.EffectivePermissionResponse;
import com.surveylauncher.backend.modules.authorization.presentation.dto.EffectivePermissionsResponse;
import com.surveylauncher.backend.modules.authorization.presentation.dto.HasAnyRoleRequest;
import com.surveylauncher.backend.modules.authorization.presentation.dto.PermissionContextRequest;
import com.surveylauncher.backend.modules.authorization.presentation.dto.RoleLevelResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 별도 배포된 권한 엔진을 위한 내부 API. 인증은 앞단 게이트웨이가 담당한다.
 */
@RestController
@RequestMapping("/internal/authorization")
@Tag(name = "Authorization", description = "권한 판정 내부 API")
public class AuthorizationController {

    private final AuthorizationService authorizationService;

    public AuthorizationController(AuthorizationService authorizationService) {
        this.authorizationService = authorizationService;
    }

    @Operation(summary = "권한 판정", description = "사용자가 리소스에 대해 액션을 수행할 수 있는지 판정한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "판정 결과(거부 포함)"),
            @ApiResponse(responseCode = "422", description = "요청 본문 검증 실패")
    })
    @PostMapping("/check")
    public ResponseEntity<AccessDecisionResponse> checkPermission(@Valid @RequestBody CheckPermissionRequest request) {
        AccessDecision decision = authorizationService.checkPermission(
                request.userId(),
                request.resource(),
                request.action(),
                toContext(request.context())
        );
        return ResponseEntity.ok(AccessDecisionResponse.from(decision));
    }

    @Operation(summary = "리소스 문맥 판정", description = "리소스가 속한 조직/팀/지역을 기준으로 판정한다.")
    @PostMapping("/contextual-check")
    public ResponseEntity<AccessDecisionResponse> checkContextualAccess(
            @Valid @RequestBody ContextualAccessRequest request
    ) {
        AccessDecision decision = authorizationService.checkContextualAccess(
                request.userId(),
                request.resource().toResourceRef(),
                request.action(),
                toContext(request.context())
        );
        return ResponseEntity.ok(AccessDecisionResponse.from(decision));
    }

    @Operation(summary = "유효 권한 계산", description = "organizationId/teamId로 좁히면 캐시에 기록하지 않는다.")
    @GetMapping("/users/{userId}/effective-permissions")
    public ResponseEntity<EffectivePermissionsResponse> computeEffectivePermissions(
            @PathVariable("userId") String userId,
            @RequestParam(name = "organizationId", required = false) UUID organizationId,
            @RequestParam(name = "teamId", required = false) UUID teamId,
            @RequestParam(name = "bypassCache", defaultValue = "false") boolean bypassCache
    ) {
        EffectivePermissionsResponse response = EffectivePermissionsResponse.from(
                authorizationService.computeEffectivePermissions(
                        parseUserId(userId),
                        new AssignmentFilter(organizationId, teamId),
                        bypassCache
                )
        );
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "유효 권한 조회", description = "resource를 지정하면 해당 리소스의 튜플만 반환한다.")
    @GetMapping("/users/{userId}/permissions")
    public ResponseEntity<List<EffectivePermissionResponse>> findPermissions(
            @PathVariable("userId") String userId,
            @RequestParam(name = "resource", required = false) ResourceType resource
    ) {
        List<EffectivePermissionResponse> items = authorizationService.findPermissions(parseUserId(userId), resource)
                .stream()
                .map(EffectivePermissionResponse::from)
                .toList();
        return ResponseEntity.ok(items);
    }

    @Operation(summary = "권한 캐시 무효화", description = "역할 할당 변경 직후 호출한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "무효화 완료"),
            @ApiResponse(responseCode = "400", description = "잘못된 사용자 ID")
    })
    @DeleteMapping("/users/{userId}/cache")
    public ResponseEntity<Void> invalidatePermissionCache(@PathVariable("userId") String userId) {
        authorizationService.invalidatePermissionCache(parseUserId(userId));
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/users/{userId}/highest-role-level")
    public ResponseEntity<RoleLevelResponse> getUserHighestRoleLevel(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(new RoleLevelResponse(userId, authorizationService.getUserHighestRoleLevel(userId)));
    }

    @PostMapping("/users/{userId}/has-any-role")
    public ResponseEntity<BooleanResultResponse> hasAnyRole(
            @PathVariable("userId") String userId,
            @Valid @RequestBody HasAnyRoleRequest request
    ) {
        boolean result = authorizationService.hasAnyRole(userId, request.roleNames());
        return ResponseEntity.ok(new BooleanResultResponse(result));
    }

    @Operation(summary = "역할 계층 비교", description = "조회 계열 액션은 동급 이상, 그 외는 상위 역할만 허용한다.")
    @GetMapping("/roles/compare")
    public ResponseEntity<BooleanResultResponse> canRolePerformAction(
            @RequestParam("actor") String actorRoleName,
            @RequestParam("target") String targetRoleName,
            @RequestParam("action") PermissionAction action
    ) {
        boolean result = authorizationService.canRolePerformAction(actorRoleName, targetRoleName, action);
        return ResponseEntity.ok(new BooleanResultResponse(result));
    }

    @PostMapping("/cache/cleanup")
    public ResponseEntity<CacheCleanupResponse> cleanupExpiredCache() {
        return ResponseEntity.ok(new CacheCleanupResponse(authorizationService.cleanupExpiredCache()));
    }

    private PermissionContext toContext(PermissionContextRequest request) {
        String requestId = RequestIdFilter.currentRequestId();
        if (request == null) {
            return PermissionContext.empty().withRequestId(requestId);
        }
        return request.toContext(requestId);
    }

    private UUID parseUserId(String userId) {
        try {
            return UUID.fromString(userId.trim());
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_USER_ID", "userId must be a UUID: " + userId);
        }
    }
}
