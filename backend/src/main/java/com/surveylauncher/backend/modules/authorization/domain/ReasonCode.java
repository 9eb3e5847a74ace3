package com.surveylauncher.backend.modules.authorization.domain;

/**
 * 모든 판정 결과에 기록되는 사유 코드. 호출 측 감사 로그와 계약된 값이므로 이름을 바꾸지 않는다.
 */
public enum ReasonCode {
    PERMISSION_GRANTED,
    NO_PERMISSIONS,
    NO_PERMISSION,
    TEAM_SCOPE_VIOLATION,
    ORGANIZATION_SCOPE_VIOLATION,
    CONTEXT_DENIED,
    SYSTEM_SETTINGS_ACCESS_DENIED,
    SYSTEM_ADMIN_CROSS_TEAM_ACCESS,
    NATIONAL_SUPPORT_ADMIN_CROSS_TEAM_ACCESS,
    SYSTEM_ERROR
}
