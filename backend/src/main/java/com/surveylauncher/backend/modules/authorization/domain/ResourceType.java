package com.surveylauncher.backend.modules.authorization.domain;

/**
 * 권한 판정 대상 리소스 분류.
 */
public enum ResourceType {
    TEAMS,
    USERS,
    DEVICES,
    SUPERVISOR_PINS,
    TELEMETRY,
    POLICY,
    AUTH,
    SYSTEM_SETTINGS,
    AUDIT_LOGS,
    SUPPORT_TICKETS,
    ORGANIZATION,
    PROJECTS
}
