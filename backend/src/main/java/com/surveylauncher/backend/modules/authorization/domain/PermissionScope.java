package com.surveylauncher.backend.modules.authorization.domain;

public enum PermissionScope {
    ORGANIZATION,
    REGION,
    TEAM,
    USER,
    SYSTEM
}
