package com.surveylauncher.backend.modules.authorization.presentation.dto;

public record RoleLevelResponse(String userId, int level) {
}
