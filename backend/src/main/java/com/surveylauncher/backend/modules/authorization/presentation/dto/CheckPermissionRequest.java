package com.surveylauncher.backend.modules.authorization.presentation.dto;

import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.ResourceType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CheckPermissionRequest(
        @NotBlank String userId,
        @NotNull ResourceType resource,
        @NotNull PermissionAction action,
        @Valid PermissionContextRequest context
) {
}
