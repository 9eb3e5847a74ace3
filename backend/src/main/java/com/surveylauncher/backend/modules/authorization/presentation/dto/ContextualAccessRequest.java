package com.surveylauncher.backend.modules.authorization.presentation.dto;

import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.PermissionAction;
import com.surveylauncher.backend.modules.authorization.domain.ResourceRef;
import com.surveylauncher.backend.modules.authorization.domain.ResourceType;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ContextualAccessRequest(
        @NotBlank String userId,
        @NotNull @Valid ResourceRefRequest resource,
        @NotNull PermissionAction action,
        @Valid PermissionContextRequest context
) {

    public record ResourceRefRequest(
            @NotNull ResourceType type,
            UUID organizationId,
            UUID teamId,
            @Size(max = 32) String regionId
    ) {

        public ResourceRef toResourceRef() {
            return new ResourceRef(type, organizationId, teamId, regionId);
        }
    }
}
