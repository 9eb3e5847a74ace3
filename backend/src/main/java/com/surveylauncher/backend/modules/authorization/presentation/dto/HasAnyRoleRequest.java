package com.surveylauncher.backend.modules.authorization.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;

public record HasAnyRoleRequest(@NotEmpty List<String> roleNames) {
}
