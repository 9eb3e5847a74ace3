package com.surveylauncher.backend.modules.authorization.presentation.dto;

public record BooleanResultResponse(boolean result) {
}
