package com.surveylauncher.backend.modules.authorization.presentation.dto;

public record CacheCleanupResponse(int removed) {
}
