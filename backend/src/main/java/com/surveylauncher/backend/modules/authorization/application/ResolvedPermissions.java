package com.surveylauncher.backend.modules.authorization.application;

import com.surveylauncher.backend.modules.authorization.domain.EffectivePermissions;

public record ResolvedPermissions(EffectivePermissions permissions, boolean cacheHit) {
}
