package com.surveylauncher.backend.modules.authorization.domain;

import java.util.UUID;

public record RoleRef(UUID roleId, String name) {
}
