package com.surveylauncher.backend.modules.authorization.domain;

import java.util.UUID;

/**
 * 문맥 판정 대상 리소스. 값이 있는 필드는 요청 컨텍스트의 같은 필드보다 우선한다.
 */
public record ResourceRef(
        ResourceType type,
        UUID organizationId,
        UUID teamId,
        String regionId
) {

    public ResourceRef {
        if (type == null) {
            throw new IllegalArgumentException("resource type is required");
        }
    }

    public static ResourceRef ofTeam(ResourceType type, UUID organizationId, UUID teamId) {
        return new ResourceRef(type, organizationId, teamId, null);
    }
}
