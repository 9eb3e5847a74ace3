package com.surveylauncher.backend.modules.authorization.domain;

import java.util.EnumSet;
import java.util.Set;

public enum PermissionAction {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    LIST,
    MANAGE,
    EXECUTE,
    AUDIT;

    private static final Set<PermissionAction> MANAGE_COVERS =
            EnumSet.of(CREATE, READ, UPDATE, DELETE, LIST, MANAGE);

    private static final Set<PermissionAction> READ_CLASS = EnumSet.of(READ, LIST, AUDIT);

    /**
     * 이 액션을 부여받은 역할이 {@code requested} 액션을 수행할 수 있는지 여부.
     * MANAGE는 CRUD/LIST를 포함하지만 EXECUTE, AUDIT은 별도로 부여해야 한다.
     */
    public boolean covers(PermissionAction requested) {
        if (this == requested) {
            return true;
        }
        return this == MANAGE && MANAGE_COVERS.contains(requested);
    }

    /**
     * 조회 계열 액션은 동급 역할끼리 허용된다.
     */
    public boolean isReadClass() {
        return READ_CLASS.contains(this);
    }
}
