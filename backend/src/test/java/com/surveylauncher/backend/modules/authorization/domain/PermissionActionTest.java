package com.surveylauncher.backend.modules.authorization.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PermissionActionTest {

    @ParameterizedTest
    @EnumSource(value = PermissionAction.class, names = {"CREATE", "READ", "UPDATE", "DELETE", "LIST", "MANAGE"})
    @DisplayName("MANAGE는 CRUD/LIST/MANAGE를 포함한다")
    void manageCoversCrudAndList(PermissionAction requested) {
        assertThat(PermissionAction.MANAGE.covers(requested)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = PermissionAction.class, names = {"EXECUTE", "AUDIT"})
    @DisplayName("EXECUTE, AUDIT은 MANAGE로 대체되지 않는다")
    void manageDoesNotCoverSeparateCapabilities(PermissionAction requested) {
        assertThat(PermissionAction.MANAGE.covers(requested)).isFalse();
        assertThat(requested.covers(requested)).isTrue();
    }

    @Test
    @DisplayName("MANAGE가 아닌 액션은 자기 자신만 포함한다")
    void otherActionsCoverOnlyThemselves() {
        assertThat(PermissionAction.UPDATE.covers(PermissionAction.READ)).isFalse();
        assertThat(PermissionAction.READ.covers(PermissionAction.MANAGE)).isFalse();
    }

    @Test
    @DisplayName("조회 계열은 READ, LIST, AUDIT")
    void readClassActions() {
        assertThat(PermissionAction.READ.isReadClass()).isTrue();
        assertThat(PermissionAction.LIST.isReadClass()).isTrue();
        assertThat(PermissionAction.AUDIT.isReadClass()).isTrue();
        assertThat(PermissionAction.MANAGE.isReadClass()).isFalse();
        assertThat(PermissionAction.EXECUTE.isReadClass()).isFalse();
    }
}
