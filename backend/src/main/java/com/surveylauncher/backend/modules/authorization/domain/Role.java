package com.surveylauncher.backend.modules.authorization.domain;

import java.util.UUID;

import com.surveylauncher.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * 권한 묶음 단위 역할. 계층 레벨이 높을수록 강한 역할이다.
 */
@Entity
@Table(name = "role")
public class Role extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 64)
    private String name;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "hierarchy_level", nullable = false)
    private int hierarchyLevel;

    @Column(name = "system_role", nullable = false)
    private boolean systemRole;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    // 조직 경계를 넘어 모든 팀/지역 리소스에 접근 가능
    @Column(name = "cross_organization_access", nullable = false)
    private boolean crossOrganizationAccess;

    // SYSTEM_SETTINGS 리소스 접근 가능
    @Column(name = "system_settings_access", nullable = false)
    private boolean systemSettingsAccess;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getHierarchyLevel() {
        return hierarchyLevel;
    }

    public void setHierarchyLevel(int hierarchyLevel) {
        this.hierarchyLevel = hierarchyLevel;
    }

    public boolean isSystemRole() {
        return systemRole;
    }

    public void setSystemRole(boolean systemRole) {
        this.systemRole = systemRole;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isCrossOrganizationAccess() {
        return crossOrganizationAccess;
    }

    public void setCrossOrganizationAccess(boolean crossOrganizationAccess) {
        this.crossOrganizationAccess = crossOrganizationAccess;
    }

    public boolean isSystemSettingsAccess() {
        return systemSettingsAccess;
    }

    public void setSystemSettingsAccess(boolean systemSettingsAccess) {
        this.systemSettingsAccess = systemSettingsAccess;
    }
}
