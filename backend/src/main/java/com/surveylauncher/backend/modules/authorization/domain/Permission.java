package com.surveylauncher.backend.modules.authorization.domain;

import java.util.UUID;

import com.surveylauncher.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * (resource, action, scope) 권한 튜플 정의.
 */
@Entity
@Table(name = "permission")
public class Permission extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 128)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "resource", nullable = false, length = 32)
    private ResourceType resource;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 16)
    private PermissionAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", nullable = false, length = 16)
    private PermissionScope scope;

    @Column(name = "description", length = 255)
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "conditions", columnDefinition = "jsonb")
    private PermissionConditions conditions;

    // TEAM 범위이지만 같은 조직의 다른 팀에도 적용
    @Column(name = "cross_team", nullable = false)
    private boolean crossTeam;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ResourceType getResource() {
        return resource;
    }

    public void setResource(ResourceType resource) {
        this.resource = resource;
    }

    public PermissionAction getAction() {
        return action;
    }

    public void setAction(PermissionAction action) {
        this.action = action;
    }

    public PermissionScope getScope() {
        return scope;
    }

    public void setScope(PermissionScope scope) {
        this.scope = scope;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public PermissionConditions getConditions() {
        return conditions;
    }

    public void setConditions(PermissionConditions conditions) {
        this.conditions = conditions;
    }

    public boolean isCrossTeam() {
        return crossTeam;
    }

    public void setCrossTeam(boolean crossTeam) {
        this.crossTeam = crossTeam;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
