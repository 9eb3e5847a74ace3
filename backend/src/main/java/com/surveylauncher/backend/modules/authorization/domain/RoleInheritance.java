package com.surveylauncher.backend.modules.authorization.domain;

import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * role이 inheritedRole의 권한을 물려받는다는 선언 한 건.
 */
@Entity
@Table(name = "role_inheritance")
public class RoleInheritance {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "role_id", nullable = false)
    private Role role;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "inherited_role_id", nullable = false)
    private Role inheritedRole;

    public UUID getId() {
        return id;
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    public Role getInheritedRole() {
        return inheritedRole;
    }

    public void setInheritedRole(Role inheritedRole) {
        this.inheritedRole = inheritedRole;
    }
}
