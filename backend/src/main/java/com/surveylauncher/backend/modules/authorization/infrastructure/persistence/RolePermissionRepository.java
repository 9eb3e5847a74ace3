package com.surveylauncher.backend.modules.authorization.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.RolePermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RolePermissionRepository extends JpaRepository<RolePermission, UUID> {

    @Query("""
            select rp
              from RolePermission rp
              join fetch rp.role r
              join fetch rp.permission p
             where r.id in :roleIds
               and rp.active = true
               and p.active = true
             order by p.name
            """)
    List<RolePermission> findActiveByRoleIds(@Param("roleIds") Collection<UUID> roleIds);
}
