package com.surveylauncher.backend.modules.authorization.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.RoleInheritance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RoleInheritanceRepository extends JpaRepository<RoleInheritance, UUID> {

    /**
     * 주어진 역할들이 직접 물려받는 활성 역할. 비활성 역할은 상속 경로에서도 빠진다.
     */
    @Query("""
            select ri
              from RoleInheritance ri
              join fetch ri.role r
              join fetch ri.inheritedRole ir
             where r.id in :roleIds
               and ir.active = true
             order by ir.hierarchyLevel desc, ir.name
            """)
    List<RoleInheritance> findActiveParentsOf(@Param("roleIds") Collection<UUID> roleIds);
}
