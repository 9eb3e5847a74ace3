package com.surveylauncher.backend.modules.authorization.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.UserRoleAssignment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserRoleAssignmentRepository extends JpaRepository<UserRoleAssignment, UUID> {

    @Query("""
            select ura
              from UserRoleAssignment ura
              join fetch ura.role r
             where ura.userId = :userId
               and ura.active = true
               and r.active = true
               and (ura.expiresAt is null or ura.expiresAt > :now)
             order by r.hierarchyLevel desc, ura.grantedAt asc
            """)
    List<UserRoleAssignment> findValidAssignments(
            @Param("userId") UUID userId,
            @Param("now") OffsetDateTime now
    );

    List<UserRoleAssignment> findByUserId(UUID userId);
}
