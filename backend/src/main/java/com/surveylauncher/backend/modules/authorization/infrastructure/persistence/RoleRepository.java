package com.surveylauncher.backend.modules.authorization.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.surveylauncher.backend.modules.authorization.domain.Role;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RoleRepository extends JpaRepository<Role, UUID> {

    Optional<Role> findByName(String name);
}
