package com.schoolmate.backend.modules.school.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.schoolmate.backend.modules.school.domain.School;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SchoolRepository extends JpaRepository<School, UUID> {

    Optional<School> findBySubdomainIgnoreCase(String subdomain);
}
