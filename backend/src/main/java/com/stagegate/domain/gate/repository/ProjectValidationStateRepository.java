package com.stagegate.domain.gate.repository;

import com.stagegate.domain.gate.model.ProjectValidationState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ProjectValidationStateRepository extends JpaRepository<ProjectValidationState, Long> {

    Optional<ProjectValidationState> findByTenantIdAndProjectId(String tenantId, String projectId);

    boolean existsByProjectId(String projectId);
}
