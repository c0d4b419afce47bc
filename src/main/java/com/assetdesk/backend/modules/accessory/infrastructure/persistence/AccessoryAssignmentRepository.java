package com.assetdesk.backend.modules.accessory.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.assetdesk.backend.modules.accessory.domain.AccessoryAssignment;

public interface AccessoryAssignmentRepository extends JpaRepository<AccessoryAssignment, Long> {

    long countByAccessoryId(Long accessoryId);

    List<AccessoryAssignment> findByAccessoryIdOrderByIdAsc(Long accessoryId);
}
