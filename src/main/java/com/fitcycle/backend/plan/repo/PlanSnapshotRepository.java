package com.fitcycle.backend.plan.repo;

import com.fitcycle.backend.plan.entity.PlanSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PlanSnapshotRepository extends JpaRepository<PlanSnapshotEntity, Long> {

    Optional<PlanSnapshotEntity> findTopByOrderByVersionDescIdDesc();
}
