package com.fitcycle.backend.progression.repo;

import com.fitcycle.backend.progression.entity.ProgressionOverrideEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProgressionOverrideRepository extends JpaRepository<ProgressionOverrideEntity, Long> {

    Optional<ProgressionOverrideEntity> findByUserIdAndNameKey(Long userId, String nameKey);

    List<ProgressionOverrideEntity> findByUserIdAndNameKeyIn(Long userId, Collection<String> nameKeys);

    List<ProgressionOverrideEntity> findByUserIdOrderByExerciseNameAsc(Long userId);
}
