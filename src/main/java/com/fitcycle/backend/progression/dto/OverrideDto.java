package com.fitcycle.backend.progression.dto;

import com.fitcycle.backend.progression.entity.ProgressionOverrideEntity;
import com.fitcycle.backend.progression.model.OverrideSource;

import java.time.Instant;

public record OverrideDto(
        String exerciseName,
        String deltaText,
        OverrideSource source,
        Instant appliedAt
) {
    public static OverrideDto of(ProgressionOverrideEntity e) {
        return new OverrideDto(e.getExerciseName(), e.getDeltaText(), e.getSource(), e.getAppliedAt());
    }
}
