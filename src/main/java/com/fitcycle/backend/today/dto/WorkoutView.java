package com.fitcycle.backend.today.dto;

import com.fitcycle.backend.plan.model.Level;
import com.fitcycle.backend.progression.service.OverlaidExercise;

import java.util.List;
import java.util.Map;

public record WorkoutView(
        String title,
        Map<Level, List<OverlaidExercise>> levels
) {}
