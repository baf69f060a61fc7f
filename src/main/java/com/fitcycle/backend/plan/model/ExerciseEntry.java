package com.fitcycle.backend.plan.model;

/**
 * 計畫中的單一動作（套用 progression 之前的原始值）。
 * reps 保留字串：sheet 裡常見 "8-10"、"до отказа" 這類寫法。
 */
public record ExerciseEntry(
        String name,
        int sets,
        String reps,
        String weight // nullable
) {}
