package com.fitcycle.backend.autoprog.dto;

import com.fitcycle.backend.autoprog.model.RuleState;

import java.time.LocalDate;

public record AutoprogRuleDto(
        Long id,
        String workoutKey,
        String exerciseName,
        String deltaText,
        int intervalDays,
        LocalDate lastAppliedDate,
        LocalDate nextDueDate,
        RuleState state
) {}
