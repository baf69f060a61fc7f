package com.fitcycle.backend.progression.dto;

public record SetOverrideRequest(
        String exerciseName,
        String deltaText
) {}
