package com.fitcycle.backend.settings.dto;

import jakarta.validation.constraints.NotBlank;

/** date: "2026-02-02" 或 "today" */
public record SetCycleStartRequest(@NotBlank String date) {}
