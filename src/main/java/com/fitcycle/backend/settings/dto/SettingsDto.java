package com.fitcycle.backend.settings.dto;

import java.time.LocalDate;

public record SettingsDto(
        LocalDate cycleStartDate,
        String timezone,
        LocalDate today
) {}
