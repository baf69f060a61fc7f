package com.fitcycle.backend.settings.dto;

import jakarta.validation.constraints.NotBlank;

public record SetTimezoneRequest(@NotBlank String timezone) {}
