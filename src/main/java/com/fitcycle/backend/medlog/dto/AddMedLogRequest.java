package com.fitcycle.backend.medlog.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/** logDate 省略 = 使用者時區的今天 */
public record AddMedLogRequest(
        LocalDate logDate,
        @NotBlank @Size(max = 120) String name,
        @PositiveOrZero BigDecimal amountMg,
        @PositiveOrZero BigDecimal amountMl,
        @Size(max = 500) String note
) {}
