package com.fitcycle.backend.progress.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

/** logDate 省略 = 使用者時區的今天 */
public record AddProgressRequest(
        LocalDate logDate,
        @NotNull @Positive BigDecimal weight,
        @NotNull @Positive BigDecimal waist,
        @NotNull @Positive BigDecimal belly,
        @NotNull @Positive BigDecimal biceps,
        @NotNull @Positive BigDecimal chest,
        @Size(max = 500) String note
) {}
