package com.fitcycle.backend.progress.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/** 只更新有給的欄位 */
public record UpdateProgressRequest(
        LocalDate logDate,
        BigDecimal weight,
        BigDecimal waist,
        BigDecimal belly,
        BigDecimal biceps,
        BigDecimal chest,
        String note
) {}
