package com.fitcycle.backend.medlog.dto;

import com.fitcycle.backend.medlog.entity.MedLog;

import java.math.BigDecimal;
import java.time.LocalDate;

public record MedLogItemDto(
        Long id,
        LocalDate logDate,
        String name,
        BigDecimal amountMg,
        BigDecimal amountMl,
        String note
) {
    public static MedLogItemDto of(MedLog m) {
        return new MedLogItemDto(m.getId(), m.getLogDate(), m.getName(),
                m.getAmountMg(), m.getAmountMl(), m.getNote());
    }
}
