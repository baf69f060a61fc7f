package com.fitcycle.backend.progress.dto;

import com.fitcycle.backend.progress.entity.BodyProgressLog;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ProgressItemDto(
        Long id,
        LocalDate logDate,
        BigDecimal weight,
        BigDecimal waist,
        BigDecimal belly,
        BigDecimal biceps,
        BigDecimal chest,
        String note
) {
    public static ProgressItemDto of(BodyProgressLog p) {
        return new ProgressItemDto(p.getId(), p.getLogDate(), p.getWeight(), p.getWaist(),
                p.getBelly(), p.getBiceps(), p.getChest(), p.getNote());
    }
}
