package com.fitcycle.backend.daystatus.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record WeeklyStatsDto(
        LocalDate from,
        LocalDate to,
        long trainDone,
        long trainSkipped,
        long restDone,
        int recordedDays,
        MacroAverages averages,
        BigDecimal weightChange // 區間內少於兩筆體重 = null
) {
    public record MacroAverages(int kcal, int protein, int fat, int carbs) {}
}
