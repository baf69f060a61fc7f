package com.fitcycle.backend.daystatus.dto;

import com.fitcycle.backend.daystatus.model.AttendanceMark;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/** 只列出有紀錄的日子；沒碰過的日期不算進 counts */
public record AttendanceDto(
        LocalDate from,
        LocalDate to,
        Map<AttendanceMark, Long> counts,
        List<DayStatusDto> days
) {}
