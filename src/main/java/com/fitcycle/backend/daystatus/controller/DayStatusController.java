package com.fitcycle.backend.daystatus.controller;

import com.fitcycle.backend.auth.security.AuthContext;
import com.fitcycle.backend.daystatus.dto.AttendanceDto;
import com.fitcycle.backend.daystatus.dto.CommentRequest;
import com.fitcycle.backend.daystatus.dto.DayStatusDto;
import com.fitcycle.backend.daystatus.dto.WeeklyStatsDto;
import com.fitcycle.backend.daystatus.service.DayStatusService;
import com.fitcycle.backend.settings.service.UserSettingsService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/v1/days")
public class DayStatusController {

    private final AuthContext auth;
    private final DayStatusService svc;
    private final UserSettingsService settings;

    public DayStatusController(AuthContext auth, DayStatusService svc, UserSettingsService settings) {
        this.auth = auth; this.svc = svc; this.settings = settings;
    }

    @GetMapping(value = "/today", produces = MediaType.APPLICATION_JSON_VALUE)
    public DayStatusDto today() {
        Long uid = auth.requireUserId();
        LocalDate today = settings.today(uid);
        return svc.day(uid, today, today);
    }

    @GetMapping(value = "/{date}", produces = MediaType.APPLICATION_JSON_VALUE)
    public DayStatusDto day(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Long uid = auth.requireUserId();
        return svc.day(uid, date, settings.today(uid));
    }

    @PostMapping(value = "/{date}/done", produces = MediaType.APPLICATION_JSON_VALUE)
    public DayStatusDto done(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Long uid = auth.requireUserId();
        return svc.markDone(uid, date, settings.today(uid));
    }

    @PostMapping(value = "/{date}/skip", produces = MediaType.APPLICATION_JSON_VALUE)
    public DayStatusDto skip(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Long uid = auth.requireUserId();
        return svc.markSkipped(uid, date, settings.today(uid));
    }

    @PutMapping(value = "/{date}/comment", produces = MediaType.APPLICATION_JSON_VALUE)
    public DayStatusDto comment(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                @Valid @RequestBody CommentRequest req) {
        Long uid = auth.requireUserId();
        return svc.comment(uid, date, req.note(), settings.today(uid));
    }

    /** 沒給區間 = 使用者當地的這個月 */
    @GetMapping(value = "/attendance", produces = MediaType.APPLICATION_JSON_VALUE)
    public AttendanceDto attendance(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        Long uid = auth.requireUserId();
        LocalDate today = settings.today(uid);
        if (from == null && to == null) {
            from = today.withDayOfMonth(1);
            to = today.withDayOfMonth(today.lengthOfMonth());
        }
        return svc.attendance(uid, from, to, today);
    }

    @GetMapping(value = "/stats/week", produces = MediaType.APPLICATION_JSON_VALUE)
    public WeeklyStatsDto weeklyStats() {
        Long uid = auth.requireUserId();
        return svc.weeklyStats(uid, settings.today(uid));
    }
}
