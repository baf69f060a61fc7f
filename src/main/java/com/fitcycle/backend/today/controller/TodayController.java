package com.fitcycle.backend.today.controller;

import com.fitcycle.backend.auth.security.AuthContext;
import com.fitcycle.backend.settings.service.UserSettingsService;
import com.fitcycle.backend.today.dto.DayPlanView;
import com.fitcycle.backend.today.service.DailyPlanAssembler;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/v1/plan")
public class TodayController {

    private final AuthContext auth;
    private final DailyPlanAssembler assembler;
    private final UserSettingsService settings;

    public TodayController(AuthContext auth, DailyPlanAssembler assembler, UserSettingsService settings) {
        this.auth = auth;
        this.assembler = assembler;
        this.settings = settings;
    }

    @GetMapping(value = "/today", produces = MediaType.APPLICATION_JSON_VALUE)
    public DayPlanView today() {
        Long uid = auth.requireUserId();
        return assembler.assemble(uid, settings.today(uid));
    }

    @GetMapping(value = "/days/{date}", produces = MediaType.APPLICATION_JSON_VALUE)
    public DayPlanView day(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        Long uid = auth.requireUserId();
        return assembler.assemble(uid, date);
    }

    @GetMapping(value = "/calendar", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<DayPlanView> calendar(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        Long uid = auth.requireUserId();
        return assembler.assembleRange(uid, from, to);
    }
}
