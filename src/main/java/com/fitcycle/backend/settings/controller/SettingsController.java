package com.fitcycle.backend.settings.controller;

import com.fitcycle.backend.auth.security.AuthContext;
import com.fitcycle.backend.settings.dto.SetCycleStartRequest;
import com.fitcycle.backend.settings.dto.SetTimezoneRequest;
import com.fitcycle.backend.settings.dto.SettingsDto;
import com.fitcycle.backend.settings.service.UserSettingsService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/settings")
public class SettingsController {

    private final AuthContext auth;
    private final UserSettingsService svc;

    public SettingsController(AuthContext auth, UserSettingsService svc) {
        this.auth = auth;
        this.svc = svc;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public SettingsDto get() {
        return svc.view(auth.requireUserId());
    }

    @PutMapping(value = "/cycle-start", produces = MediaType.APPLICATION_JSON_VALUE)
    public SettingsDto setCycleStart(@Valid @RequestBody SetCycleStartRequest req) {
        return svc.setCycleStart(auth.requireUserId(), req.date());
    }

    @PutMapping(value = "/timezone", produces = MediaType.APPLICATION_JSON_VALUE)
    public SettingsDto setTimezone(@Valid @RequestBody SetTimezoneRequest req) {
        return svc.setTimezone(auth.requireUserId(), req.timezone());
    }
}
