package com.fitcycle.backend.reminder.controller;

import com.fitcycle.backend.auth.security.AuthContext;
import com.fitcycle.backend.reminder.dto.NextTriggerDto;
import com.fitcycle.backend.reminder.dto.ReminderDto;
import com.fitcycle.backend.reminder.dto.SetReminderRequest;
import com.fitcycle.backend.reminder.service.ReminderService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/reminders")
public class ReminderController {

    private final AuthContext auth;
    private final ReminderService svc;

    public ReminderController(AuthContext auth, ReminderService svc) {
        this.auth = auth;
        this.svc = svc;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ReminderDto> list() {
        return svc.list(auth.requireUserId());
    }

    @GetMapping(value = "/next", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<NextTriggerDto> next() {
        return svc.nextTriggers(auth.requireUserId());
    }

    @PutMapping(value = "/{type}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ReminderDto set(@PathVariable String type, @RequestBody(required = false) SetReminderRequest req) {
        return svc.set(auth.requireUserId(), type, req);
    }

    @DeleteMapping(value = "/{type}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ReminderDto disable(@PathVariable String type) {
        return svc.disable(auth.requireUserId(), type);
    }
}
