package com.fitcycle.backend.progress.controller;

import com.fitcycle.backend.auth.security.AuthContext;
import com.fitcycle.backend.progress.dto.AddProgressRequest;
import com.fitcycle.backend.progress.dto.ProgressItemDto;
import com.fitcycle.backend.progress.dto.UpdateProgressRequest;
import com.fitcycle.backend.progress.service.BodyProgressService;
import com.fitcycle.backend.settings.service.UserSettingsService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/progress")
public class BodyProgressController {

    private final AuthContext auth;
    private final BodyProgressService svc;
    private final UserSettingsService settings;

    public BodyProgressController(AuthContext auth, BodyProgressService svc, UserSettingsService settings) {
        this.auth = auth; this.svc = svc; this.settings = settings;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ProgressItemDto add(@Valid @RequestBody AddProgressRequest req) {
        Long uid = auth.requireUserId();
        return svc.add(uid, req, settings.today(uid));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<ProgressItemDto> latest() {
        return svc.latest(auth.requireUserId());
    }

    @PutMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ProgressItemDto update(@PathVariable Long id, @RequestBody(required = false) UpdateProgressRequest req) {
        return svc.update(auth.requireUserId(), id, req);
    }
}
