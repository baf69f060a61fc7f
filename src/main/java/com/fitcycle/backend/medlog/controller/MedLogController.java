package com.fitcycle.backend.medlog.controller;

import com.fitcycle.backend.auth.security.AuthContext;
import com.fitcycle.backend.medlog.dto.AddMedLogRequest;
import com.fitcycle.backend.medlog.dto.MedLogItemDto;
import com.fitcycle.backend.medlog.service.MedLogService;
import com.fitcycle.backend.settings.service.UserSettingsService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/meds")
public class MedLogController {

    private final AuthContext auth;
    private final MedLogService svc;
    private final UserSettingsService settings;

    public MedLogController(AuthContext auth, MedLogService svc, UserSettingsService settings) {
        this.auth = auth; this.svc = svc; this.settings = settings;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public MedLogItemDto add(@Valid @RequestBody AddMedLogRequest req) {
        Long uid = auth.requireUserId();
        return svc.add(uid, req, settings.today(uid));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<MedLogItemDto> latest() {
        return svc.latest(auth.requireUserId());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        svc.delete(auth.requireUserId(), id);
        return ResponseEntity.noContent().build();
    }
}
