package com.fitcycle.backend.progression.controller;

import com.fitcycle.backend.auth.security.AuthContext;
import com.fitcycle.backend.progression.dto.OverrideDto;
import com.fitcycle.backend.progression.dto.SetOverrideRequest;
import com.fitcycle.backend.progression.model.OverrideSource;
import com.fitcycle.backend.progression.service.ProgressionLedger;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/progression")
public class ProgressionController {

    private final AuthContext auth;
    private final ProgressionLedger ledger;

    public ProgressionController(AuthContext auth, ProgressionLedger ledger) {
        this.auth = auth;
        this.ledger = ledger;
    }

    @GetMapping(value = "/overrides", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<OverrideDto> list() {
        Long uid = auth.requireUserId();
        return ledger.list(uid).stream().map(OverrideDto::of).toList();
    }

    @PutMapping(value = "/overrides", produces = MediaType.APPLICATION_JSON_VALUE)
    public OverrideDto set(@RequestBody SetOverrideRequest req) {
        Long uid = auth.requireUserId();
        if (req == null) throw new IllegalArgumentException("BODY_REQUIRED");
        return OverrideDto.of(ledger.setOverride(uid, req.exerciseName(), req.deltaText(), OverrideSource.USER));
    }
}
