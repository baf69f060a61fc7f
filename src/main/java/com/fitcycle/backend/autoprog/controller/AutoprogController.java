package com.fitcycle.backend.autoprog.controller;

import com.fitcycle.backend.auth.security.AuthContext;
import com.fitcycle.backend.autoprog.dto.AutoprogRuleDto;
import com.fitcycle.backend.autoprog.dto.UpsertRuleRequest;
import com.fitcycle.backend.autoprog.model.AutoprogRunResult;
import com.fitcycle.backend.autoprog.service.AutoprogRuleService;
import com.fitcycle.backend.autoprog.service.AutoprogressionEngine;
import com.fitcycle.backend.settings.service.UserSettingsService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/autoprog")
public class AutoprogController {

    private final AuthContext auth;
    private final AutoprogRuleService rules;
    private final AutoprogressionEngine engine;
    private final UserSettingsService settings;

    public AutoprogController(
            AuthContext auth,
            AutoprogRuleService rules,
            AutoprogressionEngine engine,
            UserSettingsService settings
    ) {
        this.auth = auth;
        this.rules = rules;
        this.engine = engine;
        this.settings = settings;
    }

    @GetMapping(value = "/rules", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<AutoprogRuleDto> list() {
        Long uid = auth.requireUserId();
        return rules.list(uid, settings.today(uid));
    }

    @PutMapping(value = "/rules", produces = MediaType.APPLICATION_JSON_VALUE)
    public AutoprogRuleDto upsert(@RequestBody UpsertRuleRequest req) {
        Long uid = auth.requireUserId();
        return rules.upsert(uid, req, settings.today(uid));
    }

    @DeleteMapping("/rules/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        Long uid = auth.requireUserId();
        rules.delete(uid, id);
        return ResponseEntity.noContent().build();
    }

    /** 手動觸發；同一天重複呼叫不會重複套用 */
    @PostMapping(value = "/run", produces = MediaType.APPLICATION_JSON_VALUE)
    public AutoprogRunResult run() {
        Long uid = auth.requireUserId();
        return engine.runOnce(uid, settings.today(uid));
    }
}
