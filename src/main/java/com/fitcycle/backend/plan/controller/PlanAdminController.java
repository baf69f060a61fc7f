package com.fitcycle.backend.plan.controller;

import com.fitcycle.backend.auth.security.AuthContext;
import com.fitcycle.backend.plan.dto.PlanSummaryDto;
import com.fitcycle.backend.plan.dto.SyncPlanRequest;
import com.fitcycle.backend.plan.model.PlanDefinition;
import com.fitcycle.backend.plan.service.PlanStore;
import com.fitcycle.backend.plan.sync.PlanSyncService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/admin/plan")
public class PlanAdminController {

    private final AuthContext auth;
    private final PlanSyncService sync;
    private final PlanStore store;

    public PlanAdminController(AuthContext auth, PlanSyncService sync, PlanStore store) {
        this.auth = auth;
        this.sync = sync;
        this.store = store;
    }

    @PostMapping(value = "/sync", produces = MediaType.APPLICATION_JSON_VALUE)
    public PlanSummaryDto syncFromSheet(@RequestBody(required = false) SyncPlanRequest req) {
        Long uid = auth.requireAdmin();
        log.info("Plan sync requested by userId={}", uid);
        var source = (req == null) ? null
                : new PlanSyncService.SheetSource(req.sheet(), req.gidPlan(), req.gidMacros(), req.gidCycle());
        return PlanSummaryDto.of(sync.syncFromSheet(source));
    }

    @PutMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public PlanSummaryDto upload(@RequestBody PlanDefinition definition) {
        Long uid = auth.requireAdmin();
        log.info("Plan upload by userId={}", uid);
        return PlanSummaryDto.of(sync.upload(definition));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public PlanSummaryDto current() {
        auth.requireAdmin();
        return PlanSummaryDto.of(store.current());
    }
}
