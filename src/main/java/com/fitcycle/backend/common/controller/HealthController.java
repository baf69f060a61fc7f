package com.fitcycle.backend.common.controller;

import com.fitcycle.backend.plan.service.PlanStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final PlanStore store;

    public HealthController(PlanStore store) {
        this.store = store;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "ok");
        store.currentIfLoaded().ifPresentOrElse(
                s -> m.put("planVersion", s.version()),
                () -> m.put("planVersion", null));
        return m;
    }
}
