package com.fitcycle.backend.plan.sync;

import com.fitcycle.backend.plan.config.PlanProperties;
import com.fitcycle.backend.plan.model.PlanDefinition;
import com.fitcycle.backend.plan.service.PlanStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * 啟動時先還原 DB 最後一版；沒有的話載入 classpath 的預設計畫。
 * 兩者都沒有就維持未載入，/plan 相關 API 會回 503。
 */
@Slf4j
@Component
public class PlanBootstrap implements ApplicationRunner {

    private final PlanSyncService sync;
    private final PlanStore store;
    private final PlanProperties props;
    private final ObjectMapper om;

    public PlanBootstrap(PlanSyncService sync, PlanStore store, PlanProperties props, ObjectMapper om) {
        this.sync = sync;
        this.store = store;
        this.props = props;
        this.om = om;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (sync.restoreLatest().isPresent()) return;

        String seed = props.getSeedResource();
        if (seed == null || seed.isBlank()) {
            log.warn("No persisted plan and no seed resource configured; plan stays unloaded");
            return;
        }
        Resource res = new ClassPathResource(seed);
        if (!res.exists()) {
            log.warn("Seed plan resource not found: {}", seed);
            return;
        }
        try (InputStream in = res.getInputStream()) {
            PlanDefinition def = om.readValue(in, PlanDefinition.class);
            store.load(def);
            log.info("Seed plan loaded from {}", seed);
        }
    }
}
