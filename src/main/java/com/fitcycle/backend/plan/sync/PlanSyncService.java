package com.fitcycle.backend.plan.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fitcycle.backend.plan.config.PlanProperties;
import com.fitcycle.backend.plan.entity.PlanSnapshotEntity;
import com.fitcycle.backend.plan.model.PlanDefinition;
import com.fitcycle.backend.plan.model.PlanSnapshot;
import com.fitcycle.backend.plan.repo.PlanSnapshotRepository;
import com.fitcycle.backend.plan.service.PlanStore;
import com.fitcycle.backend.plan.web.PlanValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;

/**
 * 計畫更新流程：解析 → 驗證（PlanStore.prepare）→ 落庫 → 生效（install）。
 * 任何一步失敗，目前生效的 snapshot 都不會變。
 */
@Slf4j
@Service
public class PlanSyncService {

    public static final String SOURCE_SHEET = "sheet";
    public static final String SOURCE_UPLOAD = "upload";

    private final PlanStore store;
    private final PlanSnapshotRepository repo;
    private final SheetCsvClient sheetClient;
    private final PlanTableParser parser;
    private final PlanProperties props;
    private final ObjectMapper om;
    private final TransactionTemplate tx;

    // 多個 admin 同時 sync 時版本號不能撞
    private final Object applyLock = new Object();

    public PlanSyncService(
            PlanStore store,
            PlanSnapshotRepository repo,
            SheetCsvClient sheetClient,
            PlanTableParser parser,
            PlanProperties props,
            ObjectMapper om,
            PlatformTransactionManager txManager
    ) {
        this.store = store;
        this.repo = repo;
        this.sheetClient = sheetClient;
        this.parser = parser;
        this.props = props;
        this.om = om;
        this.tx = new TransactionTemplate(txManager);
    }

    public record SheetSource(String sheet, String gidPlan, String gidMacros, String gidCycle) {}

    public PlanSnapshot syncFromSheet(SheetSource req) {
        PlanProperties.Sheet cfg = props.getSheet();
        String sheet = pick(req == null ? null : req.sheet(), cfg.getId());
        String gidPlan = pick(req == null ? null : req.gidPlan(), cfg.getGidPlan());
        String gidMacros = pick(req == null ? null : req.gidMacros(), cfg.getGidMacros());
        String gidCycle = pick(req == null ? null : req.gidCycle(), cfg.getGidCycle());

        if (sheet == null) throw new IllegalArgumentException("SHEET_ID_REQUIRED");
        if (gidMacros == null) throw new IllegalArgumentException("GID_MACROS_REQUIRED");
        if (gidCycle == null) throw new IllegalArgumentException("GID_CYCLE_REQUIRED");

        String planCsv = sheetClient.fetchCsv(sheet, gidPlan);
        String macrosCsv = sheetClient.fetchCsv(sheet, gidMacros);
        String cycleCsv = sheetClient.fetchCsv(sheet, gidCycle);

        return apply(parser.parse(planCsv, macrosCsv, cycleCsv), SOURCE_SHEET);
    }

    public PlanSnapshot upload(PlanDefinition definition) {
        return apply(definition, SOURCE_UPLOAD);
    }

    public PlanSnapshot apply(PlanDefinition definition, String source) {
        synchronized (applyLock) {
            long persistedMax = repo.findTopByOrderByVersionDescIdDesc()
                    .map(PlanSnapshotEntity::getVersion)
                    .orElse(0L);
            long next = Math.max(store.currentVersion(), persistedMax) + 1;

            PlanSnapshot snapshot = store.prepare(definition, next);
            String payload = toJson(definition);

            tx.executeWithoutResult(status -> {
                PlanSnapshotEntity e = new PlanSnapshotEntity();
                e.setVersion(snapshot.version());
                e.setPayload(payload);
                e.setSource(source);
                e.setLoadedAt(snapshot.loadedAt());
                repo.save(e);
            });

            store.install(snapshot);
            log.info("Plan applied: source={}, version={}", source, snapshot.version());
            return snapshot;
        }
    }

    /** 啟動時把最後一版落庫的計畫還原；沒有或壞掉就回 empty */
    public Optional<PlanSnapshot> restoreLatest() {
        Optional<PlanSnapshotEntity> latest = repo.findTopByOrderByVersionDescIdDesc();
        if (latest.isEmpty()) return Optional.empty();

        PlanSnapshotEntity e = latest.get();
        try {
            PlanDefinition def = om.readValue(e.getPayload(), PlanDefinition.class);
            PlanSnapshot snapshot = store.prepare(def, e.getVersion());
            store.install(snapshot);
            return Optional.of(snapshot);
        } catch (JsonProcessingException | PlanValidationException ex) {
            log.warn("Persisted plan version={} could not be restored: {}", e.getVersion(), ex.getMessage());
            return Optional.empty();
        }
    }

    private String toJson(PlanDefinition definition) {
        try {
            return om.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("PLAN_SERIALIZE_FAILED", e);
        }
    }

    private static String pick(String requested, String fallback) {
        if (requested != null && !requested.isBlank()) return requested.trim();
        if (fallback != null && !fallback.isBlank()) return fallback.trim();
        return null;
    }
}
