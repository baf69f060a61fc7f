package com.fitcycle.backend.progression.service;

import com.fitcycle.backend.plan.model.ExerciseEntry;
import com.fitcycle.backend.plan.web.PlanValidationException;
import com.fitcycle.backend.progression.entity.ProgressionOverrideEntity;
import com.fitcycle.backend.progression.model.ExerciseKeys;
import com.fitcycle.backend.progression.model.OverrideSource;
import com.fitcycle.backend.progression.repo.ProgressionOverrideRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 每個使用者、每個動作只保留最後一次的 delta（last-write-wins），不保留歷史、不自動過期。
 * 手動輸入與 autoprog 都走 setOverride，所以 ledger 是唯一真實來源。
 */
@Service
public class ProgressionLedger {

    static final int MAX_TEXT_LEN = 200;

    private final ProgressionOverrideRepository repo;
    private final UserLedgerLock ledgerLock;
    private final TransactionTemplate tx;
    private final Clock clock;

    public ProgressionLedger(
            ProgressionOverrideRepository repo,
            UserLedgerLock ledgerLock,
            PlatformTransactionManager txManager,
            Clock clock
    ) {
        this.repo = repo;
        this.ledgerLock = ledgerLock;
        this.tx = new TransactionTemplate(txManager);
        this.clock = clock;
    }

    /**
     * upsert。鎖包在 transaction 外面，commit 完才放鎖。
     * 若呼叫端已在 transaction 內（autoprog），這裡會加入同一個 transaction。
     */
    public ProgressionOverrideEntity setOverride(Long userId, String exerciseName, String deltaText, OverrideSource source) {
        String name = requireText(exerciseName, "EXERCISE_NAME_REQUIRED", "exerciseName").trim();
        String delta = requireText(deltaText, "DELTA_TEXT_REQUIRED", "deltaText");
        OverrideSource src = (source == null) ? OverrideSource.USER : source;

        return ledgerLock.withLock(userId, () -> tx.execute(status -> {
            String key = ExerciseKeys.nameKey(name);
            ProgressionOverrideEntity e = repo.findByUserIdAndNameKey(userId, key)
                    .orElseGet(ProgressionOverrideEntity::new);
            e.setUserId(userId);
            e.setExerciseName(name);
            e.setNameKey(key);
            e.setDeltaText(delta);
            e.setSource(src);
            e.setAppliedAt(clock.instant());
            return repo.save(e);
        }));
    }

    public Optional<String> getOverride(Long userId, String exerciseName) {
        if (exerciseName == null) return Optional.empty();
        return repo.findByUserIdAndNameKey(userId, ExerciseKeys.nameKey(exerciseName))
                .filter(o -> exerciseName.equals(o.getExerciseName()))
                .map(ProgressionOverrideEntity::getDeltaText);
    }

    public List<ProgressionOverrideEntity> list(Long userId) {
        return repo.findByUserIdOrderByExerciseNameAsc(userId);
    }

    /** 依名稱完全比對（大小寫敏感、不做模糊比對）把 override 掛到每個動作旁邊 */
    public List<OverlaidExercise> overlay(Long userId, List<ExerciseEntry> entries) {
        if (entries == null || entries.isEmpty()) return List.of();

        Set<String> keys = new HashSet<>();
        for (ExerciseEntry e : entries) keys.add(ExerciseKeys.nameKey(e.name()));

        Map<String, String> byName = new HashMap<>();
        for (ProgressionOverrideEntity o : repo.findByUserIdAndNameKeyIn(userId, keys)) {
            byName.put(o.getExerciseName(), o.getDeltaText());
        }

        List<OverlaidExercise> out = new ArrayList<>(entries.size());
        for (ExerciseEntry e : entries) {
            out.add(new OverlaidExercise(e, byName.get(e.name())));
        }
        return out;
    }

    /** 只擋空白與長度，回傳原文；delta 照使用者輸入原樣保存 */
    private static String requireText(String raw, String code, String field) {
        if (raw == null || raw.isBlank()) {
            throw new PlanValidationException(code, field + " is required");
        }
        if (raw.length() > MAX_TEXT_LEN) {
            throw new PlanValidationException(code.replace("_REQUIRED", "_TOO_LONG"),
                    field + " must be at most " + MAX_TEXT_LEN + " characters");
        }
        return raw;
    }
}
