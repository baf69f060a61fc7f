package com.fitcycle.backend.autoprog.service;

import com.fitcycle.backend.autoprog.config.AutoprogProperties;
import com.fitcycle.backend.autoprog.dto.AutoprogRuleDto;
import com.fitcycle.backend.autoprog.dto.UpsertRuleRequest;
import com.fitcycle.backend.autoprog.entity.AutoprogRuleEntity;
import com.fitcycle.backend.autoprog.repo.AutoprogRuleRepository;
import com.fitcycle.backend.plan.model.PlanSnapshot;
import com.fitcycle.backend.plan.service.PlanStore;
import com.fitcycle.backend.plan.web.PlanValidationException;
import com.fitcycle.backend.progression.model.ExerciseKeys;
import com.fitcycle.backend.progression.service.UserLedgerLock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@RequiredArgsConstructor
@Service
public class AutoprogRuleService {

    private static final int MAX_KEY_LEN = 100;
    private static final int MAX_TEXT_LEN = 200;
    private static final int MAX_INTERVAL_DAYS = 365;

    private final AutoprogRuleRepository repo;
    private final PlanStore planStore;
    private final UserLedgerLock ledgerLock;
    private final AutoprogProperties props;

    /**
     * 同一 (user, workoutKey, exerciseName) 視為同一條規則：更新 delta / interval，保留 lastAppliedDate。
     */
    public AutoprogRuleDto upsert(Long userId, UpsertRuleRequest req, LocalDate today) {
        if (req == null) throw new PlanValidationException("RULE_REQUIRED", "rule body is required");

        String workoutKey = require(req.workoutKey(), "WORKOUT_KEY_REQUIRED", "workoutKey", MAX_KEY_LEN);
        String exerciseName = require(req.exerciseName(), "EXERCISE_NAME_REQUIRED", "exerciseName", MAX_TEXT_LEN);
        String deltaText = requireVerbatim(req.deltaText(), "DELTA_TEXT_REQUIRED", "deltaText", MAX_TEXT_LEN);

        int interval = (req.intervalDays() == null) ? props.getDefaultIntervalDays() : req.intervalDays();
        if (interval < 1 || interval > MAX_INTERVAL_DAYS) {
            throw new PlanValidationException("INTERVAL_DAYS_INVALID",
                    "intervalDays must be between 1 and " + MAX_INTERVAL_DAYS);
        }

        // 有計畫時才檢查 key；還沒載入計畫就先收下
        Optional<PlanSnapshot> plan = planStore.currentIfLoaded();
        if (plan.isPresent() && plan.get().dayContent(workoutKey).isEmpty()) {
            throw new PlanValidationException("WORKOUT_KEY_UNKNOWN",
                    "Unknown workout key " + workoutKey + ". Available: " + String.join(", ", plan.get().workouts().keySet()));
        }

        return ledgerLock.withLock(userId, () -> save(userId, workoutKey, exerciseName, deltaText, interval, today));
    }

    @Transactional(readOnly = true)
    public List<AutoprogRuleDto> list(Long userId, LocalDate today) {
        return repo.findByUserIdOrderByIdAsc(userId).stream()
                .map(r -> toDto(r, today))
                .toList();
    }

    public void delete(Long userId, Long ruleId) {
        ledgerLock.withLock(userId, () -> {
            AutoprogRuleEntity r = repo.findByIdAndUserId(ruleId, userId)
                    .orElseThrow(() -> new NoSuchElementException("RULE_NOT_FOUND"));
            repo.delete(r);
        });
    }

    private AutoprogRuleDto save(Long userId, String workoutKey, String exerciseName, String deltaText,
                                 int interval, LocalDate today) {
        AutoprogRuleEntity e = repo.findByUserIdAndRuleKey(userId, ExerciseKeys.ruleKey(workoutKey, exerciseName))
                .orElseGet(AutoprogRuleEntity::new);
        e.setUserId(userId);
        e.setWorkoutKey(workoutKey);
        e.setExerciseName(exerciseName);
        e.setDeltaText(deltaText);
        e.setIntervalDays(interval);
        return toDto(repo.save(e), today);
    }

    static AutoprogRuleDto toDto(AutoprogRuleEntity r, LocalDate today) {
        LocalDate next = (r.getLastAppliedDate() == null)
                ? today
                : r.getLastAppliedDate().plusDays(r.getIntervalDays());
        return new AutoprogRuleDto(
                r.getId(),
                r.getWorkoutKey(),
                r.getExerciseName(),
                r.getDeltaText(),
                r.getIntervalDays(),
                r.getLastAppliedDate(),
                next,
                AutoprogressionEngine.stateOf(r, today)
        );
    }

    /** delta 原樣保存（不 trim），只擋空白與長度 */
    private static String requireVerbatim(String raw, String code, String field, int maxLen) {
        if (raw == null || raw.isBlank()) throw new PlanValidationException(code, field + " is required");
        if (raw.length() > maxLen) {
            throw new PlanValidationException(code.replace("_REQUIRED", "_TOO_LONG"),
                    field + " must be at most " + maxLen + " characters");
        }
        return raw;
    }

    private static String require(String raw, String code, String field, int maxLen) {
        if (raw == null || raw.isBlank()) throw new PlanValidationException(code, field + " is required");
        String s = raw.trim();
        if (s.length() > maxLen) {
            throw new PlanValidationException(code.replace("_REQUIRED", "_TOO_LONG"),
                    field + " must be at most " + maxLen + " characters");
        }
        return s;
    }
}
