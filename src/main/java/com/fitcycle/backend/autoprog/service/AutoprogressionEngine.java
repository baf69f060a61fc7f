package com.fitcycle.backend.autoprog.service;

import com.fitcycle.backend.autoprog.entity.AutoprogRuleEntity;
import com.fitcycle.backend.autoprog.model.AutoprogRunResult;
import com.fitcycle.backend.autoprog.model.RuleOutcome;
import com.fitcycle.backend.autoprog.model.RuleState;
import com.fitcycle.backend.autoprog.repo.AutoprogRuleRepository;
import com.fitcycle.backend.progression.model.OverrideSource;
import com.fitcycle.backend.progression.service.ProgressionLedger;
import com.fitcycle.backend.progression.service.UserLedgerLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 套用到期的 autoprog 規則。
 * - today 由呼叫端傳入，這裡不讀時鐘
 * - 同一天呼叫兩次：第二次所有規則都是 lastAppliedDate == today → 不會重複套用
 * - 依建立順序（id asc）處理；同一動作有兩條規則時，後處理的那條勝出
 * - 每條規則一個 transaction（寫 ledger + 更新 lastAppliedDate），失敗只回滾那一條並回報 FAILED，不在這裡重試
 */
@Slf4j
@Service
public class AutoprogressionEngine {

    private final AutoprogRuleRepository rules;
    private final ProgressionLedger ledger;
    private final UserLedgerLock ledgerLock;
    private final TransactionTemplate tx;

    public AutoprogressionEngine(
            AutoprogRuleRepository rules,
            ProgressionLedger ledger,
            UserLedgerLock ledgerLock,
            PlatformTransactionManager txManager
    ) {
        this.rules = rules;
        this.ledger = ledger;
        this.ledgerLock = ledgerLock;
        this.tx = new TransactionTemplate(txManager);
    }

    public static boolean isDue(AutoprogRuleEntity rule, LocalDate today) {
        LocalDate last = rule.getLastAppliedDate();
        if (last == null) return true;
        return ChronoUnit.DAYS.between(last, today) >= rule.getIntervalDays();
    }

    public static RuleState stateOf(AutoprogRuleEntity rule, LocalDate today) {
        if (isDue(rule, today)) return RuleState.DUE;
        if (today.equals(rule.getLastAppliedDate())) return RuleState.APPLIED;
        return RuleState.IDLE;
    }

    public AutoprogRunResult runOnce(Long userId, LocalDate today) {
        if (userId == null) throw new IllegalArgumentException("USER_ID_REQUIRED");
        if (today == null) throw new IllegalArgumentException("DATE_REQUIRED");

        return ledgerLock.withLock(userId, () -> {
            List<AutoprogRunResult.RuleResult> results = new ArrayList<>();
            for (AutoprogRuleEntity rule : rules.findByUserIdOrderByIdAsc(userId)) {
                results.add(processRule(rule, today));
            }
            AutoprogRunResult result = new AutoprogRunResult(userId, today, List.copyOf(results));
            log.info("Autoprog run user={} today={}: applied={}, skipped={}, failed={}",
                    userId, today,
                    result.count(RuleOutcome.APPLIED),
                    result.count(RuleOutcome.SKIPPED_NOT_DUE),
                    result.count(RuleOutcome.FAILED));
            return result;
        });
    }

    private AutoprogRunResult.RuleResult processRule(AutoprogRuleEntity rule, LocalDate today) {
        if (!isDue(rule, today)) {
            return outcome(rule, RuleOutcome.SKIPPED_NOT_DUE, null);
        }
        try {
            Boolean applied = tx.execute(status -> {
                // transaction 內重讀一次：規則可能剛被刪掉或改過
                AutoprogRuleEntity fresh = rules.findById(rule.getId()).orElse(null);
                if (fresh == null || !isDue(fresh, today)) return false;

                ledger.setOverride(fresh.getUserId(), fresh.getExerciseName(), fresh.getDeltaText(), OverrideSource.AUTOPROG);
                fresh.setLastAppliedDate(today);
                rules.save(fresh);
                return true;
            });
            return outcome(rule, Boolean.TRUE.equals(applied) ? RuleOutcome.APPLIED : RuleOutcome.SKIPPED_NOT_DUE, null);
        } catch (RuntimeException ex) {
            log.warn("Autoprog rule failed: id={}, user={}, exercise={}: {}",
                    rule.getId(), rule.getUserId(), rule.getExerciseName(), ex.toString());
            return outcome(rule, RuleOutcome.FAILED, ex.getMessage());
        }
    }

    private static AutoprogRunResult.RuleResult outcome(AutoprogRuleEntity r, RuleOutcome o, String error) {
        return new AutoprogRunResult.RuleResult(
                r.getId(), r.getWorkoutKey(), r.getExerciseName(), r.getDeltaText(), o, error);
    }
}
