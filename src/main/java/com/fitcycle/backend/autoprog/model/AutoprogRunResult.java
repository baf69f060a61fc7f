package com.fitcycle.backend.autoprog.model;

import java.time.LocalDate;
import java.util.List;

public record AutoprogRunResult(
        Long userId,
        LocalDate today,
        List<RuleResult> rules
) {
    public record RuleResult(
            Long ruleId,
            String workoutKey,
            String exerciseName,
            String deltaText,
            RuleOutcome outcome,
            String error // 只有 FAILED 才有
    ) {}

    public long count(RuleOutcome outcome) {
        return rules.stream().filter(r -> r.outcome() == outcome).count();
    }
}
