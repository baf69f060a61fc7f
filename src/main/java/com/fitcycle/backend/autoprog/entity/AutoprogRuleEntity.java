package com.fitcycle.backend.autoprog.entity;

import com.fitcycle.backend.progression.model.ExerciseKeys;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "autoprog_rules",
        uniqueConstraints = @UniqueConstraint(name = "uq_autoprog_user_rule_key",
                columnNames = {"user_id", "rule_key"}),
        indexes = @Index(name = "idx_autoprog_user", columnList = "user_id,id")
)
public class AutoprogRuleEntity {

    /** 自增 id 同時代表建立順序：runOnce 依 id asc 處理 */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "workout_key", nullable = false, length = 100)
    private String workoutKey;

    @Column(name = "exercise_name", nullable = false, length = 200)
    private String exerciseName;

    /** ExerciseKeys.ruleKey(workoutKey, exerciseName)，寫入前自動補上 */
    @Column(name = "rule_key", nullable = false, length = ExerciseKeys.LENGTH)
    private String ruleKey;

    @Column(name = "delta_text", nullable = false, length = 200)
    private String deltaText;

    @Column(name = "interval_days", nullable = false)
    private int intervalDays = 7;

    /** null = 從未套用過 → 下一次 runOnce 一定 due */
    @Column(name = "last_applied_date")
    private LocalDate lastAppliedDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        ruleKey = ExerciseKeys.ruleKey(workoutKey, exerciseName);
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        ruleKey = ExerciseKeys.ruleKey(workoutKey, exerciseName);
        updatedAt = Instant.now();
    }
}
