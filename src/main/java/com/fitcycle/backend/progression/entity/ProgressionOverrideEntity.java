package com.fitcycle.backend.progression.entity;

import com.fitcycle.backend.progression.model.ExerciseKeys;
import com.fitcycle.backend.progression.model.OverrideSource;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "progression_overrides",
        uniqueConstraints = @UniqueConstraint(name = "uq_progression_user_name_key",
                columnNames = {"user_id", "name_key"})
)
public class ProgressionOverrideEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** 與計畫中的動作名稱完全比對（大小寫敏感） */
    @Column(name = "exercise_name", nullable = false, length = 200)
    private String exerciseName;

    /** ExerciseKeys.nameKey(exerciseName)，寫入前自動補上 */
    @Column(name = "name_key", nullable = false, length = ExerciseKeys.LENGTH)
    private String nameKey;

    /** 原樣保存，例如 "+2 повт" / "+2.5 кг"；不解析 */
    @Column(name = "delta_text", nullable = false, length = 200)
    private String deltaText;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private OverrideSource source;

    @Column(name = "applied_at", nullable = false)
    private Instant appliedAt;

    @PrePersist
    @PreUpdate
    void syncNameKey() {
        nameKey = ExerciseKeys.nameKey(exerciseName);
    }
}
