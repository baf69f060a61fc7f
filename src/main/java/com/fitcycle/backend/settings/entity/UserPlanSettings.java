package com.fitcycle.backend.settings.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Entity
@Table(name = "user_plan_settings")
public class UserPlanSettings {

    @Id
    @Column(name = "user_id")
    private Long userId;

    /** cycle 的第 0 天；只有使用者明確設定時才會變 */
    @Column(name = "cycle_start_date")
    private LocalDate cycleStartDate;

    @Column(nullable = false, length = 64)
    private String timezone;

    /** {"water":{"time":"10:00","enabled":true}, ...} */
    @Column(name = "reminders_json", columnDefinition = "TEXT")
    private String remindersJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() { updatedAt = Instant.now(); }
}
