package com.fitcycle.backend.daystatus.entity;

import com.fitcycle.backend.daystatus.model.DayStatus;
import com.fitcycle.backend.plan.model.DayType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 使用者某一天的執行紀錄。第一次碰到這天時，從當下組出的計畫拍一份快照
 * （dayType / workoutKey / 營養素），之後計畫改版也不回頭改這筆。
 */
@Getter @Setter @NoArgsConstructor
@Entity @Table(
        name = "calendar_days",
        uniqueConstraints = @UniqueConstraint(name = "uq_calendar_user_date", columnNames = {"user_id", "day_date"}),
        indexes = @Index(name = "idx_calendar_user_status", columnList = "user_id,status")
)
public class CalendarDay {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "day_date", nullable = false)
    private LocalDate dayDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_type", nullable = false, length = 8)
    private DayType dayType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 8)
    private DayStatus status;

    @Column(name = "workout_key", length = 64)
    private String workoutKey;

    @Column(name = "kcal", nullable = false)
    private int kcal;

    @Column(name = "protein", nullable = false)
    private int protein;

    @Column(name = "fat", nullable = false)
    private int fat;

    @Column(name = "carbs", nullable = false)
    private int carbs;

    @Column(name = "note", length = 500)
    private String note;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (status == null) status = DayStatus.PLANNED;
        updatedAt = now;
    }

    @PreUpdate void onUpdate() { updatedAt = Instant.now(); }
}
