package com.fitcycle.backend.progress.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor
@Entity @Table(
        name = "body_progress_logs",
        indexes = @Index(name = "idx_body_progress_user_date", columnList = "user_id,log_date")
)
public class BodyProgressLog {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** 使用者當地日期；同一天可以量很多次 */
    @Column(name = "log_date", nullable = false)
    private LocalDate logDate;

    @Column(name = "weight", nullable = false, precision = 6, scale = 1)
    private BigDecimal weight;

    // 以下皆為 cm
    @Column(name = "waist", nullable = false, precision = 6, scale = 1)
    private BigDecimal waist;

    @Column(name = "belly", nullable = false, precision = 6, scale = 1)
    private BigDecimal belly;

    @Column(name = "biceps", nullable = false, precision = 6, scale = 1)
    private BigDecimal biceps;

    @Column(name = "chest", nullable = false, precision = 6, scale = 1)
    private BigDecimal chest;

    @Column(name = "note", length = 500)
    private String note;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate void onUpdate() { updatedAt = Instant.now(); }
}
