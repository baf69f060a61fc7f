package com.fitcycle.backend.medlog.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor
@Entity @Table(
        name = "med_logs",
        indexes = @Index(name = "idx_med_logs_user_date", columnList = "user_id,log_date")
)
public class MedLog {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "log_date", nullable = false)
    private LocalDate logDate;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    // 兩種劑量都可以不填
    @Column(name = "amount_mg", precision = 10, scale = 2)
    private BigDecimal amountMg;

    @Column(name = "amount_ml", precision = 10, scale = 2)
    private BigDecimal amountMl;

    @Column(name = "note", length = 500)
    private String note;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
