package com.fitcycle.backend.plan.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(
        name = "plan_snapshots",
        indexes = @Index(name = "idx_plan_snapshots_version", columnList = "version")
)
public class PlanSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "version", nullable = false)
    private long version;

    /** PlanDefinition 的 JSON */
    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    /** sheet / upload / seed */
    @Column(name = "source", nullable = false, length = 20)
    private String source;

    @Column(name = "loaded_at", nullable = false)
    private Instant loadedAt;
}
