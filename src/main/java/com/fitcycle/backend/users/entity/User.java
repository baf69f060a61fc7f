package com.fitcycle.backend.users.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Data
@Entity
@Table(
        name = "users",
        uniqueConstraints = @UniqueConstraint(name = "ux_users_tg_id", columnNames = {"tg_id"})
)
public class User {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Telegram user id（init data 裡的 user.id） */
    @Column(name = "tg_id", nullable = false)
    private Long tgId;

    @Column private String name;

    /** 私聊時 chat_id 通常等於 tg_id；提醒投遞端會用到 */
    @Column(name = "chat_id")
    private Long chatId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
