package com.example.notificationscheduler.domain.entity;

import com.example.notificationscheduler.domain.enums.UserRole;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Known user. The online flag mirrors whether a realtime session is registered.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppUser {

    @Id
    @Column(name = "id", updatable = false, nullable = false, length = 100)
    private String id;

    @Column(name = "email", nullable = false, unique = true, length = 200)
    private String email;

    @Column(name = "name", length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    @Builder.Default
    private UserRole role = UserRole.USER;

    @Column(name = "is_online", nullable = false)
    @Builder.Default
    private Boolean online = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.role == null) {
            this.role = UserRole.USER;
        }
        if (this.online == null) {
            this.online = false;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
