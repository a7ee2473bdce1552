package org.caureq.fleethub.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity @Table(name = "users", indexes = {
        @Index(name = "idx_users_username", columnList = "username")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class User {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String username;

    @Column(nullable = false, length = 100)
    private String passwordHash;   // bcrypt

    private boolean superAdmin;

    private Instant createdAt;
    private Instant deletedAt;     // soft delete

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean isDeleted() { return deletedAt != null; }
}
