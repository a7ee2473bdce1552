package org.caureq.fleethub.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Explicit per-user, per-agent level. Replaces the group ceiling, up or down. */
@Entity @Table(name = "user_agent_permissions", indexes = {
        @Index(name = "idx_override_user_agent", columnList = "user_id, agent_id")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class UserAgentPermission {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id")
    private User user;

    @Column(name = "agent_id", nullable = false, length = 128)
    private String agentId;

    @Column(name = "access_level", nullable = false)
    private int level;

    private Long grantedBy;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
