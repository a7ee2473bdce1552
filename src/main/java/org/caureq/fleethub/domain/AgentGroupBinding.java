package org.caureq.fleethub.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/** Binds an agent to a group with a ceiling permission level (0..3). */
@Entity @Table(name = "agent_group_bindings", indexes = {
        @Index(name = "idx_binding_agent", columnList = "agent_id"),
        @Index(name = "idx_binding_group", columnList = "group_id")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AgentGroupBinding {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "group_id")
    private AccessGroup group;

    @Column(name = "agent_id", nullable = false, length = 128)
    private String agentId;

    @Column(name = "access_level", nullable = false)
    private int level;

    private Instant createdAt;
    private Instant deletedAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }
}
