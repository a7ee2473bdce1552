package org.caureq.fleethub.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One row per command attempt. Written as PENDING before dispatch, finalized once,
 * then only removed by retention.
 */
@Entity @Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_ts", columnList = "ts DESC"),
        @Index(name = "idx_audit_agent", columnList = "agent_id"),
        @Index(name = "idx_audit_user", columnList = "user_id")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AuditLog {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private Long userId;
    private String username;
    private String clientIp;

    @Column(name = "agent_id", length = 128)
    private String agentId;
    private String agentHostname;

    @Column(length = 40)
    private String commandType;
    @Column(length = 64)
    private String commandId;
    @Column(length = 500)
    private String target;        // service name, pid, path...
    @Column(length = 4000)
    private String parameters;    // JSON

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private AuditStatus status;

    @Column(length = 2000)
    private String error;
    private Long durationMs;

    @Column(nullable = false)
    private Instant ts;
}
