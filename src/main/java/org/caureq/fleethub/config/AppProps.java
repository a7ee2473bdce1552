package org.caureq.fleethub.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "fleethub")
public record AppProps(AuthProps auth, AgentAuthProps agentAuth, GatewayProps gateway,
                       CommandProps command, ArchiveProps archive, AuditProps audit) {

    public AppProps {
        auth = auth == null ? new AuthProps(null, null, null, null, null) : auth;
        agentAuth = agentAuth == null ? new AgentAuthProps(false, List.of()) : agentAuth;
        gateway = gateway == null ? new GatewayProps(null, null, 0, false, 0, null, 0) : gateway;
        command = command == null ? new CommandProps(null) : command;
        archive = archive == null ? new ArchiveProps(false, 0, 0, 0) : archive;
        audit = audit == null ? new AuditProps(0) : audit;
    }

    /** User tokens (JWT) and the bootstrap superadmin. */
    public record AuthProps(String jwtSecret, Duration accessTtl, Duration elevatedTtl,
                            String superadminUsername, String superadminPassword) {
        public AuthProps {
            accessTtl = accessTtl == null ? Duration.ofHours(12) : accessTtl;
            elevatedTtl = elevatedTtl == null ? Duration.ofMinutes(5) : elevatedTtl;
        }
    }

    /** Static agent credentials. When disabled every token is accepted. */
    public record AgentAuthProps(boolean enabled, List<AgentToken> tokens) {
        public AgentAuthProps {
            tokens = tokens == null ? List.of() : List.copyOf(tokens);
        }
    }

    public record AgentToken(String name, String token) {}

    public record GatewayProps(Duration heartbeatTimeout, Duration handshakeTimeout, int grpcPort,
                               boolean grpcEnabled, int subscriberQueueSize, String overflowPolicy,
                               int maxSubscribers) {
        public GatewayProps {
            heartbeatTimeout = heartbeatTimeout == null ? Duration.ofSeconds(90) : heartbeatTimeout;
            handshakeTimeout = handshakeTimeout == null ? Duration.ofSeconds(10) : handshakeTimeout;
            grpcPort = grpcPort <= 0 ? 9090 : grpcPort;
            subscriberQueueSize = subscriberQueueSize <= 0 ? 256 : subscriberQueueSize;
            overflowPolicy = overflowPolicy == null ? "drop-oldest" : overflowPolicy;
            maxSubscribers = maxSubscribers <= 0 ? 64 : maxSubscribers;
        }
    }

    public record CommandProps(Duration timeout) {
        public CommandProps {
            timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        }
    }

    /** Monthly raw partitions and rollup retention, in days. */
    public record ArchiveProps(boolean enabled, int retentionDays, int hourlyRetentionDays, int dailyRetentionDays) {
        public ArchiveProps {
            retentionDays = retentionDays <= 0 ? 30 : retentionDays;
            hourlyRetentionDays = hourlyRetentionDays <= 0 ? 90 : hourlyRetentionDays;
            dailyRetentionDays = dailyRetentionDays <= 0 ? 365 : dailyRetentionDays;
        }
    }

    public record AuditProps(int retentionDays) {
        public AuditProps {
            retentionDays = retentionDays <= 0 ? 90 : retentionDays;
        }
    }
}
