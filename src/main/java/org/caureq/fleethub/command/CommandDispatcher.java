package org.caureq.fleethub.command;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.config.AppProps;
import org.caureq.fleethub.domain.AuditStatus;
import org.caureq.fleethub.error.AuthorizationException;
import org.caureq.fleethub.error.AuthorizationException.Reason;
import org.caureq.fleethub.error.CommandTimeoutException;
import org.caureq.fleethub.error.NotFoundException;
import org.caureq.fleethub.gateway.AgentConnection;
import org.caureq.fleethub.gateway.AgentGateway;
import org.caureq.fleethub.gateway.ConnectionState;
import org.caureq.fleethub.gateway.OutboundFrame;
import org.caureq.fleethub.model.Agent;
import org.caureq.fleethub.permission.PermissionResolver;
import org.caureq.fleethub.registry.AgentRegistry;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.caureq.fleethub.security.TokenService;
import org.caureq.fleethub.service.AuditService;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Synchronous command round-trip: permission checks, audit row, send over the agent's stream,
 * then wait for the correlated {@code command_result} up to {@code fleethub.command.timeout}.
 *
 * <p>Nothing reaches the agent unless every check passed. The audit row is written as PENDING
 * before the frame goes out and finalized exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandDispatcher {
    private final PermissionResolver resolver;
    private final TokenService tokens;
    private final AgentGateway gateway;
    private final AgentRegistry registry;
    private final PendingCommands pending;
    private final AuditService audit;
    private final AppProps props;

    public CommandResult dispatch(AuthenticatedUser actor, String clientIp, String agentId,
                                  CommandRequest request, String elevatedToken) {
        var type = request.commandType();

        resolver.require(actor.userId(), agentId, type.requiredLevel());
        if (type.requiresElevation() && !tokens.isElevatedFor(elevatedToken, actor.userId())) {
            throw new AuthorizationException(Reason.ELEVATION_REQUIRED,
                    type + " requires an elevated credential (X-Elevated-Token)");
        }
        var conn = streaming(agentId);

        var commandId = UUID.randomUUID().toString();
        var hostname = registry.agent(agentId).map(Agent::hostname).orElse(null);
        long auditId = audit.begin(actor, clientIp, agentId, hostname, type, commandId, request);
        var timeout = props.command().timeout();
        long started = System.nanoTime();

        var future = pending.register(commandId, agentId);
        if (conn.state() != ConnectionState.STREAMING) {
            // went away between the lookup and the registration
            pending.forget(commandId);
            audit.complete(auditId, AuditStatus.FAILED, "agent disconnected", elapsedMs(started));
            throw notConnected(agentId);
        }

        try {
            conn.send(OutboundFrame.command(new CommandFrame(commandId, type.name(), request.target(),
                    request.params(), timeout.toMillis())));
        } catch (RuntimeException e) {
            pending.forget(commandId);
            audit.complete(auditId, AuditStatus.FAILED, "send failed: " + e.getMessage(), elapsedMs(started));
            throw e;
        }
        log.info("command {} {} -> {} by {}", commandId, type, agentId, actor.username());

        try {
            var reply = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long ms = elapsedMs(started);
            audit.complete(auditId, reply.success() ? AuditStatus.SUCCEEDED : AuditStatus.FAILED, reply.error(), ms);
            return CommandResult.of(agentId, reply, ms);
        } catch (TimeoutException e) {
            pending.forget(commandId);
            audit.complete(auditId, AuditStatus.TIMED_OUT, "no answer within " + timeout, elapsedMs(started));
            log.warn("command {} {} -> {} timed out after {}", commandId, type, agentId, timeout);
            throw new CommandTimeoutException(commandId, timeout);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            audit.complete(auditId, AuditStatus.FAILED, cause.getMessage(), elapsedMs(started));
            if (cause instanceof NotFoundException nf) throw nf;
            throw new IllegalStateException("command " + commandId + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.forget(commandId);
            audit.complete(auditId, AuditStatus.FAILED, "interrupted", elapsedMs(started));
            throw new IllegalStateException("interrupted while waiting for command " + commandId, e);
        }
    }

    private AgentConnection streaming(String agentId) {
        return gateway.connection(agentId)
                .filter(c -> c.state() == ConnectionState.STREAMING)
                .orElseThrow(() -> notConnected(agentId));
    }

    private static NotFoundException notConnected(String agentId) {
        return new NotFoundException("agent not connected: " + agentId);
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
