package org.caureq.fleethub.command;

import lombok.extern.slf4j.Slf4j;
import org.caureq.fleethub.error.NotFoundException;
import org.caureq.fleethub.gateway.InboundFrame;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Commands sent to an agent and not yet answered, keyed by command id. The gateway completes
 * them from {@code command_result} frames and fails them when the agent goes away.
 */
@Slf4j
@Component
public class PendingCommands {

    private record Pending(String agentId, CompletableFuture<InboundFrame.CommandResult> future) {}

    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    public CompletableFuture<InboundFrame.CommandResult> register(String commandId, String agentId) {
        var future = new CompletableFuture<InboundFrame.CommandResult>();
        if (pending.putIfAbsent(commandId, new Pending(agentId, future)) != null) {
            throw new IllegalStateException("duplicate command id " + commandId);
        }
        return future;
    }

    /** Returns false for unknown or foreign command ids (late replies after a timeout land here). */
    public boolean complete(String agentId, InboundFrame.CommandResult result) {
        var p = pending.get(result.commandId());
        if (p == null || !p.agentId().equals(agentId)) {
            log.debug("ignoring result for unknown command {} from {}", result.commandId(), agentId);
            return false;
        }
        pending.remove(result.commandId());
        return p.future().complete(result);
    }

    public void forget(String commandId) {
        pending.remove(commandId);
    }

    /** Fails everything waiting on {@code agentId}; returns how many were failed. */
    public int failAll(String agentId, String cause) {
        int n = 0;
        for (var it = pending.entrySet().iterator(); it.hasNext(); ) {
            var e = it.next();
            if (e.getValue().agentId().equals(agentId)) {
                it.remove();
                e.getValue().future().completeExceptionally(
                        new NotFoundException("agent disconnected: " + agentId + " (" + cause + ")"));
                n++;
            }
        }
        if (n > 0) log.info("failed {} pending command(s) for {}: {}", n, agentId, cause);
        return n;
    }

    public int size() {
        return pending.size();
    }
}
