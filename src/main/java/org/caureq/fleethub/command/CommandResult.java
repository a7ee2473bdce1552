package org.caureq.fleethub.command;

import org.caureq.fleethub.gateway.InboundFrame;

public record CommandResult(String commandId, String agentId, boolean success, String output,
                            String error, Integer exitCode, long durationMs) {

    public static CommandResult of(String agentId, InboundFrame.CommandResult reply, long durationMs) {
        return new CommandResult(reply.commandId(), agentId, reply.success(), reply.output(),
                reply.error(), reply.exitCode(), durationMs);
    }
}
