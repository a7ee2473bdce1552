package org.caureq.fleethub.error;

import java.time.Duration;
import java.util.Map;

public class CommandTimeoutException extends HubException {
    private final String commandId;

    public CommandTimeoutException(String commandId, Duration timeout) {
        super(ErrorCode.TIMEOUT, "command " + commandId + " timed out after " + timeout.toMillis() + " ms");
        this.commandId = commandId;
    }

    public String commandId() { return commandId; }

    @Override
    public Map<String, Object> details() {
        return Map.of("commandId", commandId);
    }
}
